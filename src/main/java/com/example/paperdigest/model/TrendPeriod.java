package com.example.paperdigest.model;

public enum TrendPeriod {
    DAY, WEEK, MONTH
}
