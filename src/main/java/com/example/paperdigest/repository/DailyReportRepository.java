package com.example.paperdigest.repository;

import com.example.paperdigest.model.DailyReport;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;

/**
 * Daily reports keyed by their ISO date (collection daily_reports).
 */
public interface DailyReportRepository extends MongoRepository<DailyReport, String> {

    @Query(value = "{ '_id': { $gte: ?0, $lte: ?1 } }", sort = "{ '_id': 1 }")
    List<DailyReport> findRange(String fromDate, String toDate);
}
