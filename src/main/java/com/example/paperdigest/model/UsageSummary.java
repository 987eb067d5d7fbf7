package com.example.paperdigest.model;

/**
 * Model usage of one run.
 *
 * @param calls            Model calls issued
 * @param fastTierTokens   Tokens consumed by the fast model
 * @param smartTierTokens  Tokens consumed by the stronger model
 * @param budgetExhausted  Whether the run hit its call or token ceiling
 */
public record UsageSummary(
        int calls,
        long fastTierTokens,
        long smartTierTokens,
        boolean budgetExhausted
) {
    public long totalTokens() {
        return fastTierTokens + smartTierTokens;
    }
}
