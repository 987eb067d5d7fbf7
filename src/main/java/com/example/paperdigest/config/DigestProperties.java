package com.example.paperdigest.config;

import com.example.paperdigest.model.ResolutionMode;
import com.example.paperdigest.model.RetryPolicy;
import com.example.paperdigest.model.ReviewMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Configuration properties for the digest pipeline. Immutable; each component reads the
 * section it needs.
 */
@ConfigurationProperties(prefix = "digest")
public record DigestProperties(
        Search search,
        Filter filter,
        Extraction extraction,
        Trend trend,
        Spotlight spotlight,
        Run run
) {

    /**
     * Upstream search and period resolution.
     *
     * @param categories       Categories to harvest (e.g. cs.CL)
     * @param mode             LATEST_UPDATE or FIXED_WINDOW
     * @param fixedWindow      Window length for FIXED_WINDOW
     * @param lookbackDays     Maximum days probed in LATEST_UPDATE
     * @param maxTotalAttempts Ceiling on search attempts across all probes of one resolution
     * @param timezone         Zone used for calendar days
     * @param maxResults       Upstream result cap per query
     * @param keywordsInclude  Interest terms (empty = everything is relevant)
     * @param keywordsExclude  Terms that force a candidate out
     * @param baseUrl          arXiv export API base URL
     * @param requestTimeout   Read timeout of one search request
     * @param retry            Per-probe retry policy
     */
    public record Search(
            List<String> categories,
            ResolutionMode mode,
            Duration fixedWindow,
            int lookbackDays,
            int maxTotalAttempts,
            String timezone,
            int maxResults,
            List<String> keywordsInclude,
            List<String> keywordsExclude,
            String baseUrl,
            Duration requestTimeout,
            Retry retry
    ) {
        public Search {
            categories = categories != null ? List.copyOf(categories) : List.of();
            keywordsInclude = keywordsInclude != null ? List.copyOf(keywordsInclude) : List.of();
            keywordsExclude = keywordsExclude != null ? List.copyOf(keywordsExclude) : List.of();
        }

        public ZoneId zone() {
            return ZoneId.of(timezone != null ? timezone : "UTC");
        }
    }

    /**
     * Relevance filtering.
     *
     * @param reviewMode       FAST_ONLY or FAST_THEN_REVIEW
     * @param threshold        Minimum score for selection
     * @param maxSelected      Selection cap
     * @param reviewBand       Scores within threshold ± band go to stage-2 review
     * @param concurrency      Parallel classification calls
     * @param maxAttempts      Attempts per classification (schema repair included)
     * @param includePrefilter Skip the model for candidates matching no include term
     */
    public record Filter(
            ReviewMode reviewMode,
            int threshold,
            int maxSelected,
            int reviewBand,
            int concurrency,
            int maxAttempts,
            boolean includePrefilter
    ) {}

    /**
     * Structured extraction.
     *
     * @param workers Worker pool size
     * @param retry   Per-item retry policy
     */
    public record Extraction(int workers, Retry retry) {}

    public enum WindowMode { ROLLING, CALENDAR }

    /**
     * Trend rollups.
     *
     * @param enableWeekly  Compute the weekly trend
     * @param enableMonthly Compute the monthly trend
     * @param windowMode    ROLLING (last N days) or CALENDAR (ISO week / calendar month)
     * @param weeklyDays    Rolling weekly window length
     * @param monthlyDays   Rolling monthly window length
     * @param topK          Keywords kept per trend
     */
    public record Trend(
            boolean enableWeekly,
            boolean enableMonthly,
            WindowMode windowMode,
            int weeklyDays,
            int monthlyDays,
            int topK
    ) {}

    public enum Normalization { LOG, LINEAR }

    /**
     * Weight and normalization of one source metric.
     *
     * @param source        Source identifier
     * @param metric        Metric identifier
     * @param weight        Relative weight (renormalized over available metrics)
     * @param normalization LOG or LINEAR
     * @param scale         Value that maps to 1.0
     */
    public record MetricRule(
            String source,
            String metric,
            double weight,
            Normalization normalization,
            double scale
    ) {}

    /**
     * Attention spotlight.
     *
     * @param enabled      Run the spotlight stage
     * @param recentDays   Only papers published this recently are eligible
     * @param threshold    Minimum attention score
     * @param maxItems     Spotlight cap
     * @param fetchTimeout Timeout of one signal fetch
     * @param concurrency  Parallel signal fetches
     * @param sources      Enabled source identifiers
     * @param metrics      Metric weights and normalization rules
     * @param semanticScholarUrl Semantic Scholar Graph API base URL
     * @param openAlexUrl  OpenAlex API base URL
     * @param cacheSize    Maximum cached (paper, source, day) entries
     */
    public record Spotlight(
            boolean enabled,
            int recentDays,
            int threshold,
            int maxItems,
            Duration fetchTimeout,
            int concurrency,
            List<String> sources,
            List<MetricRule> metrics,
            String semanticScholarUrl,
            String openAlexUrl,
            long cacheSize
    ) {
        public Spotlight {
            sources = sources != null ? List.copyOf(sources) : List.of();
            metrics = metrics != null ? List.copyOf(metrics) : List.of();
        }
    }

    /**
     * Whole-run settings.
     *
     * @param wallClockBudget Deadline for one run; in-flight work is cancelled when it expires
     * @param maxCalls        Model call ceiling per run
     * @param maxTokens       Model token ceiling per run
     * @param deterministic   Request temperature 0 from the models
     * @param domain          Domain label echoed in the report
     * @param language        Language of narratives and localized titles
     * @param inferenceRetry  Transport retry policy of the model adapter
     */
    public record Run(
            Duration wallClockBudget,
            int maxCalls,
            long maxTokens,
            boolean deterministic,
            String domain,
            String language,
            Retry inferenceRetry
    ) {}

    public record Retry(int maxAttempts, Duration baseDelay, Duration maxDelay, Duration jitter) {

        public RetryPolicy toPolicy() {
            return new RetryPolicy(Math.max(1, maxAttempts), baseDelay, maxDelay, jitter);
        }
    }
}
