package landscape.pipeline.model;

import java.util.Locale;

/**
 * The nine pipeline phases, in their canonical execution order.
 * Each phase carries its external key and the queue lane its items flow through.
 */
public enum PhaseName {
    /** Search volume and CPC lookups per keyword */
    KEYWORD_METRICS("keyword_metrics", "keywords"),
    /** SERP results per keyword x region x content type */
    SERP_COLLECTION("serp_collection", "serp"),
    /** Firmographic enrichment per result domain */
    COMPANY_ENRICHMENT("company_enrichment", "enrichment"),
    /** Video metadata per video result */
    VIDEO_ENRICHMENT("video_enrichment", "enrichment"),
    /** Page content fetch per organic URL */
    CONTENT_SCRAPING("content_scraping", "scraping"),
    /** LLM analysis per scraped page */
    CONTENT_ANALYSIS("content_analysis", "analysis"),
    /** Score aggregation per landscape */
    DSI_CALCULATION("dsi_calculation", "scoring"),
    /** Point-in-time snapshot of calculated scores */
    HISTORICAL_SNAPSHOT("historical_snapshot", "scoring"),
    /** Landscape level score roll-up */
    LANDSCAPE_DSI("landscape_dsi", "scoring");

    private final String key;
    private final String defaultLane;

    PhaseName(String key, String defaultLane) {
        this.key = key;
        this.defaultLane = defaultLane;
    }

    public String key() {
        return key;
    }

    public String defaultLane() {
        return defaultLane;
    }

    /**
     * Parse either the enum constant name or the snake_case key.
     */
    public static PhaseName fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("phase name is required");
        }
        String normalized = value.trim();
        for (PhaseName phase : values()) {
            if (phase.key.equalsIgnoreCase(normalized) || phase.name().equalsIgnoreCase(normalized)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + value.toLowerCase(Locale.ROOT));
    }
}
