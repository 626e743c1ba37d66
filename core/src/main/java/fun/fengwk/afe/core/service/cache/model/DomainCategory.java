package fun.fengwk.afe.core.service.cache.model;

/**
 * Domain category used for TTL calculation, with its TTL multiplier.
 *
 * @author fengwk
 */
public enum DomainCategory {

    /**
     * Government sites, very stable content.
     */
    STATIC_GOV("static_gov", 4.0),

    STATIC_DOCS("static_docs", 3.0),

    STATIC_EDU("static_edu", 3.0),

    STATIC_WIKI("static_wiki", 2.0),

    /**
     * Hosts matching the generic static heuristics.
     */
    STATIC_DEFAULT("static_default", 2.0),

    /**
     * Social media, very dynamic content.
     */
    DYNAMIC_SOCIAL("dynamic_social", 0.25),

    DYNAMIC_NEWS("dynamic_news", 0.5),

    DYNAMIC_COMMERCE("dynamic_commerce", 0.75),

    DEFAULT("default", 1.0);

    private final String value;
    private final double ttlMultiplier;

    DomainCategory(String value, double ttlMultiplier) {
        this.value = value;
        this.ttlMultiplier = ttlMultiplier;
    }

    public String getValue() {
        return value;
    }

    public double getTtlMultiplier() {
        return ttlMultiplier;
    }

}
