package fun.fengwk.afe.core.service.fetch.model;

import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Extraction tiers in increasing cost order.
 *
 * @author fengwk
 */
public enum RenderTier {

    /**
     * Embedded framework data, structured data, predicted api or static html.
     */
    STRUCTURAL("structural"),

    /**
     * Http fetch with a constrained script sandbox.
     */
    LIGHTWEIGHT_SCRIPT("lightweight-script"),

    /**
     * Real browser engine, optional.
     */
    FULL_RENDER("full-render");

    private final String value;

    RenderTier(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Next more expensive tier, full-render is its own successor.
     */
    public RenderTier next() {
        return switch (this) {
            case STRUCTURAL -> LIGHTWEIGHT_SCRIPT;
            case LIGHTWEIGHT_SCRIPT, FULL_RENDER -> FULL_RENDER;
        };
    }

    /**
     * Resolve a tier name, accepting the legacy names {@code static}, {@code intelligence},
     * {@code lightweight} and {@code playwright}.
     */
    public static RenderTier fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException("tier is blank");
        }
        String normalized = value.trim();
        for (RenderTier tier : values()) {
            if (tier.value.equalsIgnoreCase(normalized) || tier.name().equalsIgnoreCase(normalized)) {
                return tier;
            }
        }
        return switch (normalized.toLowerCase(Locale.ROOT)) {
            case "static", "intelligence" -> STRUCTURAL;
            case "lightweight" -> LIGHTWEIGHT_SCRIPT;
            case "playwright" -> FULL_RENDER;
            default -> throw new IllegalArgumentException("unsupported tier: " + value);
        };
    }

}
