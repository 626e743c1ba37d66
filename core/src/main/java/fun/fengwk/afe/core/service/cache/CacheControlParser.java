package fun.fengwk.afe.core.service.cache;

import fun.fengwk.afe.core.service.cache.model.CacheControlDirectives;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Parses Cache-Control header values.
 *
 * @author fengwk
 */
public final class CacheControlParser {

    private CacheControlParser() {
    }

    /**
     * Parse a Cache-Control header, e.g. {@code max-age=3600, must-revalidate}.
     * Unknown directives and invalid numbers are ignored.
     */
    public static CacheControlDirectives parse(String header) {
        if (!StringUtils.hasText(header)) {
            return CacheControlDirectives.EMPTY;
        }

        CacheControlDirectives.CacheControlDirectivesBuilder builder = CacheControlDirectives.builder();
        for (String rawPart : header.toLowerCase(Locale.ROOT).split(",")) {
            String part = rawPart.trim();
            if (part.startsWith("max-age=")) {
                builder.maxAge(parseSeconds(part.substring("max-age=".length())));
            } else if (part.startsWith("s-maxage=")) {
                builder.sMaxAge(parseSeconds(part.substring("s-maxage=".length())));
            } else if (part.startsWith("stale-while-revalidate=")) {
                builder.staleWhileRevalidate(parseSeconds(part.substring("stale-while-revalidate=".length())));
            } else if (part.startsWith("stale-if-error=")) {
                builder.staleIfError(parseSeconds(part.substring("stale-if-error=".length())));
            } else if (part.equals("must-revalidate")) {
                builder.mustRevalidate(true);
            } else if (part.equals("no-cache")) {
                builder.noCache(true);
            } else if (part.equals("no-store")) {
                builder.noStore(true);
            } else if (part.equals("private")) {
                builder.isPrivate(true);
            } else if (part.equals("public")) {
                builder.isPublic(true);
            }
        }
        return builder.build();
    }

    private static Long parseSeconds(String raw) {
        String value = raw.trim();
        if (value.startsWith("\"") && value.endsWith("\"") && value.length() > 1) {
            value = value.substring(1, value.length() - 1);
        }
        try {
            long seconds = Long.parseLong(value);
            return seconds >= 0 ? seconds : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

}
