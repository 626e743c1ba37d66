package fun.fengwk.afe.core.utils;

import org.springframework.util.StringUtils;

import java.net.URI;
import java.util.Locale;

/**
 * Lenient url helpers, never throw on malformed input.
 *
 * @author fengwk
 */
public final class UrlUtils {

    private UrlUtils() {
    }

    /**
     * Parse an absolute url.
     *
     * @return parsed uri with a host, or null if the url is not a valid absolute url
     */
    public static URI tryParse(String url) {
        if (!StringUtils.hasText(url)) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                return null;
            }
            return uri;
        } catch (Exception ex) {
            return null;
        }
    }

    /**
     * Lower-cased hostname of the url, or null.
     */
    public static String extractHostname(String url) {
        URI uri = tryParse(url);
        return uri == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
    }

    /**
     * Lower-cased hostname, accepting bare host keys like {@code example.com/path}.
     */
    public static String extractHostnameLenient(String key) {
        if (!StringUtils.hasText(key)) {
            return null;
        }
        String candidate = key.startsWith("http") ? key : "https://" + key;
        return extractHostname(candidate);
    }

    /**
     * Whether {@code hostname} equals {@code domain} or is one of its subdomains.
     */
    public static boolean isSameOrSubdomain(String hostname, String domain) {
        if (hostname == null || domain == null) {
            return false;
        }
        String normalizedHost = hostname.toLowerCase(Locale.ROOT);
        String normalizedDomain = domain.toLowerCase(Locale.ROOT);
        return normalizedHost.equals(normalizedDomain) || normalizedHost.endsWith("." + normalizedDomain);
    }

}
