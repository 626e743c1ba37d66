package fun.fengwk.afe.core.service.support;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Static hostname heuristics shared by tier selection and domain classification.
 *
 * @author fengwk
 */
public final class DomainHeuristics {

    private static final List<Pattern> KNOWN_STATIC_DOMAINS = List.of(
        Pattern.compile("\\.gov$"),
        Pattern.compile("\\.gov\\.\\w{2}$"),
        Pattern.compile("\\.edu$"),
        Pattern.compile("docs\\."),
        Pattern.compile("wiki"),
        Pattern.compile("github\\.io$"),
        Pattern.compile("readthedocs"),
        Pattern.compile("\\.org$"),
        Pattern.compile("blog\\.")
    );

    private static final List<Pattern> KNOWN_BROWSER_REQUIRED = List.of(
        Pattern.compile("twitter\\.com"),
        Pattern.compile("(^|\\.)x\\.com"),
        Pattern.compile("instagram\\.com"),
        Pattern.compile("facebook\\.com"),
        Pattern.compile("linkedin\\.com"),
        Pattern.compile("tiktok\\.com"),
        Pattern.compile("youtube\\.com"),
        Pattern.compile("reddit\\.com"),
        Pattern.compile("discord\\.com")
    );

    private DomainHeuristics() {
    }

    public static boolean isStaticDomain(String hostname) {
        return matchesAny(KNOWN_STATIC_DOMAINS, hostname);
    }

    public static boolean isBrowserRequired(String hostname) {
        return matchesAny(KNOWN_BROWSER_REQUIRED, hostname);
    }

    private static boolean matchesAny(List<Pattern> patterns, String hostname) {
        if (hostname == null || hostname.isEmpty()) {
            return false;
        }
        String normalized = hostname.toLowerCase(Locale.ROOT);
        for (Pattern pattern : patterns) {
            if (pattern.matcher(normalized).find()) {
                return true;
            }
        }
        return false;
    }

}
