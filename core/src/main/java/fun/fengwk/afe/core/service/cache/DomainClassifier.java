package fun.fengwk.afe.core.service.cache;

import fun.fengwk.afe.core.service.cache.model.DomainCategory;
import fun.fengwk.afe.core.service.support.DomainHeuristics;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps a hostname to a {@link DomainCategory} through ordered pattern rules.
 *
 * @author fengwk
 */
@Component
public class DomainClassifier {

    private static final List<Rule> RULES = List.of(
        rule("\\.gov(?:\\.[a-z]{2})?$", DomainCategory.STATIC_GOV),
        rule("\\.gob\\.[a-z]{2}$", DomainCategory.STATIC_GOV),

        rule("docs?\\.", DomainCategory.STATIC_DOCS),
        rule("readthedocs", DomainCategory.STATIC_DOCS),
        rule("\\.github\\.io$", DomainCategory.STATIC_DOCS),
        rule("developer\\.", DomainCategory.STATIC_DOCS),
        rule("devdocs", DomainCategory.STATIC_DOCS),

        rule("\\.edu(?:\\.[a-z]{2})?$", DomainCategory.STATIC_EDU),
        rule("\\.ac\\.[a-z]{2}$", DomainCategory.STATIC_EDU),

        rule("wiki", DomainCategory.STATIC_WIKI),
        rule("pedia", DomainCategory.STATIC_WIKI),

        rule("twitter\\.com|(^|\\.)x\\.com", DomainCategory.DYNAMIC_SOCIAL),
        rule("facebook\\.com|(^|\\.)fb\\.com", DomainCategory.DYNAMIC_SOCIAL),
        rule("instagram\\.com", DomainCategory.DYNAMIC_SOCIAL),
        rule("linkedin\\.com", DomainCategory.DYNAMIC_SOCIAL),
        rule("tiktok\\.com", DomainCategory.DYNAMIC_SOCIAL),
        rule("reddit\\.com", DomainCategory.DYNAMIC_SOCIAL),
        rule("discord\\.com", DomainCategory.DYNAMIC_SOCIAL),
        rule("threads\\.net", DomainCategory.DYNAMIC_SOCIAL),

        rule("news\\.", DomainCategory.DYNAMIC_NEWS),
        rule("\\.news$", DomainCategory.DYNAMIC_NEWS),
        rule("cnn\\.com|bbc\\.com|nytimes\\.com|theguardian\\.com", DomainCategory.DYNAMIC_NEWS),
        rule("reuters\\.com|apnews\\.com|bloomberg\\.com", DomainCategory.DYNAMIC_NEWS),

        rule("amazon\\.|ebay\\.|etsy\\.|shopify", DomainCategory.DYNAMIC_COMMERCE),
        rule("shop\\.|store\\.", DomainCategory.DYNAMIC_COMMERCE)
    );

    public DomainCategory classify(String hostname) {
        if (!StringUtils.hasText(hostname)) {
            return DomainCategory.DEFAULT;
        }
        String normalized = hostname.trim().toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(normalized).find()) {
                return rule.category();
            }
        }

        if (DomainHeuristics.isStaticDomain(normalized)) {
            return DomainCategory.STATIC_DEFAULT;
        }
        // Sites that need a real browser are almost always highly dynamic.
        if (DomainHeuristics.isBrowserRequired(normalized)) {
            return DomainCategory.DYNAMIC_SOCIAL;
        }
        return DomainCategory.DEFAULT;
    }

    private static Rule rule(String regex, DomainCategory category) {
        return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), category);
    }

    private record Rule(Pattern pattern, DomainCategory category) {
    }

}
