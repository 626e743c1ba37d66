package fun.fengwk.afe.core.service.fetch.support;

import fun.fengwk.afe.core.service.fetch.model.TierExtraction;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether tier output is complete enough to accept.
 *
 * @author fengwk
 */
@Component
public class ContentValidator {

    static final int INCOMPLETE_MARKER_TEXT_LENGTH = 500;
    static final int NO_CONTENT_MARKER_TEXT_LENGTH = 1000;

    private static final List<String> LOADING_TEXT_MARKERS = List.of(
        "loading...",
        "please wait"
    );

    private static final List<String> LOADING_CLASS_SELECTORS = List.of(
        "[class^=skeleton]",
        "[class^=loading]",
        "[class^=spinner]"
    );

    private static final List<String> ROOT_CONTAINER_SELECTORS = List.of(
        "div#root",
        "div#app",
        "div#__next"
    );

    private static final String CONTENT_MARKER_SELECTOR = "article, main, h1, p, [class^=content], [id^=content]";

    /**
     * Validate tier output.
     *
     * @param minContentLength minimum accepted text length
     */
    public ValidationResult validate(TierExtraction extraction, int minContentLength) {
        String html = extraction.getHtml() == null ? "" : extraction.getHtml();
        String text = extraction.getContent() == null || extraction.getContent().getText() == null
            ? "" : extraction.getContent().getText();
        int textLength = text.length();

        if (textLength < minContentLength) {
            return ValidationResult.reject("Content too short: " + textLength + " < " + minContentLength);
        }

        Document document = Jsoup.parse(html);
        if (textLength < INCOMPLETE_MARKER_TEXT_LENGTH) {
            String marker = findIncompleteMarker(html, document);
            if (marker != null) {
                return ValidationResult.reject("Found incomplete marker: " + marker);
            }
        }

        if (textLength < NO_CONTENT_MARKER_TEXT_LENGTH && document.selectFirst(CONTENT_MARKER_SELECTOR) == null) {
            return ValidationResult.reject("No content markers found and content is short");
        }

        return ValidationResult.VALID;
    }

    private String findIncompleteMarker(String html, Document document) {
        String lowerHtml = html.toLowerCase(Locale.ROOT);
        for (String marker : LOADING_TEXT_MARKERS) {
            if (lowerHtml.contains(marker)) {
                return marker;
            }
        }
        for (String selector : ROOT_CONTAINER_SELECTORS) {
            Element container = document.selectFirst(selector);
            if (container != null && container.childrenSize() == 0 && container.text().isBlank()) {
                return "empty " + selector;
            }
        }
        for (String selector : LOADING_CLASS_SELECTORS) {
            if (document.selectFirst(selector) != null) {
                return selector;
            }
        }
        return null;
    }

    /**
     * Validation verdict, reason is null when valid.
     */
    public record ValidationResult(boolean valid, String reason) {

        public static final ValidationResult VALID = new ValidationResult(true, null);

        public static ValidationResult reject(String reason) {
            return new ValidationResult(false, reason);
        }

    }

}
