package fun.fengwk.afe.core.service.fetch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Content derived from a page.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedContent {

    private String title;
    private String text;
    private String markdown;

    /**
     * Structured payload when the tier found one, e.g. framework data or json-ld.
     */
    private Map<String, Object> structured;

}
