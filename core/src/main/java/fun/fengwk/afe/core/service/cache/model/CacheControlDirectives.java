package fun.fengwk.afe.core.service.cache.model;

import lombok.Builder;
import lombok.Value;

/**
 * Parsed Cache-Control directives. Numeric values are in seconds, null when absent.
 *
 * @author fengwk
 */
@Value
@Builder
public class CacheControlDirectives {

    public static final CacheControlDirectives EMPTY = CacheControlDirectives.builder().build();

    Long maxAge;
    Long sMaxAge;
    Long staleWhileRevalidate;
    Long staleIfError;
    boolean mustRevalidate;
    boolean noCache;
    boolean noStore;
    boolean isPrivate;
    boolean isPublic;

}
