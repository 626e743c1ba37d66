package fun.fengwk.afe.core.service.cache;

/**
 * Loads a value on cache miss.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface CacheLoader<T> {

    T load() throws Exception;

}
