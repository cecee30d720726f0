package com.lpzapper.common.cache;

/**
 * Loads a value for {@link TtlCache}. May throw; the cache decides whether to fall back to a stale value.
 */
@FunctionalInterface
public interface Fetcher<T> {

    T fetch() throws Exception;
}
