package io.github.cyfko.prereq.core.config;

/**
 * Configuration of the compiled-prerequisites cache.
 * <p>
 * Catalog prerequisite strings repeat heavily across courses and terms, so compiled results are kept
 * in a bounded LRU cache keyed by the trimmed raw text.
 * </p>
 *
 * <pre>{@code
 * CachePolicy.defaults();      // enabled, 1000 entries
 * CachePolicy.relaxed();       // enabled, 5000 entries (full-catalog crawls)
 * CachePolicy.none();          // disabled
 * CachePolicy.custom(250);     // enabled, 250 entries
 * }</pre>
 *
 * @param cacheEnabled whether compiled results are cached
 * @param cacheSize    maximum number of cached entries
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    public static CachePolicy relaxed() {
        return new CachePolicy(true, 5000);
    }

    /**
     * @return a policy with caching disabled (size 1, unused)
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
