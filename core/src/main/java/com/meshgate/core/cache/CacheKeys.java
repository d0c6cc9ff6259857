package com.meshgate.core.cache;

/**
 * Keyspace for cached backend responses.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefix {@code gateway:cache:} avoids collisions with other tenants of the store</li>
 *   <li>Entries always carry a TTL (the owning service's cache TTL)</li>
 * </ul>
 * </p>
 */
public final class CacheKeys {
    private CacheKeys() {
    }

    private static final String PREFIX = "gateway:cache:";

    /**
     * Response key: {@code gateway:cache:{service}:{method}:{uri}}
     * <p>
     * <b>Type:</b> String (JSON-serialized response)
     * <br>
     * <b>TTL:</b> the service's cache TTL
     * </p>
     *
     * @param serviceName owning service
     * @param method      HTTP method
     * @param uri         request path including the query string
     * @return cache key
     */
    public static String response(String serviceName, String method, String uri) {
        return PREFIX + serviceName + ":" + method.toUpperCase() + ":" + uri;
    }
}
