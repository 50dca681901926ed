// Part of Sharefetch
package com.machinezoo.sharefetch;

/**
 * Backing store of {@link SingleFlightCache}.
 * <p>
 * {@link SingleFlightCache} only calls these methods while holding its own lock,
 * so implementations need not coordinate compound operations, but they must be safe to read from other threads.
 * Implementations must not expire entries on their own. Expiry is decided by the cache.
 * 
 * @param <K>
 *            key type
 * @param <V>
 *            value type
 * 
 * @see MemoryCacheStorage
 */
public interface CacheStorage<K, V> {
	/**
	 * Removes the entry.
	 * 
	 * @return {@code true} if there was an entry to remove
	 */
	boolean delete(K key);
	/**
	 * Returns the entry or {@code null} if there is none.
	 */
	CacheEntry<V> get(K key);
	boolean has(K key);
	/**
	 * Stores the entry, replacing any previous one.
	 * 
	 * @return {@code this} (fluent method)
	 */
	CacheStorage<K, V> set(K key, CacheEntry<V> entry);
}
