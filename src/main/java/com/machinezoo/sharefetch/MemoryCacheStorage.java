// Part of Sharefetch
package com.machinezoo.sharefetch;

import java.util.*;
import java.util.concurrent.*;

/**
 * Default {@link CacheStorage} keeping entries in a {@link ConcurrentHashMap}.
 * Entries stay until deleted. There is no size limit.
 */
public class MemoryCacheStorage<K, V> implements CacheStorage<K, V> {
	private final Map<K, CacheEntry<V>> entries = new ConcurrentHashMap<>();
	@Override
	public boolean delete(K key) {
		return entries.remove(key) != null;
	}
	@Override
	public CacheEntry<V> get(K key) {
		return entries.get(key);
	}
	@Override
	public boolean has(K key) {
		return entries.containsKey(key);
	}
	@Override
	public MemoryCacheStorage<K, V> set(K key, CacheEntry<V> entry) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(entry);
		entries.put(key, entry);
		return this;
	}
	public int size() {
		return entries.size();
	}
	@Override
	public String toString() {
		return "MemoryCacheStorage(" + entries.size() + ")";
	}
}
