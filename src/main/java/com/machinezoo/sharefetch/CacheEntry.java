// Part of Sharefetch
package com.machinezoo.sharefetch;

import java.time.*;
import java.util.*;

/**
 * Cached value along with the time it was stored.
 * Entries are immutable. Storing a new value replaces the entry.
 * 
 * @param <V>
 *            type of the cached value
 */
public class CacheEntry<V> {
	private final V value;
	public V value() {
		return value;
	}
	private final Instant storedAt;
	public Instant storedAt() {
		return storedAt;
	}
	public CacheEntry(V value, Instant storedAt) {
		Objects.requireNonNull(storedAt);
		this.value = value;
		this.storedAt = storedAt;
	}
	public Duration age(Instant now) {
		return Duration.between(storedAt, now);
	}
	/*
	 * Entry expires exactly when its age reaches ttl. Entry aged ttl minus one tick is still fresh.
	 */
	public boolean expired(Instant now, Duration ttl) {
		return age(now).compareTo(ttl) >= 0;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof CacheEntry))
			return false;
		CacheEntry<?> other = (CacheEntry<?>)obj;
		return Objects.equals(value, other.value) && storedAt.equals(other.storedAt);
	}
	@Override
	public int hashCode() {
		return Objects.hash(value, storedAt);
	}
	@Override
	public String toString() {
		return value + " @ " + storedAt;
	}
}
