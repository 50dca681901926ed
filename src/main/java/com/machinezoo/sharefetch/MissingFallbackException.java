// Part of Sharefetch
package com.machinezoo.sharefetch;

import java.util.*;

/**
 * Signals that {@link SingleFlightCache#get(Object)} found neither a fresh entry nor a fetch in progress
 * and no fallback was given to start one.
 * 
 * @see SingleFlightCache#get(Object, java.util.function.Supplier)
 */
public class MissingFallbackException extends NoSuchElementException {
	private static final long serialVersionUID = 1L;
	private final transient Object key;
	/**
	 * Returns the key that was looked up.
	 * 
	 * @return cache key, never {@code null}
	 */
	public Object key() {
		return key;
	}
	public MissingFallbackException(Object key) {
		super("No fresh value for " + key + " and no fallback to fetch it.");
		Objects.requireNonNull(key);
		this.key = key;
	}
}
