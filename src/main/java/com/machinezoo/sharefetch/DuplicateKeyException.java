// Part of Sharefetch
package com.machinezoo.sharefetch;

import java.util.*;

/**
 * Thrown by {@link StreamRegistry#registerStream(Object, java.util.function.Function)} when the key already has a live stream.
 * The existing stream is left untouched.
 */
public class DuplicateKeyException extends IllegalStateException {
	private static final long serialVersionUID = 1L;
	private final transient Object key;
	public Object key() {
		return key;
	}
	public DuplicateKeyException(Object key) {
		super("Stream " + key + " is already registered.");
		Objects.requireNonNull(key);
		this.key = key;
	}
}
