// Part of Sharefetch
package com.machinezoo.sharefetch;

import java.util.*;
import java.util.concurrent.*;

/**
 * Failure of a cache fallback or of a stream query.
 * <p>
 * All callers sharing one cache fetch receive the same {@code FetchException} instance,
 * wrapped in {@link CompletionException} by {@link CompletableFuture#join()}.
 * The original failure is available via {@link #getCause()}.
 */
public class FetchException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	private final transient Object key;
	/**
	 * Returns key of the failed fetch.
	 * 
	 * @return cache or stream key
	 */
	public Object key() {
		return key;
	}
	public FetchException(Object key, Throwable cause) {
		super("Fetch of " + key + " failed.", cause);
		Objects.requireNonNull(key);
		this.key = key;
	}
	/*
	 * Futures report failures wrapped in CompletionException or ExecutionException. Strip those first.
	 */
	static Throwable unwrap(Throwable exception) {
		while ((exception instanceof CompletionException || exception instanceof ExecutionException) && exception.getCause() != null)
			exception = exception.getCause();
		return exception;
	}
	static FetchException wrap(Object key, Throwable exception) {
		Throwable cause = unwrap(exception);
		if (cause instanceof FetchException)
			return (FetchException)cause;
		return new FetchException(key, cause);
	}
}
