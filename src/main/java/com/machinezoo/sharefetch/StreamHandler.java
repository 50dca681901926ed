// Part of Sharefetch
package com.machinezoo.sharefetch;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.sharefetch.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/*
 * Refresh pipeline of one stream: throttle, query, broadcast, until teardown.
 *
 * Throttling is leading-edge. The first update opens a window and runs the query.
 * Updates arriving while the window is open are dropped, not queued.
 * Queries may overlap. Their results are emitted in completion order, which means "last value wins".
 */
/**
 * Live feed registered in {@link StreamRegistry}.
 * Handler can be kept by the application to request updates or to clear the stream without going through the registry.
 *
 * @param <P>
 *            type of update payload passed to the query
 * @param <T>
 *            type of values in the stream
 *
 * @see StreamRegistry#registerStream(Object, Function, Duration)
 */
@StubDocs
public class StreamHandler<P, T> {
	private static final Logger logger = LoggerFactory.getLogger(StreamHandler.class);
	private static final Counter updateCount = Metrics.counter("sharefetch.stream.updates");
	private static final Counter dropCount = Metrics.counter("sharefetch.stream.drops");
	private static final Counter queryCount = Metrics.counter("sharefetch.stream.queries");
	private static final Counter failureCount = Metrics.counter("sharefetch.stream.failures");
	private static final Counter emissionCount = Metrics.counter("sharefetch.stream.emissions");
	private final Object key;
	public Object key() {
		return key;
	}
	private final Function<P, CompletableFuture<T>> query;
	private final Duration throttle;
	public Duration throttle() {
		return throttle;
	}
	private final java.time.Clock clock;
	private final DiagnosticLog log;
	private final ReplayBroadcast<T> stream = new ReplayBroadcast<>();
	/**
	 * Returns the broadcast carrying values of this stream.
	 */
	public ReplayBroadcast<T> stream() {
		return stream;
	}
	/*
	 * Guarded by this.
	 */
	private Instant window;
	private boolean cleared;
	/*
	 * Set by the registry before the handler is published. Removes the handler from the registry after teardown.
	 */
	volatile Runnable detach;
	StreamHandler(Object key, Function<P, CompletableFuture<T>> query, Duration throttle, java.time.Clock clock, DiagnosticLog log) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(query);
		Objects.requireNonNull(throttle);
		Objects.requireNonNull(clock);
		Objects.requireNonNull(log);
		if (throttle.isNegative())
			throw new IllegalArgumentException("Throttle window cannot be negative.");
		this.key = key;
		this.query = query;
		this.throttle = throttle;
		this.clock = clock;
		this.log = log;
		OwnerTrace.of(this)
			.alias("handler")
			.tag("key", key);
		OwnerTrace.of(stream).parent(this);
	}
	/**
	 * Requests refresh of the stream.
	 * The query runs only if no other update passed during the last throttle window and the stream is not cleared.
	 * Query is never invoked under a lock, so it can run concurrently with {@link #clear()}.
	 * Values of queries that complete after teardown are discarded.
	 *
	 * @param payload
	 *            argument for the query, may be {@code null}
	 * @return {@code true} if the query was started, {@code false} if the update was dropped
	 */
	public boolean update(P payload) {
		updateCount.increment();
		synchronized (this) {
			if (cleared)
				return false;
			Instant now = clock.instant();
			if (window != null && Duration.between(window, now).compareTo(throttle) < 0) {
				dropCount.increment();
				log.debug("throttled", key);
				return false;
			}
			window = now;
		}
		/*
		 * Teardown may have happened since the window was taken.
		 */
		if (cleared())
			return false;
		query(payload);
		return true;
	}
	private void query(P payload) {
		queryCount.increment();
		log.debug("query", key, payload);
		CompletableFuture<T> future;
		try {
			future = query.apply(payload);
			if (future == null)
				future = CompletableFuture.failedFuture(new NullPointerException("Query returned null future."));
		} catch (Throwable ex) {
			future = CompletableFuture.failedFuture(ex);
		}
		future.whenComplete((value, exception) -> {
			if (exception != null) {
				/*
				 * Stream stays alive. Applications that need to see failures encode them in the value type.
				 */
				failureCount.increment();
				FetchException failure = FetchException.wrap(key, exception);
				logger.debug("Query of stream {} failed.", key, failure);
				log.debug("failed", key, failure.getCause());
			} else if (stream.emit(value)) {
				emissionCount.increment();
				log.debug("emit", key, value);
			}
		});
	}
	/**
	 * Tears down the stream. Subscribers are completed, queries still running are ignored, and further updates are dropped.
	 * Handler is also removed from its registry.
	 *
	 * @return {@code false} if the stream was already cleared
	 */
	public boolean clear() {
		synchronized (this) {
			if (cleared)
				return false;
			cleared = true;
		}
		stream.complete();
		Runnable detach = this.detach;
		if (detach != null)
			detach.run();
		log.debug("cleared", key);
		return true;
	}
	public synchronized boolean cleared() {
		return cleared;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + stream.latest();
	}
}
