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
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/**
 * Asynchronous cache that runs at most one fetch per key at a time.
 * <p>
 * {@link #get(Object, Supplier)} resolves the key in this order:
 * <ol>
 * <li>fresh cached value, returned as an already completed future,</li>
 * <li>fetch already in progress for the key, whose outcome is shared with the caller,</li>
 * <li>new fetch started by calling the fallback,</li>
 * <li>failure with {@link MissingFallbackException} if there is no fallback.</li>
 * </ol>
 * All callers that join one fetch observe the same value or the same {@link FetchException}.
 * Failures are never cached. Once a fetch fails, the next call with a fallback starts a new fetch.
 * <p>
 * Entries are not expired in the background. Stale entries are dropped when {@link #get(Object)} finds them
 * or when the application calls {@link #collect(Object)}.
 * This matters for caches whose keys include request parameters, because such caches grow without bound otherwise.
 * <p>
 * {@code SingleFlightCache} is thread-safe. The whole resolution above is atomic,
 * so two threads can never both start a fetch for the same key.
 * Fallbacks and completion callbacks run outside of the cache's lock.
 *
 * @param <K>
 *            key type
 * @param <V>
 *            type of cached values
 *
 * @see CacheStorage
 * @see StreamRegistry
 */
@DraftDocs("examples of key design")
public class SingleFlightCache<K, V> {
	/**
	 * Default time-to-live of cached values: 5 minutes.
	 */
	public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
	private static final Logger logger = LoggerFactory.getLogger(SingleFlightCache.class);
	private static final Counter hitCount = Metrics.counter("sharefetch.cache.hits");
	private static final Counter joinCount = Metrics.counter("sharefetch.cache.joins");
	private static final Counter fetchCount = Metrics.counter("sharefetch.cache.fetches");
	private static final Counter failureCount = Metrics.counter("sharefetch.cache.failures");
	private static final Timer fetchTimer = Metrics.timer("sharefetch.cache.fetch.time");
	private final CacheStorage<K, V> storage;
	/*
	 * Key is present here if and only if a fetch for it is running. Guarded by this.
	 */
	private final Map<K, CompletableFuture<V>> flights = new HashMap<>();
	private volatile Duration ttl = DEFAULT_TTL;
	/**
	 * Returns time-to-live applied when none is given to {@link #get(Object, Supplier, Duration)} or {@link #collect(Object, Duration)}.
	 *
	 * @return default time-to-live, {@link #DEFAULT_TTL} unless configured otherwise
	 */
	public Duration ttl() {
		return ttl;
	}
	/**
	 * Configures default time-to-live.
	 *
	 * @param ttl
	 *            non-negative duration
	 * @return {@code this} (fluent method)
	 */
	public SingleFlightCache<K, V> ttl(Duration ttl) {
		this.ttl = checkTtl(ttl);
		return this;
	}
	private volatile java.time.Clock clock = java.time.Clock.systemUTC();
	public java.time.Clock clock() {
		return clock;
	}
	public SingleFlightCache<K, V> clock(java.time.Clock clock) {
		Objects.requireNonNull(clock);
		this.clock = clock;
		return this;
	}
	private volatile DiagnosticLog log = new DiagnosticLog("[cache]").level(DiagnosticLog.Level.NONE);
	public DiagnosticLog log() {
		return log;
	}
	public SingleFlightCache<K, V> log(DiagnosticLog log) {
		Objects.requireNonNull(log);
		this.log = log;
		return this;
	}
	public SingleFlightCache(CacheStorage<K, V> storage) {
		Objects.requireNonNull(storage);
		this.storage = storage;
		OwnerTrace.of(this).alias("cache");
	}
	public SingleFlightCache() {
		this(new MemoryCacheStorage<>());
	}
	private static Duration checkTtl(Duration ttl) {
		Objects.requireNonNull(ttl);
		if (ttl.isNegative())
			throw new IllegalArgumentException("Time-to-live cannot be negative.");
		return ttl;
	}
	/**
	 * Returns fresh cached value or joins fetch in progress. Never starts a new fetch.
	 *
	 * @param key
	 *            cache key
	 * @return future of the value, failed with {@link MissingFallbackException} if there is neither fresh value nor running fetch
	 */
	public CompletableFuture<V> get(K key) {
		return get(key, null, ttl);
	}
	/**
	 * Returns fresh cached value, joins fetch in progress, or starts a new fetch using the fallback.
	 *
	 * @param key
	 *            cache key
	 * @param fallback
	 *            fetch to start if the key is neither cached nor being fetched, may be {@code null}
	 * @return future of the value
	 *
	 * @see #get(Object, Supplier, Duration)
	 */
	public CompletableFuture<V> get(K key, Supplier<CompletableFuture<V>> fallback) {
		return get(key, fallback, ttl);
	}
	/**
	 * Returns fresh cached value, joins fetch in progress, or starts a new fetch using the fallback.
	 * <p>
	 * Cached value is fresh if it is younger than {@code ttl}. Value exactly {@code ttl} old is expired and it is dropped.
	 * <p>
	 * Fallback is invoked only after the fetch has been registered, so that concurrent callers join it.
	 * It is invoked on the calling thread. Exceptions thrown by the fallback and {@code null} futures count as failed fetches.
	 * <p>
	 * Every call returns its own future. Cancelling it does not affect other callers or the fetch.
	 *
	 * @param key
	 *            cache key
	 * @param fallback
	 *            fetch to start if the key is neither cached nor being fetched, may be {@code null}
	 * @param ttl
	 *            maximum age of cached value to accept
	 * @return future of the value that fails with {@link FetchException} if the fetch fails
	 *         or with {@link MissingFallbackException} if there is nothing to return and no fallback
	 */
	public CompletableFuture<V> get(K key, Supplier<CompletableFuture<V>> fallback, Duration ttl) {
		Objects.requireNonNull(key);
		checkTtl(ttl);
		PostLockQueue postlock = new PostLockQueue(this);
		return postlock.eval(() -> {
			CacheEntry<V> cached = fresh(key, ttl);
			if (cached != null) {
				hitCount.increment();
				postlock.post(() -> log.debug("hit", key));
				return CompletableFuture.completedFuture(cached.value());
			}
			CompletableFuture<V> joined = flights.get(key);
			if (joined != null) {
				joinCount.increment();
				postlock.post(() -> log.debug("join", key));
				return joined.copy();
			}
			if (fallback == null)
				return CompletableFuture.failedFuture(new MissingFallbackException(key));
			CompletableFuture<V> flight = new CompletableFuture<>();
			flights.put(key, flight);
			postlock.post(() -> fetch(key, fallback, flight));
			return flight.copy();
		});
	}
	private CacheEntry<V> fresh(K key, Duration ttl) {
		CacheEntry<V> cached = storage.get(key);
		if (cached == null)
			return null;
		if (cached.expired(clock.instant(), ttl)) {
			storage.delete(key);
			return null;
		}
		return cached;
	}
	private void fetch(K key, Supplier<CompletableFuture<V>> fallback, CompletableFuture<V> flight) {
		fetchCount.increment();
		log.debug("fetch", key);
		Timer.Sample sample = Timer.start();
		Span span = GlobalTracer.get().buildSpan("sharefetch.fetch")
			.withTag("component", "sharefetch")
			.withTag("key", key.toString())
			.start();
		OwnerTrace.of(this).fill(span);
		CompletableFuture<V> source;
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			source = fallback.get();
			if (source == null)
				source = CompletableFuture.failedFuture(new NullPointerException("Fallback returned null future."));
		} catch (Throwable ex) {
			source = CompletableFuture.failedFuture(ex);
		}
		source.whenComplete((value, exception) -> {
			sample.stop(fetchTimer);
			if (exception != null) {
				io.opentracing.tag.Tags.ERROR.set(span, true);
				span.finish();
				fail(key, flight, exception);
			} else {
				span.finish();
				succeed(key, flight, value);
			}
		});
	}
	private void succeed(K key, CompletableFuture<V> flight, V value) {
		PostLockQueue postlock = new PostLockQueue(this);
		postlock.run(() -> {
			storage.set(key, new CacheEntry<>(value, clock.instant()));
			flights.remove(key, flight);
			postlock.post(() -> flight.complete(value));
		});
		log.debug("stored", key);
	}
	private void fail(K key, CompletableFuture<V> flight, Throwable exception) {
		FetchException failure = FetchException.wrap(key, exception);
		failureCount.increment();
		logger.debug("Fetch of {} failed.", key, failure.getCause());
		PostLockQueue postlock = new PostLockQueue(this);
		postlock.run(() -> {
			flights.remove(key, flight);
			postlock.post(() -> flight.completeExceptionally(failure));
		});
		log.debug("failed", key, failure.getCause());
	}
	/**
	 * Stores the value with current timestamp, replacing any previous entry.
	 * Fetch in progress for the same key is not affected and it will overwrite the value when it completes.
	 *
	 * @param key
	 *            cache key
	 * @param value
	 *            value to cache
	 */
	public synchronized void set(K key, V value) {
		Objects.requireNonNull(key);
		storage.set(key, new CacheEntry<>(value, clock.instant()));
	}
	/**
	 * Checks whether there is an entry for the key, fresh or not.
	 */
	public synchronized boolean has(K key) {
		Objects.requireNonNull(key);
		return storage.has(key);
	}
	/**
	 * Checks whether a fetch for the key is in progress.
	 */
	public synchronized boolean fetching(K key) {
		Objects.requireNonNull(key);
		return flights.containsKey(key);
	}
	/**
	 * Drops the entry if it is at least as old as default time-to-live.
	 *
	 * @see #collect(Object, Duration)
	 */
	public boolean collect(K key) {
		return collect(key, ttl);
	}
	/**
	 * Drops the entry if it is at least {@code ttl} old. Fresh entries are left alone.
	 *
	 * @param key
	 *            cache key
	 * @param ttl
	 *            minimum age of entries to drop
	 * @return {@code true} if an entry was dropped
	 */
	public synchronized boolean collect(K key, Duration ttl) {
		Objects.requireNonNull(key);
		checkTtl(ttl);
		CacheEntry<V> cached = storage.get(key);
		if (cached == null || !cached.expired(clock.instant(), ttl))
			return false;
		return storage.delete(key);
	}
	@Override
	public String toString() {
		int running;
		synchronized (this) {
			running = flights.size();
		}
		return OwnerTrace.of(this) + " = " + running + " in flight";
	}
}
