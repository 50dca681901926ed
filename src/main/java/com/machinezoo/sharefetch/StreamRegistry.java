// Part of Sharefetch
package com.machinezoo.sharefetch;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.sharefetch.util.*;
import com.machinezoo.stagean.*;

/**
 * Named live feeds shared by many consumers.
 * <p>
 * Every stream is registered once with a query function. The application then requests refreshes via
 * {@link #applyUpdate(Object, Object)} and consumers subscribe to the stream's {@link ReplayBroadcast}.
 * Refreshes are throttled, so a burst of update requests from many consumers results in a single query.
 * Late subscribers get the last value immediately without triggering a query.
 * <p>
 * Failed queries are swallowed. The stream keeps its last value and stays ready for the next update.
 * Applications that want subscribers to see failures should make the query return an explicit failure value.
 * <p>
 * {@code StreamRegistry} is thread-safe.
 *
 * @param <K>
 *            key type
 *
 * @see StreamHandler
 * @see SingleFlightCache
 */
@DraftApi("typed keys carrying payload and value types")
public class StreamRegistry<K> {
	/**
	 * Default throttle window of stream updates: 1 second.
	 */
	public static final Duration DEFAULT_THROTTLE = Duration.ofSeconds(1);
	/*
	 * Emissions within this delay after applyUpdateAsync() are not taken as confirmation.
	 * They are replays or results of earlier queries.
	 */
	static final Duration GRACE = Duration.ofMillis(1);
	private static final Logger logger = LoggerFactory.getLogger(StreamRegistry.class);
	private static final ScheduledExecutorService timing = Executors.newScheduledThreadPool(1, new ThreadFactory() {
		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable);
			thread.setDaemon(true);
			thread.setName("sharefetch-timing");
			return thread;
		}
	});
	/*
	 * Guarded by this. Insertion order is kept for keys().
	 */
	private final Map<K, StreamHandler<?, ?>> handlers = new LinkedHashMap<>();
	private volatile Duration throttle = DEFAULT_THROTTLE;
	public Duration throttle() {
		return throttle;
	}
	/**
	 * Configures throttle window for streams registered without explicit window.
	 *
	 * @return {@code this} (fluent method)
	 */
	public StreamRegistry<K> throttle(Duration throttle) {
		Objects.requireNonNull(throttle);
		if (throttle.isNegative())
			throw new IllegalArgumentException("Throttle window cannot be negative.");
		this.throttle = throttle;
		return this;
	}
	private volatile java.time.Clock clock = java.time.Clock.systemUTC();
	public java.time.Clock clock() {
		return clock;
	}
	/**
	 * Configures time source for throttling. Affects only streams registered afterwards.
	 *
	 * @return {@code this} (fluent method)
	 */
	public StreamRegistry<K> clock(java.time.Clock clock) {
		Objects.requireNonNull(clock);
		this.clock = clock;
		return this;
	}
	private volatile ScheduledExecutorService scheduler = timing;
	public ScheduledExecutorService scheduler() {
		return scheduler;
	}
	/**
	 * Configures scheduler for timeouts of {@link #applyUpdateAsync(Object, Object, Duration)}.
	 * Default is a shared single-threaded daemon scheduler.
	 *
	 * @return {@code this} (fluent method)
	 */
	public StreamRegistry<K> scheduler(ScheduledExecutorService scheduler) {
		Objects.requireNonNull(scheduler);
		this.scheduler = scheduler;
		return this;
	}
	private volatile Executor executor = ForkJoinPool.commonPool();
	public Executor executor() {
		return executor;
	}
	/**
	 * Configures executor that completes futures returned by {@link #applyUpdateAsync(Object, Object, Duration)} on timeout.
	 * Continuations attached to those futures run there, keeping them off the scheduler thread.
	 * Default is {@link ForkJoinPool#commonPool()}.
	 *
	 * @return {@code this} (fluent method)
	 */
	public StreamRegistry<K> executor(Executor executor) {
		Objects.requireNonNull(executor);
		this.executor = executor;
		return this;
	}
	private volatile DiagnosticLog log = new DiagnosticLog("[streams]").level(DiagnosticLog.Level.NONE);
	public DiagnosticLog log() {
		return log;
	}
	public StreamRegistry<K> log(DiagnosticLog log) {
		Objects.requireNonNull(log);
		this.log = log;
		return this;
	}
	public StreamRegistry() {
		OwnerTrace.of(this).alias("streams");
	}
	/**
	 * Registers stream with default throttle window.
	 *
	 * @see #registerStream(Object, Function, Duration)
	 */
	public <P, T> ReplayBroadcast<T> registerStream(K key, Function<P, CompletableFuture<T>> queryOnce) {
		return registerStream(key, queryOnce, throttle);
	}
	/**
	 * Registers new stream under the key.
	 * <p>
	 * Registration does not run the query. The stream stays empty until the first update.
	 * Key of a cleared stream can be registered again, which creates a brand new stream.
	 *
	 * @param key
	 *            stream key
	 * @param queryOnce
	 *            function fetching one value of the stream, called for every update that passes the throttle
	 * @param throttle
	 *            minimum time between two queries
	 * @return broadcast of stream values
	 * @throws DuplicateKeyException
	 *             if the key already has a live stream
	 */
	public <P, T> ReplayBroadcast<T> registerStream(K key, Function<P, CompletableFuture<T>> queryOnce, Duration throttle) {
		Objects.requireNonNull(key);
		StreamHandler<P, T> handler = new StreamHandler<>(key, queryOnce, throttle, clock, log);
		OwnerTrace.of(handler).parent(this);
		handler.detach = () -> forget(key, handler);
		synchronized (this) {
			StreamHandler<?, ?> existing = handlers.get(key);
			if (existing != null && !existing.cleared())
				throw new DuplicateKeyException(key);
			handlers.put(key, handler);
		}
		log.debug("registered", key);
		return handler.stream();
	}
	private synchronized void forget(K key, StreamHandler<?, ?> handler) {
		handlers.remove(key, handler);
	}
	/*
	 * Includes handlers that were cleared but not yet removed.
	 */
	synchronized int size() {
		return handlers.size();
	}
	/**
	 * Returns handler of a live stream.
	 * Type parameters are not checked. Callers must use the types the stream was registered with.
	 */
	@SuppressWarnings("unchecked")
	public synchronized <P, T> Optional<StreamHandler<P, T>> getHandler(K key) {
		Objects.requireNonNull(key);
		StreamHandler<?, ?> handler = handlers.get(key);
		if (handler == null || handler.cleared())
			return Optional.empty();
		return Optional.of((StreamHandler<P, T>)handler);
	}
	public <T> Optional<ReplayBroadcast<T>> getStream(K key) {
		return this.<Object, T>getHandler(key).map(StreamHandler::stream);
	}
	public synchronized List<K> keys() {
		List<K> keys = new ArrayList<>();
		for (Map.Entry<K, StreamHandler<?, ?>> entry : handlers.entrySet())
			if (!entry.getValue().cleared())
				keys.add(entry.getKey());
		return keys;
	}
	/**
	 * Tears down the stream and forgets it. Does nothing if there is no such stream. Not throttled.
	 */
	public void clear(K key) {
		Objects.requireNonNull(key);
		PostLockQueue postlock = new PostLockQueue(this);
		postlock.run(() -> {
			StreamHandler<?, ?> handler = handlers.remove(key);
			if (handler != null)
				postlock.post(handler::clear);
		});
	}
	public void clearAll() {
		PostLockQueue postlock = new PostLockQueue(this);
		postlock.run(() -> {
			for (StreamHandler<?, ?> handler : handlers.values())
				postlock.post(handler::clear);
			handlers.clear();
		});
	}
	/**
	 * Requests refresh of the stream. Does nothing if there is no such stream.
	 *
	 * @see StreamHandler#update(Object)
	 */
	public void applyUpdate(K key, Object payload) {
		this.<Object, Object>getHandler(key).ifPresent(h -> h.update(payload));
	}
	/**
	 * Requests refresh of the stream and reports whether it landed.
	 * <p>
	 * Returned future completes with {@link UpdateOutcome#UPDATED} as soon as the stream emits
	 * a value more than one millisecond after this call. Earlier emissions, including replay of the last value, are ignored.
	 * It completes with {@link UpdateOutcome#NOT_UPDATED} if {@code waitFor} elapses first or if the stream is cleared meanwhile.
	 * The query itself is not bounded by {@code waitFor}. It continues and its value is still emitted when it arrives.
	 * <p>
	 * Continuations attached to the returned future run on the thread that resolves it.
	 * That is the thread delivering stream values for {@link UpdateOutcome#UPDATED}, the clearing thread on teardown,
	 * and the configured {@link #executor(Executor)} on timeout.
	 * <p>
	 * Unknown key resolves immediately to {@link UpdateOutcome#UNKNOWN_KEY}.
	 *
	 * @param key
	 *            stream key
	 * @param payload
	 *            argument for the query
	 * @param waitFor
	 *            how long to wait for new value
	 * @return future outcome of the update
	 */
	public CompletableFuture<UpdateOutcome> applyUpdateAsync(K key, Object payload, Duration waitFor) {
		Objects.requireNonNull(waitFor);
		if (waitFor.isNegative())
			throw new IllegalArgumentException("Timeout cannot be negative.");
		StreamHandler<Object, Object> handler = this.<Object, Object>getHandler(key).orElse(null);
		if (handler == null)
			return CompletableFuture.completedFuture(UpdateOutcome.UNKNOWN_KEY);
		handler.update(payload);
		CompletableFuture<UpdateOutcome> outcome = new CompletableFuture<>();
		AtomicBoolean armed = new AtomicBoolean();
		CloseableScope subscription = handler.stream().subscribe(new ReplayBroadcast.Subscriber<Object>() {
			@Override
			public void accept(Object value) {
				if (armed.get())
					outcome.complete(UpdateOutcome.UPDATED);
			}
			@Override
			public void complete() {
				outcome.complete(UpdateOutcome.NOT_UPDATED);
			}
		});
		if (outcome.isDone()) {
			subscription.close();
			return outcome;
		}
		ScheduledExecutorService scheduler = this.scheduler;
		Executor executor = this.executor;
		ScheduledFuture<?> grace = scheduler.schedule(ExceptionLogging.log(logger).runnable(() -> armed.set(true)), GRACE.toNanos(), TimeUnit.NANOSECONDS);
		/*
		 * Scheduler is shared. Only the hop to the executor runs on it.
		 */
		ScheduledFuture<?> timeout = scheduler.schedule(ExceptionLogging.log(logger).runnable(() -> executor.execute(
			ExceptionLogging.log(logger).runnable(() -> outcome.complete(UpdateOutcome.NOT_UPDATED)))), waitFor.toNanos(), TimeUnit.NANOSECONDS);
		outcome.whenComplete((result, exception) -> {
			subscription.close();
			grace.cancel(false);
			timeout.cancel(false);
			log.debug("update outcome", key, result);
		});
		return outcome;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + keys();
	}
}
