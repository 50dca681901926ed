// Part of Sharefetch
package com.machinezoo.sharefetch;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.sharefetch.util.*;
import com.machinezoo.stagean.*;

/**
 * Fan-out channel that remembers its last value.
 * <p>
 * New subscriber first receives the last emitted value, if there is one, and then all subsequent emissions.
 * Subscribers are invoked in the order they subscribed. Values reach every subscriber in emission order.
 * <p>
 * Subscribers are never invoked while the broadcast is locked. Callbacks are queued and run one at a time
 * by whichever thread is currently delivering. When nobody else is delivering, {@link #emit(Object)} and {@link #subscribe(Consumer)}
 * return only after all queued callbacks ran. When called from a subscriber or while another thread is delivering,
 * they queue the callbacks and return immediately, leaving delivery to the thread that is already doing it.
 * <p>
 * Broadcast ends with {@link #complete()}. Subscribers are then notified via {@link Subscriber#complete()} and released.
 * Completed broadcast still replays its last value to late subscribers, which are then immediately completed.
 * <p>
 * Exceptions thrown by subscribers are logged and do not prevent delivery to other subscribers.
 *
 * @param <T>
 *            type of emitted values
 */
@StubDocs
public class ReplayBroadcast<T> {
	/**
	 * Subscriber that also wants to know when the broadcast ends.
	 * Plain {@link Consumer} can be used as a subscriber when completion is not interesting.
	 */
	public interface Subscriber<T> extends Consumer<T> {
		default void complete() {
		}
	}
	private static final Logger logger = LoggerFactory.getLogger(ReplayBroadcast.class);
	/*
	 * Guarded by this.
	 */
	private final Set<Subscription> subscribers = new LinkedHashSet<>();
	private boolean present;
	private T latest;
	private boolean completed;
	/*
	 * Callbacks waiting for delivery, guarded by this. At most one thread drains the queue at any time.
	 */
	private final Deque<Runnable> pending = new ArrayDeque<>();
	private boolean draining;
	public ReplayBroadcast() {
		OwnerTrace.of(this).alias("broadcast");
	}
	private class Subscription implements CloseableScope {
		final Consumer<? super T> consumer;
		/*
		 * Closed subscription gets no further callbacks, not even those already queued.
		 */
		volatile boolean closed;
		Subscription(Consumer<? super T> consumer) {
			this.consumer = consumer;
		}
		@Override
		public void close() {
			closed = true;
			synchronized (ReplayBroadcast.this) {
				subscribers.remove(this);
			}
		}
	}
	/**
	 * Adds subscriber, replaying the last value to it if there is any.
	 *
	 * @param consumer
	 *            callback receiving values, possibly a {@link Subscriber}
	 * @return scope that unsubscribes when closed
	 */
	public CloseableScope subscribe(Consumer<? super T> consumer) {
		Objects.requireNonNull(consumer);
		Subscription subscription = new Subscription(consumer);
		synchronized (this) {
			if (present) {
				T replay = latest;
				pending.add(() -> deliver(subscription, replay));
			}
			if (completed)
				pending.add(() -> finish(subscription));
			else
				subscribers.add(subscription);
		}
		drain();
		return subscription;
	}
	/**
	 * Remembers the value and queues it for all current subscribers.
	 *
	 * @param value
	 *            value to emit, may be {@code null}
	 * @return {@code false} if the broadcast is already completed and the value was discarded
	 */
	public boolean emit(T value) {
		synchronized (this) {
			if (completed)
				return false;
			latest = value;
			present = true;
			/*
			 * Subscribers added later get the value via replay. Iterate over a snapshot.
			 */
			List<Subscription> targets = new ArrayList<>(subscribers);
			pending.add(() -> {
				for (Subscription subscription : targets)
					deliver(subscription, value);
			});
		}
		drain();
		return true;
	}
	/**
	 * Ends the broadcast and releases all subscribers. Further emissions are discarded.
	 *
	 * @return {@code false} if the broadcast was already completed
	 */
	public boolean complete() {
		synchronized (this) {
			if (completed)
				return false;
			completed = true;
			List<Subscription> released = new ArrayList<>(subscribers);
			subscribers.clear();
			pending.add(() -> {
				for (Subscription subscription : released)
					finish(subscription);
			});
		}
		drain();
		return true;
	}
	private void drain() {
		synchronized (this) {
			if (draining)
				return;
			draining = true;
		}
		while (true) {
			Runnable task;
			synchronized (this) {
				task = pending.poll();
				if (task == null) {
					draining = false;
					return;
				}
			}
			try {
				task.run();
			} catch (Throwable ex) {
				synchronized (this) {
					draining = false;
				}
				throw ex;
			}
		}
	}
	private void deliver(Subscription subscription, T value) {
		if (!subscription.closed)
			ExceptionLogging.log(logger).run(() -> subscription.consumer.accept(value));
	}
	private void finish(Subscription subscription) {
		if (!subscription.closed && subscription.consumer instanceof Subscriber)
			ExceptionLogging.log(logger).run(((Subscriber<?>)subscription.consumer)::complete);
	}
	/**
	 * Returns the last emitted value. Emitted {@code null} looks the same as no emission.
	 */
	public synchronized Optional<T> latest() {
		return present ? Optional.ofNullable(latest) : Optional.empty();
	}
	public synchronized boolean completed() {
		return completed;
	}
	public synchronized int subscribers() {
		return subscribers.size();
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + latest();
	}
}
