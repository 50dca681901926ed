// Part of Sharefetch
package com.machinezoo.sharefetch;

import java.util.*;
import java.util.function.*;

/*
 * Collects work that must run after a monitor is released: starting fetches, completing futures, tearing down streams.
 * Such work may call back into application code, which must never happen while a cache or registry is locked.
 * One instance serves one critical section.
 */
class PostLockQueue {
	private final Object lock;
	private List<Runnable> queue = new ArrayList<>();
	PostLockQueue(Object lock) {
		Objects.requireNonNull(lock);
		this.lock = lock;
	}
	<T> T eval(Supplier<T> section) {
		T result;
		synchronized (lock) {
			result = section.get();
		}
		List<Runnable> tasks = queue;
		queue = null;
		for (Runnable task : tasks)
			task.run();
		return result;
	}
	void run(Runnable section) {
		eval(() -> {
			section.run();
			return null;
		});
	}
	void post(Runnable task) {
		Objects.requireNonNull(task);
		if (queue == null)
			throw new IllegalStateException("Critical section has already ended.");
		queue.add(task);
	}
}
