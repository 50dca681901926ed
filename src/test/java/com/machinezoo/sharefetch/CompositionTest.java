// Part of Sharefetch
package com.machinezoo.sharefetch;

import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;

public class CompositionTest extends TestBase {
	@Test
	public void streamQueriesThroughCache() {
		ManualClock clock = new ManualClock();
		SingleFlightCache<String, Integer> cache = new SingleFlightCache<String, Integer>().clock(clock);
		StreamRegistry<String> registry = new StreamRegistry<String>().clock(clock);
		AtomicInteger fetches = new AtomicInteger();
		CompletableFuture<Integer> source = new CompletableFuture<>();
		// Two feeds backed by the same cached resource.
		ReplayBroadcast<Integer> a = registry.registerStream("a", p -> cache.get("price", () -> {
			fetches.incrementAndGet();
			return source;
		}, Duration.ofSeconds(30)));
		ReplayBroadcast<String> b = registry.registerStream("b", p -> cache.get("price", () -> {
			fetches.incrementAndGet();
			return source;
		}, Duration.ofSeconds(30)).thenApply(v -> "$" + v));
		registry.applyUpdate("a", null);
		registry.applyUpdate("b", null);
		// Both refreshes share one fetch.
		assertEquals(1, fetches.get());
		source.complete(10);
		assertEquals(Optional.of(10), a.latest());
		assertEquals(Optional.of("$10"), b.latest());
		// Within cache ttl, later refreshes are served from cache.
		clock.advance(Duration.ofSeconds(2));
		registry.applyUpdate("a", null);
		assertEquals(1, fetches.get());
		registry.clearAll();
	}
}
