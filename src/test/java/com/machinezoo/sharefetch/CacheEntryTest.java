// Part of Sharefetch
package com.machinezoo.sharefetch;

import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import org.junit.jupiter.api.*;

public class CacheEntryTest {
	static final Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
	@Test
	public void age() {
		CacheEntry<String> e = new CacheEntry<>("v", t0);
		assertEquals("v", e.value());
		assertEquals(t0, e.storedAt());
		assertEquals(Duration.ofSeconds(3), e.age(t0.plusSeconds(3)));
	}
	@Test
	public void expired() {
		CacheEntry<String> e = new CacheEntry<>("v", t0);
		Duration ttl = Duration.ofSeconds(10);
		assertFalse(e.expired(t0, ttl));
		assertFalse(e.expired(t0.plus(ttl).minusMillis(1), ttl));
		// Age equal to ttl is already expired.
		assertTrue(e.expired(t0.plus(ttl), ttl));
		assertTrue(e.expired(t0.plus(ttl).plusMillis(1), ttl));
		// Zero ttl accepts nothing.
		assertTrue(e.expired(t0, Duration.ZERO));
	}
	@Test
	public void equality() {
		assertEquals(new CacheEntry<>("v", t0), new CacheEntry<>("v", t0));
		assertEquals(new CacheEntry<>(null, t0), new CacheEntry<>(null, t0));
		assertNotEquals(new CacheEntry<>("v", t0), new CacheEntry<>("v", t0.plusMillis(1)));
		assertNotEquals(new CacheEntry<>("v", t0), new CacheEntry<>("w", t0));
	}
}
