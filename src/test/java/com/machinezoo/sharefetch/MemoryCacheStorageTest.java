// Part of Sharefetch
package com.machinezoo.sharefetch;

import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import org.junit.jupiter.api.*;

public class MemoryCacheStorageTest {
	@Test
	public void crud() {
		MemoryCacheStorage<String, Integer> s = new MemoryCacheStorage<>();
		CacheEntry<Integer> e1 = new CacheEntry<>(1, Instant.EPOCH);
		CacheEntry<Integer> e2 = new CacheEntry<>(2, Instant.EPOCH.plusSeconds(1));
		assertFalse(s.has("k"));
		assertNull(s.get("k"));
		// Set is fluent and later set overwrites.
		assertSame(s, s.set("k", e1));
		assertTrue(s.has("k"));
		assertSame(e1, s.get("k"));
		s.set("k", e2);
		assertSame(e2, s.get("k"));
		assertEquals(1, s.size());
		// Delete reports whether there was anything to delete.
		assertTrue(s.delete("k"));
		assertFalse(s.delete("k"));
		assertFalse(s.has("k"));
	}
}
