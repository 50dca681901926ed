// Part of Sharefetch
package com.machinezoo.sharefetch.util;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.*;

public class OwnerTraceTest {
	@Test
	public void defaultAlias() {
		Object target = new Object();
		assertEquals("Object{}", OwnerTrace.of(target).toString());
	}
	@Test
	public void chain() {
		Object registry = new Object();
		Object handler = new Object();
		Object broadcast = new Object();
		OwnerTrace.of(registry).alias("streams");
		OwnerTrace.of(handler).alias("handler").tag("key", "feed").parent(registry);
		OwnerTrace.of(broadcast).alias("broadcast").parent(handler);
		assertEquals("streams.handler.broadcast{handler.key=feed}", OwnerTrace.of(broadcast).toString());
	}
	@Test
	public void tags() {
		Object target = new Object();
		OwnerTrace.of(target)
			.alias("cache")
			.tag("b", 2)
			.tag("a", 1)
			// Null is ignored and replacement keeps one entry per key.
			.tag("c", null)
			.tag("b", 3);
		assertEquals("cache{cache.a=1, cache.b=3}", OwnerTrace.of(target).toString());
	}
	@Test
	public void sameAliasNumbering() {
		Object outer = new Object();
		Object inner = new Object();
		OwnerTrace.of(outer).alias("handler").tag("key", "a");
		OwnerTrace.of(inner).alias("handler").tag("key", "b").parent(outer);
		assertEquals("handler.handler2{handler.key=a, handler2.key=b}", OwnerTrace.of(inner).toString());
	}
}
