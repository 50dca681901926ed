// Part of Sharefetch
package com.machinezoo.sharefetch.util;

import static org.junit.jupiter.api.Assertions.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.junit.jupiter.api.*;
import org.slf4j.helpers.*;

public class DiagnosticLogTest {
	@Test
	public void levels() {
		DiagnosticLog log = new DiagnosticLog("[test]");
		// Default level is INFO.
		assertEquals(DiagnosticLog.Level.INFO, log.level());
		assertTrue(log.enabled(DiagnosticLog.Level.INFO));
		assertFalse(log.enabled(DiagnosticLog.Level.DEBUG));
		log.level(DiagnosticLog.Level.DEBUG);
		assertTrue(log.enabled(DiagnosticLog.Level.DEBUG));
		assertTrue(log.enabled(DiagnosticLog.Level.INFO));
		log.level(DiagnosticLog.Level.NONE);
		assertFalse(log.enabled(DiagnosticLog.Level.DEBUG));
		assertFalse(log.enabled(DiagnosticLog.Level.INFO));
		// NONE is a threshold, not a message level.
		assertFalse(log.enabled(DiagnosticLog.Level.NONE));
	}
	@Test
	public void format() {
		DiagnosticLog log = new DiagnosticLog("[test]");
		assertEquals("[test] a 1 null", log.format("a", 1, null));
		assertEquals("[test]", log.format());
	}
	@Test
	public void taps() {
		DiagnosticLog log = new DiagnosticLog("[test]").logger(NOPLogger.NOP_LOGGER);
		AtomicInteger n = new AtomicInteger();
		Consumer<String> debug = log.debugTap(v -> {
			n.incrementAndGet();
			return "got " + v;
		});
		Consumer<String> info = log.infoTap(v -> {
			n.incrementAndGet();
			return "got " + v;
		});
		// Message is not formatted when the level is off.
		debug.accept("a");
		assertEquals(0, n.get());
		info.accept("a");
		assertEquals(1, n.get());
		// Level is checked on every value, not when the tap is created.
		log.level(DiagnosticLog.Level.DEBUG);
		debug.accept("b");
		assertEquals(2, n.get());
		log.level(DiagnosticLog.Level.NONE);
		info.accept("c");
		assertEquals(2, n.get());
	}
	@Test
	public void plainMessages() {
		// Messages at every level are accepted without failure, whether enabled or not.
		DiagnosticLog log = new DiagnosticLog("[test]").level(DiagnosticLog.Level.DEBUG);
		log.debug("hit", "key");
		log.info("fetch", 1, null);
		log.level(DiagnosticLog.Level.NONE);
		log.info("skipped");
		assertEquals("[test]", log.prefix());
	}
}
