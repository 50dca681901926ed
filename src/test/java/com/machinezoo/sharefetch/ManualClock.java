// Part of Sharefetch
package com.machinezoo.sharefetch;

import java.time.*;

/*
 * Clock that moves only when told to.
 */
public class ManualClock extends Clock {
	private volatile Instant now;
	public ManualClock(Instant start) {
		now = start;
	}
	public ManualClock() {
		this(Instant.parse("2024-01-01T00:00:00Z"));
	}
	public synchronized ManualClock advance(Duration duration) {
		now = now.plus(duration);
		return this;
	}
	public ManualClock advanceMillis(long millis) {
		return advance(Duration.ofMillis(millis));
	}
	@Override
	public Instant instant() {
		return now;
	}
	@Override
	public ZoneId getZone() {
		return ZoneOffset.UTC;
	}
	@Override
	public Clock withZone(ZoneId zone) {
		return this;
	}
}
