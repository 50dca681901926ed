// Part of Sharefetch
package com.machinezoo.sharefetch;

/**
 * Result of {@link StreamRegistry#applyUpdateAsync(Object, Object, java.time.Duration)}.
 */
public enum UpdateOutcome {
	/**
	 * The stream emitted a value after the update was requested.
	 */
	UPDATED,
	/**
	 * No value was emitted before the timeout, either because the update was throttled,
	 * the query failed or was too slow, or the stream was cleared meanwhile.
	 * The query itself may still complete and emit later.
	 */
	NOT_UPDATED,
	/**
	 * There is no stream registered under the key. Nothing was requested.
	 */
	UNKNOWN_KEY
}
