// Part of Sharefetch
/*
 * Conventions shared by all classes here:
 * - Null check is performed on method parameters where appropriate.
 * - Application callbacks (fallbacks, queries, subscribers) are never invoked while a cache or registry is locked.
 * - Failures that cannot be propagated are logged. There's no other logging by default.
 * - Every object has an OwnerTrace alias and defines toString() through it.
 */
/**
 * Single-flight asynchronous cache and registry of throttled, replaying live streams.
 *
 * @see com.machinezoo.sharefetch.SingleFlightCache
 * @see com.machinezoo.sharefetch.StreamRegistry
 */
package com.machinezoo.sharefetch;
