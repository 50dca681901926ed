// Part of Sharefetch
/**
 * Diagnostic helpers shared by caches and stream registries.
 */
package com.machinezoo.sharefetch.util;
