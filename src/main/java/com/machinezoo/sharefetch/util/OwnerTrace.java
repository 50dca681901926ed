// Part of Sharefetch
package com.machinezoo.sharefetch.util;

import static java.util.stream.Collectors.*;
import java.util.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Caches, stream handlers, and broadcasts are owned by each other: a broadcast belongs to a stream handler,
 * which belongs to a registry. Log lines and tracing spans are only meaningful if they carry the whole chain,
 * for example "registry.handler.broadcast" with the stream key, so that one can tell which feed emitted what.
 *
 * Trace data is attached externally via a weak identity map, so any object can be traced without carrying a field.
 * The map value must not reference the target, otherwise the entry would keep itself alive.
 */
/**
 * Ownership chain and tags of library objects for use in {@code toString()} and tracing spans.
 */
@StubDocs
@DraftApi("should be in a separate library")
public class OwnerTrace<T> {
	/*
	 * Guava's weakKeys() compares keys by identity, which is what we want for arbitrary application keys.
	 */
	private static final LoadingCache<Object, TraceData> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(TraceData::new));
	public static <T> OwnerTrace<T> of(T target) {
		Objects.requireNonNull(target);
		return new OwnerTrace<T>(all.getUnchecked(target));
	}
	private final TraceData data;
	private OwnerTrace(TraceData data) {
		this.data = data;
	}
	private static class TraceData {
		volatile String alias;
		volatile Tag tags;
		volatile TraceData parent;
		TraceData(Object target) {
			alias = target instanceof Class ? ((Class<?>)target).getSimpleName() : target.getClass().getSimpleName();
		}
	}
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	/*
	 * Tags form a short linked list. Replacing a tag mutates the node in place.
	 */
	private static class Tag {
		final String key;
		volatile Object value;
		final Tag next;
		Tag(String key, Object value, Tag next) {
			this.key = key;
			this.value = value;
			this.next = next;
		}
	}
	/*
	 * Null values are ignored, which lets callers pass optional keys without a null check.
	 */
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		if (value == null)
			return this;
		synchronized (data) {
			for (Tag tag = data.tags; tag != null; tag = tag.next) {
				if (tag.key.equals(key)) {
					tag.value = value;
					return this;
				}
			}
			data.tags = new Tag(key, value, data.tags);
		}
		return this;
	}
	public OwnerTrace<T> parent(Object parent) {
		data.parent = OwnerTrace.of(parent).data;
		return this;
	}
	/*
	 * Ancestors sharing an alias get numbered namespaces (handler, handler2, ...) so that their tags do not collide.
	 */
	private static class Namespace {
		final TraceData data;
		String name;
		Namespace(TraceData data) {
			this.data = data;
		}
	}
	private List<Namespace> namespaces() {
		List<Namespace> namespaces = new ArrayList<>();
		for (TraceData ancestor = data; ancestor != null; ancestor = ancestor.parent)
			namespaces.add(new Namespace(ancestor));
		Collections.reverse(namespaces);
		Object2IntMap<String> numbering = new Object2IntOpenHashMap<>(namespaces.size());
		for (Namespace ns : namespaces) {
			String alias = ns.data.alias;
			if (!numbering.containsKey(alias)) {
				ns.name = alias;
				numbering.put(alias, 2);
			} else {
				int number = numbering.getInt(alias);
				ns.name = alias + number;
				numbering.put(alias, number + 1);
			}
		}
		return namespaces;
	}
	private static String path(List<Namespace> namespaces) {
		return namespaces.stream().map(ns -> ns.name).collect(joining("."));
	}
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		List<Namespace> namespaces = namespaces();
		span.setTag("owner", path(namespaces));
		for (Namespace ns : namespaces) {
			for (Tag tag = ns.data.tags; tag != null; tag = tag.next) {
				String key = ns.name + "." + tag.key;
				Object value = tag.value;
				if (value instanceof String)
					span.setTag(key, (String)value);
				else if (value instanceof Number)
					span.setTag(key, (Number)value);
				else if (value instanceof Boolean)
					span.setTag(key, (boolean)value);
				else
					span.setTag(key, value.toString());
			}
		}
		return span;
	}
	/*
	 * Sorted by tag name, so that output is stable.
	 */
	@Override
	public String toString() {
		Map<String, Object> sorted = new TreeMap<>();
		List<Namespace> namespaces = namespaces();
		for (Namespace ns : namespaces)
			for (Tag tag = ns.data.tags; tag != null; tag = tag.next)
				sorted.put(ns.name + "." + tag.key, tag.value);
		return path(namespaces) + sorted;
	}
}
