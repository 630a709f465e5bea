// Part of Stable Options
package com.machinezoo.stableoptions.util;

import static java.util.stream.Collectors.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Options caches, cells, and callback wrappers are created in large numbers, often one set per widget.
 * When something goes wrong, a bare class name in toString() or in a tracing span doesn't tell which widget is involved.
 * Owner trace attaches an alias, tags, and parent link to any object, so that every object can describe itself
 * together with all of its owners, e.g. "binding.options.cell.callback{binding.prefix=chatkit, callback.path=$.onError, options.id=3}".
 *
 * Tracing data is not stored in the traced objects. Wrappers are proxies and cannot carry extra fields.
 * It is instead kept in a weak identity map. Guava's weak-keyed cache provides exactly that, synchronization included.
 * Values of the map must not reference the key, otherwise entries would never be collected.
 * That's why OwnerTrace itself is only a short-lived builder and the data lives in separate object.
 */
/**
 * Ancestry and tags of an object for use in {@code toString()} and tracing spans.
 */
@NoTests
@StubDocs
@DraftApi("should be in a separate library")
public class OwnerTrace<T> {
	private static final LoadingCache<Object, Data> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(Data::new));
	public static <T> OwnerTrace<T> of(T target) {
		Objects.requireNonNull(target);
		return new OwnerTrace<T>(target, all.getUnchecked(target));
	}
	private final T target;
	public T target() {
		return target;
	}
	private final Data data;
	private OwnerTrace(T target, Data data) {
		this.target = target;
		this.data = data;
	}
	/*
	 * Fields are volatile, because traced objects may be printed from any thread.
	 */
	private static class Data {
		volatile String alias;
		volatile Tag tags;
		volatile Data parent;
		Data(Object target) {
			alias = target.getClass().getSimpleName();
		}
	}
	/*
	 * Tag lists are short, so singly linked list beats any map.
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
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	/*
	 * Null values are silently ignored, so that callers can tag optional properties without null checks.
	 */
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		if (value != null) {
			Tag head = data.tags;
			for (Tag tag = head; tag != null; tag = tag.next) {
				if (tag.key.equals(key)) {
					tag.value = value;
					return this;
				}
			}
			data.tags = new Tag(key, value, head);
		}
		return this;
	}
	private static final AtomicLong counter = new AtomicLong();
	public OwnerTrace<T> generateId() {
		return tag("id", counter.incrementAndGet());
	}
	public OwnerTrace<T> parent(Object parent) {
		Objects.requireNonNull(parent);
		data.parent = parent instanceof OwnerTrace ? ((OwnerTrace<?>)parent).data : all.getUnchecked(parent);
		return this;
	}
	/*
	 * Ancestors are stored child-to-parent, but we want to print them root first.
	 * Repeated aliases (nested bindings for example) get numbered, so that their tags don't overwrite each other.
	 */
	private List<Map.Entry<String, Data>> namespaces() {
		List<Data> chain = new ArrayList<>();
		for (Data ancestor = data; ancestor != null && chain.size() < 64; ancestor = ancestor.parent)
			chain.add(ancestor);
		Collections.reverse(chain);
		Object2IntMap<String> numbering = new Object2IntOpenHashMap<>(chain.size());
		List<Map.Entry<String, Data>> namespaces = new ArrayList<>(chain.size());
		for (Data ancestor : chain) {
			String alias = ancestor.alias;
			int number = numbering.getInt(alias);
			numbering.put(alias, number == 0 ? 2 : number + 1);
			namespaces.add(new AbstractMap.SimpleImmutableEntry<>(number == 0 ? alias : alias + number, ancestor));
		}
		return namespaces;
	}
	/*
	 * OpenTracing tags are restricted to strings, numbers, and booleans. Everything else is stringified.
	 */
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		List<Map.Entry<String, Data>> namespaces = namespaces();
		span.setTag("owner", namespaces.stream().map(Map.Entry::getKey).collect(joining(".")));
		for (Map.Entry<String, Data> ns : namespaces) {
			for (Tag tag = ns.getValue().tags; tag != null; tag = tag.next) {
				String key = ns.getKey() + "." + tag.key;
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
	@Override
	public String toString() {
		Map<String, Object> sorted = new TreeMap<>();
		List<Map.Entry<String, Data>> namespaces = namespaces();
		for (Map.Entry<String, Data> ns : namespaces)
			for (Tag tag = ns.getValue().tags; tag != null; tag = tag.next)
				sorted.put(ns.getKey() + "." + tag.key, tag.value);
		return namespaces.stream().map(Map.Entry::getKey).collect(joining(".")) + sorted;
	}
}
