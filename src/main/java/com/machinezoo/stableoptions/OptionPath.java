// Part of Stable Options
package com.machinezoo.stableoptions;

import java.util.*;
import com.google.common.collect.*;
import com.machinezoo.stagean.*;

/**
 * Location of a node in options tree.
 * Path is a sequence of segments. Every segment is either a record key ({@link String}) or a sequence index ({@link Integer}).
 * Empty path points to the root of the tree.
 * <p>
 * Paths are immutable. Methods {@link #key(String)} and {@link #index(int)} return new extended paths.
 *
 * @see LatestCallbacks
 */
@StubDocs
public final class OptionPath {
	private static final OptionPath root = new OptionPath(ImmutableList.of());
	public static OptionPath root() {
		return root;
	}
	private final ImmutableList<Object> segments;
	public List<Object> segments() {
		return segments;
	}
	private OptionPath(ImmutableList<Object> segments) {
		this.segments = segments;
	}
	/**
	 * Creates path from a list of segments.
	 *
	 * @param segments
	 *            list of {@link String} keys and non-negative {@link Integer} indexes
	 * @return path consisting of the segments
	 * @throws NullPointerException
	 *             if {@code segments} or any of the segments is {@code null}
	 * @throws IllegalArgumentException
	 *             if some segment is neither a string nor a non-negative integer
	 */
	public static OptionPath of(List<?> segments) {
		for (Object segment : segments) {
			Objects.requireNonNull(segment);
			if (segment instanceof Integer) {
				if ((Integer)segment < 0)
					throw new IllegalArgumentException("Negative index in options path.");
			} else if (!(segment instanceof String))
				throw new IllegalArgumentException("Path segment must be a string key or an integer index.");
		}
		return new OptionPath(ImmutableList.copyOf(segments));
	}
	public static OptionPath of(Object... segments) {
		return of(Arrays.asList(segments));
	}
	public OptionPath key(String key) {
		Objects.requireNonNull(key);
		return new OptionPath(ImmutableList.<Object>builderWithExpectedSize(segments.size() + 1).addAll(segments).add(key).build());
	}
	public OptionPath index(int index) {
		if (index < 0)
			throw new IllegalArgumentException("Negative index in options path.");
		return new OptionPath(ImmutableList.<Object>builderWithExpectedSize(segments.size() + 1).addAll(segments).add(index).build());
	}
	public boolean isRoot() {
		return segments.isEmpty();
	}
	/**
	 * Returns path of the parent container.
	 *
	 * @return path without the last segment
	 * @throws IllegalStateException
	 *             if this is the root path
	 */
	public OptionPath parent() {
		if (segments.isEmpty())
			throw new IllegalStateException("Root path has no parent.");
		return new OptionPath(segments.subList(0, segments.size() - 1));
	}
	/**
	 * Returns the last segment, i.e. key or index of the node in its parent container.
	 *
	 * @return last segment of the path
	 * @throws IllegalStateException
	 *             if this is the root path
	 */
	public Object last() {
		if (segments.isEmpty())
			throw new IllegalStateException("Root path has no segments.");
		return segments.get(segments.size() - 1);
	}
	/*
	 * Resolution is lenient, because it runs against options that may have changed shape since the path was created.
	 * Missing keys, out-of-range indexes, null containers, and containers of the wrong kind all resolve to null.
	 */
	/**
	 * Finds the node at this path in the provided options tree.
	 * This method never throws. If the path cannot be followed, {@code null} is returned.
	 *
	 * @param root
	 *            root of the options tree, possibly {@code null}
	 * @return node at this path or {@code null} if there is no such node
	 */
	public Object resolve(Object root) {
		Object node = root;
		try {
			for (Object segment : segments) {
				node = OptionNodes.child(node, segment);
				if (node == null)
					return null;
			}
		} catch (RuntimeException ex) {
			/*
			 * Application-defined maps may reject lookups, for example TreeMap with incompatible comparator.
			 * That's just another form of shape drift.
			 */
			return null;
		}
		return node;
	}
	@Override
	public boolean equals(Object obj) {
		return obj instanceof OptionPath && segments.equals(((OptionPath)obj).segments);
	}
	@Override
	public int hashCode() {
		return segments.hashCode();
	}
	/*
	 * Rendered in JSONPath-like notation, which is both compact and familiar.
	 */
	@Override
	public String toString() {
		StringBuilder text = new StringBuilder("$");
		for (Object segment : segments) {
			if (segment instanceof Integer)
				text.append('[').append(segment).append(']');
			else
				text.append('.').append(segment);
		}
		return text.toString();
	}
}
