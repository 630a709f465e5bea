// Part of Stable Options
package com.machinezoo.stableoptions;

import java.lang.reflect.*;
import java.util.*;

/*
 * Uniform access to sequences and records, so that lists and arrays can be walked with the same code.
 * Callers are expected to classify the node via OptionKind before calling any of these methods.
 */
final class OptionNodes {
	private OptionNodes() {
	}
	static int length(Object sequence) {
		if (sequence instanceof List)
			return ((List<?>)sequence).size();
		return Array.getLength(sequence);
	}
	static Object element(Object sequence, int index) {
		if (sequence instanceof List)
			return ((List<?>)sequence).get(index);
		return Array.get(sequence, index);
	}
	/*
	 * Snapshot of the elements. Random access into arbitrary lists can be slow (think LinkedList),
	 * so walks copy the elements once and then index into the copy.
	 */
	static List<Object> elements(Object sequence) {
		if (sequence instanceof List)
			return new ArrayList<>((List<?>)sequence);
		int length = Array.getLength(sequence);
		List<Object> elements = new ArrayList<>(length);
		for (int i = 0; i < length; ++i)
			elements.add(Array.get(sequence, i));
		return elements;
	}
	@SuppressWarnings("unchecked")
	static Map<String, Object> record(Object record) {
		return (Map<String, Object>)record;
	}
	/*
	 * Lookup of one path segment. Anything that doesn't resolve yields null.
	 * This is deliberately lenient. Paths are resolved against the latest snapshot,
	 * which may have a completely different shape than the one the path was taken from.
	 */
	static Object child(Object container, Object segment) {
		if (container == null)
			return null;
		if (segment instanceof String) {
			if (!(container instanceof Map))
				return null;
			return ((Map<?, ?>)container).get(segment);
		}
		int index = (Integer)segment;
		if (container instanceof List) {
			List<?> list = (List<?>)container;
			return index < list.size() ? list.get(index) : null;
		}
		if (container.getClass().isArray())
			return index < Array.getLength(container) ? Array.get(container, index) : null;
		return null;
	}
}
