// Part of Stable Options
package com.machinezoo.stableoptions;

import java.lang.reflect.*;
import java.util.*;
import org.slf4j.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Shaping produces a copy of the options in which every callback is replaced with live wrapper.
 * Records and sequences must be copied, because we cannot put wrappers into application-owned collections.
 * Copies are unmodifiable. Consumers are not supposed to modify options and silent modification would desynchronize the cache.
 *
 * Copies of the containers on the current path are kept in a memo while their content is being shaped,
 * so that cycles in the options are reproduced as cycles in the copy instead of causing infinite recursion.
 * Containers leave the memo once they are shaped. Subtree reachable via two paths is therefore copied twice,
 * because wrappers in each copy must be bound to their own path. Equal options may later hold different callbacks at those paths.
 *
 * Application-defined collections may fail while being iterated. Such container is passed through unchanged
 * just like opaque values. Equality treats the same failure as a change, so the cache never gets stuck on it.
 */
final class OptionsShaper {
	private static final Logger logger = LoggerFactory.getLogger(OptionsShaper.class);
	private final OptionsCell<?> cell;
	private final Reference2ObjectMap<Object, Object> ancestors = new Reference2ObjectOpenHashMap<>();
	private OptionsShaper(OptionsCell<?> cell) {
		this.cell = cell;
	}
	@SuppressWarnings("unchecked")
	static <T> T shape(OptionsCell<?> cell, T options) {
		return (T)new OptionsShaper(cell).shape(options, OptionPath.root());
	}
	private Object shape(Object node, OptionPath path) {
		switch (OptionKind.of(node)) {
			case CALLABLE:
				return LatestCallbacks.wrap(cell, path, node);
			case RECORD:
			case SEQUENCE:
				return container(node, path);
			case PRIMITIVE:
			case OPAQUE:
			default:
				return node;
		}
	}
	private Object container(Object node, OptionPath path) {
		Object ancestor = ancestors.get(node);
		if (ancestor != null)
			return ancestor;
		try {
			if (node instanceof Map)
				return record(OptionNodes.record(node), path);
			if (node instanceof List)
				return list((List<?>)node, path);
			return array(node, path);
		} catch (RuntimeException ex) {
			logger.debug("Failed to shape options at {}, passing the container through unchanged.", path, ex);
			return node;
		} finally {
			ancestors.remove(node);
		}
	}
	private Object record(Map<String, Object> record, OptionPath path) {
		Map<String, Object> copy = new LinkedHashMap<>();
		Map<String, Object> view = Collections.unmodifiableMap(copy);
		ancestors.put(record, view);
		for (Map.Entry<String, Object> entry : new ArrayList<>(record.entrySet()))
			copy.put(entry.getKey(), shape(entry.getValue(), path.key(entry.getKey())));
		return view;
	}
	private Object list(List<?> list, OptionPath path) {
		List<Object> elements = OptionNodes.elements(list);
		List<Object> copy = new ArrayList<>(elements.size());
		List<Object> view = Collections.unmodifiableList(copy);
		ancestors.put(list, view);
		for (int i = 0; i < elements.size(); ++i)
			copy.add(shape(elements.get(i), path.index(i)));
		return view;
	}
	private Object array(Object array, OptionPath path) {
		Class<?> component = array.getClass().getComponentType();
		/*
		 * Arrays of primitive types cannot contain callbacks or containers. Plain clone will do.
		 */
		if (component.isPrimitive()) {
			int length = Array.getLength(array);
			Object copy = Array.newInstance(component, length);
			System.arraycopy(array, 0, copy, 0, length);
			return copy;
		}
		List<Object> elements = OptionNodes.elements(array);
		Object[] copy = (Object[])Array.newInstance(retains(component, elements) ? component : Object.class, elements.size());
		ancestors.put(array, copy);
		for (int i = 0; i < elements.size(); ++i)
			copy[i] = shape(elements.get(i), path.index(i));
		return copy;
	}
	/*
	 * We would like to keep the array type (String[] stays String[]), but shaped elements are not always
	 * instances of the original component type. Records become unmodifiable maps, callbacks become proxies, and so on.
	 * The decision must be made before the elements are shaped, because the copy must exist before recursion for cycles to work.
	 * So we predict it from element kinds and fall back to Object[] whenever shaped element might not fit.
	 */
	private static boolean retains(Class<?> component, List<Object> elements) {
		if (component == Object.class)
			return true;
		for (Object element : elements) {
			switch (OptionKind.of(element)) {
				case PRIMITIVE:
				case OPAQUE:
					break;
				case CALLABLE:
					if (!component.isInterface() || !Modifier.isPublic(component.getModifiers()))
						return false;
					break;
				case RECORD:
					if (!component.isAssignableFrom(Map.class))
						return false;
					break;
				case SEQUENCE:
					if (!(element instanceof List) || !component.isAssignableFrom(List.class))
						return false;
					break;
				default:
					return false;
			}
		}
		return true;
	}
}
