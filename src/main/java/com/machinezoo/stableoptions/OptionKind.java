// Part of Stable Options
package com.machinezoo.stableoptions;

import java.lang.reflect.*;
import java.util.*;
import com.google.common.cache.*;

/*
 * Options are untyped trees, so both the equality walk and the shaping walk need to know what kind of node they are looking at.
 * We classify every node exactly once and then switch on the result.
 * Keeping all type tests here makes the walks exhaustive and it gives us single place to extend the classification.
 */
/**
 * Classification of nodes in options trees.
 * Every value that can appear in options belongs to exactly one kind as determined by {@link #of(Object)}.
 *
 * @see OptionEquality
 * @see OptionsCache
 */
public enum OptionKind {
	/**
	 * Immutable scalar value: {@code null}, {@link String}, {@link Boolean}, {@link Character},
	 * boxed JDK number ({@link Byte}, {@link Short}, {@link Integer}, {@link Long}, {@link Float}, {@link Double}),
	 * or enum constant. Primitives are compared by value and passed through unchanged.
	 */
	PRIMITIVE,
	/**
	 * Ordered sequence: any {@link List} or Java array, including arrays of primitive types.
	 * Sequences are compared element by element and rebuilt during shaping.
	 */
	SEQUENCE,
	/**
	 * Plain record: any {@link Map} whose keys are all strings.
	 * Records are compared key by key and rebuilt during shaping.
	 */
	RECORD,
	/**
	 * Callback: object implementing at least one interface annotated with {@link FunctionalInterface}.
	 * JDK classes qualify only if they are lambdas or proxies, so that values like {@link java.time.Instant} stay opaque.
	 * Non-public functional interfaces count only if live wrapper can implement them,
	 * i.e. all non-public interfaces of the callback come from one package that is open to this library.
	 * All callables compare equal. They are replaced with live wrappers during shaping.
	 *
	 * @see LatestCallbacks
	 */
	CALLABLE,
	/**
	 * Anything else, for example {@link Set}, {@link java.time.Instant}, {@link Date}, map with non-string keys, or application object.
	 * Opaque values are compared by reference and passed through unchanged.
	 */
	OPAQUE;
	/*
	 * Functional interface detection walks the whole interface hierarchy, which is relatively expensive.
	 * Callback classes are few (every lambda expression in source code has one class) while callbacks are created on every render.
	 * We therefore cache the answer per class. Weak keys let classes unload.
	 */
	private static final LoadingCache<Class<?>, Boolean> callables = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(OptionKind::functional));
	/**
	 * Determines kind of the value.
	 * This method never throws.
	 * Classification of records has to inspect map keys, so it is linear in the size of the map.
	 * If the keys cannot be iterated, the map is considered {@link #OPAQUE}.
	 *
	 * @param value
	 *            the value to classify, possibly {@code null}
	 * @return kind of the value
	 */
	public static OptionKind of(Object value) {
		if (value == null || value instanceof String || value instanceof Boolean || value instanceof Character || value instanceof Enum)
			return PRIMITIVE;
		if (value instanceof Number)
			return boxed(value.getClass()) ? PRIMITIVE : OPAQUE;
		/*
		 * Callables are checked first, because collection could theoretically implement functional interface too.
		 * Such hybrids are treated as callbacks, which matches how the consumer is going to use them.
		 */
		if (callables.getUnchecked(value.getClass()))
			return CALLABLE;
		if (value instanceof List || value.getClass().isArray())
			return SEQUENCE;
		if (value instanceof Map)
			return plain((Map<?, ?>)value) ? RECORD : OPAQUE;
		return OPAQUE;
	}
	private static boolean boxed(Class<?> clazz) {
		return clazz == Integer.class || clazz == Long.class || clazz == Double.class || clazz == Float.class || clazz == Short.class || clazz == Byte.class;
	}
	private static boolean plain(Map<?, ?> map) {
		try {
			for (Object key : map.keySet())
				if (!(key instanceof String))
					return false;
			return true;
		} catch (RuntimeException ex) {
			return false;
		}
	}
	/*
	 * Some JDK value classes implement functional interfaces. Instant and LocalDate are TemporalAdjusters for example.
	 * They are data, not callbacks. Classes loaded by the bootstrap loader are therefore callable only if they are lambdas or proxies.
	 */
	private static boolean functional(Class<?> clazz) {
		if (clazz.getClassLoader() == null && !clazz.isSynthetic() && !clazz.isHidden() && !Proxy.isProxyClass(clazz))
			return false;
		for (Class<?> iface : interfaces(clazz))
			if (functionalInterface(iface))
				return true;
		return false;
	}
	private static boolean functionalInterface(Class<?> iface) {
		if (iface.isAnnotationPresent(FunctionalInterface.class))
			return true;
		for (Class<?> parent : iface.getInterfaces())
			if (functionalInterface(parent))
				return true;
		return false;
	}
	/*
	 * Live wrappers are proxies and proxies can only implement interfaces they can see.
	 * Non-public interfaces are fine as long as they all come from one package of one class loader
	 * and that package is open to us, so that we can invoke their methods reflectively.
	 * Otherwise non-public interfaces are skipped, but their public parents are still exposed.
	 * Callbacks that end up with no functional interface are not callbacks as far as we are concerned.
	 */
	static List<Class<?>> interfaces(Class<?> clazz) {
		Set<Class<?>> direct = new LinkedHashSet<>();
		for (Class<?> type = clazz; type != null; type = type.getSuperclass())
			direct.addAll(Arrays.asList(type.getInterfaces()));
		if (exposable(direct))
			return new ArrayList<>(direct);
		Set<Class<?>> exposed = new LinkedHashSet<>();
		for (Class<?> iface : direct)
			expose(iface, exposed);
		return new ArrayList<>(exposed);
	}
	private static boolean exposable(Collection<Class<?>> interfaces) {
		Class<?> first = null;
		for (Class<?> iface : interfaces) {
			if (Modifier.isPublic(iface.getModifiers()))
				continue;
			if (first == null) {
				if (!iface.getModule().isOpen(iface.getPackageName(), OptionKind.class.getModule()))
					return false;
				first = iface;
			} else if (iface.getClassLoader() != first.getClassLoader() || !iface.getPackageName().equals(first.getPackageName()))
				return false;
		}
		return true;
	}
	private static void expose(Class<?> iface, Set<Class<?>> exposed) {
		if (Modifier.isPublic(iface.getModifiers()))
			exposed.add(iface);
		else {
			for (Class<?> parent : iface.getInterfaces())
				expose(parent, exposed);
		}
	}
}
