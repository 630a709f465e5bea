// Part of Stable Options
package com.machinezoo.stableoptions;

import java.lang.reflect.*;
import java.util.*;
import com.google.common.base.Defaults;
import com.google.common.reflect.AbstractInvocationHandler;
import com.machinezoo.stableoptions.util.*;

/*
 * Consumers of options register callbacks once and keep calling them for a long time.
 * Application meanwhile recreates the callbacks on every render, because they capture fresh application state.
 * If the consumer kept calling the originally registered callback, it would operate on stale state.
 *
 * Live wrappers solve this with one level of indirection. Wrapper knows only the cell with the latest options
 * and the path where the callback was found. Every call resolves the path again and forwards to whatever callback is there now.
 * Wrappers hold no options data, so they don't keep old options alive.
 *
 * Wrappers are dynamic proxies implementing the same interfaces as the original callback.
 * Consumer can therefore cast the wrapper to Function, Runnable, or any application-defined functional interface
 * exactly as it would cast the original callback.
 */
/**
 * Factory for live callback wrappers.
 * A live wrapper forwards every call to the callback currently found at the wrapper's {@link OptionPath}
 * in the options currently stored in the wrapper's {@link OptionsCell}.
 * <p>
 * If the path no longer resolves to a callback implementing the called interface (shape drift),
 * the wrapper does nothing and returns {@code null}, or zero/{@code false} for primitive return types.
 * Exceptions thrown by the callback propagate unchanged.
 * <p>
 * If the callback is an {@link OptionMethod}, its {@code self} parameter receives
 * the immediate parent container of the callback in the latest options.
 * <p>
 * Default interface methods (like {@link java.util.function.Function#andThen(java.util.function.Function)})
 * are executed on the wrapper itself, so that composed callbacks stay live too.
 * Wrappers are equal only to themselves.
 *
 * @see OptionsCache
 * @see OptionMethod
 */
public final class LatestCallbacks {
	private LatestCallbacks() {
	}
	/**
	 * Creates live wrapper for the callback at the given path.
	 *
	 * @param <T>
	 *            type of the callback
	 * @param cell
	 *            cell holding the latest options
	 * @param path
	 *            location of the callback in the options
	 * @param template
	 *            the callback currently at the path, which determines interfaces implemented by the wrapper
	 * @return live wrapper implementing all interfaces of the {@code template} that proxies can implement
	 * @throws NullPointerException
	 *             if any parameter is {@code null}
	 * @throws IllegalArgumentException
	 *             if {@code template} is not {@linkplain OptionKind#CALLABLE callable}
	 */
	@SuppressWarnings("unchecked")
	public static <T> T wrap(OptionsCell<?> cell, OptionPath path, T template) {
		Objects.requireNonNull(cell);
		Objects.requireNonNull(path);
		Objects.requireNonNull(template);
		if (OptionKind.of(template) != OptionKind.CALLABLE)
			throw new IllegalArgumentException("Only callbacks can be wrapped.");
		LatestHandler handler = new LatestHandler(cell, path);
		List<Class<?>> interfaces = OptionKind.interfaces(template.getClass());
		/*
		 * Proxy implementing non-public interface must be defined by the loader of that interface.
		 */
		ClassLoader loader = template.getClass().getClassLoader();
		for (Class<?> iface : interfaces)
			if (!Modifier.isPublic(iface.getModifiers()))
				loader = iface.getClassLoader();
		return (T)Proxy.newProxyInstance(loader, interfaces.toArray(new Class<?>[interfaces.size()]), handler);
	}
	/**
	 * Checks whether the object is a live wrapper created by {@link #wrap(OptionsCell, OptionPath, Object)}.
	 *
	 * @param object
	 *            any object or {@code null}
	 * @return {@code true} if the object is a live wrapper
	 */
	public static boolean isWrapper(Object object) {
		return object != null && Proxy.isProxyClass(object.getClass()) && Proxy.getInvocationHandler(object) instanceof LatestHandler;
	}
	/**
	 * Returns path the live wrapper forwards to.
	 *
	 * @param wrapper
	 *            live wrapper
	 * @return path of the wrapped callback
	 * @throws IllegalArgumentException
	 *             if {@code wrapper} is not a live wrapper
	 */
	public static OptionPath path(Object wrapper) {
		if (!isWrapper(wrapper))
			throw new IllegalArgumentException("Not a live callback wrapper.");
		return ((LatestHandler)Proxy.getInvocationHandler(wrapper)).path;
	}
	/*
	 * Guava's handler base class takes care of equals(), hashCode(), and toString() with the usual proxy semantics.
	 * We only have to handle interface methods.
	 */
	private static class LatestHandler extends AbstractInvocationHandler {
		final OptionsCell<?> cell;
		final OptionPath path;
		/*
		 * Parent path and the last segment are derived once, because wrappers may be called very often, for example on every keystroke.
		 */
		final OptionPath parent;
		final OptionPath leaf;
		LatestHandler(OptionsCell<?> cell, OptionPath path) {
			this.cell = cell;
			this.path = path;
			parent = path.isRoot() ? null : path.parent();
			leaf = path.isRoot() ? null : OptionPath.of(path.last());
			OwnerTrace.of(this)
				.alias("callback")
				.parent(cell)
				.tag("path", path.toString());
		}
		@Override
		protected Object handleInvocation(Object proxy, Method method, Object[] args) throws Throwable {
			if (method.isDefault())
				return InvocationHandler.invokeDefault(proxy, method, args);
			/*
			 * Read the cell only once. Parent and callback must come from the same options object.
			 */
			Object latest = cell.get();
			Object container = parent != null ? parent.resolve(latest) : null;
			Object callback = parent != null ? leaf.resolve(container) : latest;
			/*
			 * Shape drift. Callback was removed, replaced with data, or replaced with callback of different type.
			 * This is not an error. Consumers may legitimately call handlers that application no longer provides.
			 */
			if (!method.getDeclaringClass().isInstance(callback) || OptionKind.of(callback) != OptionKind.CALLABLE)
				return Defaults.defaultValue(method.getReturnType());
			if (method.getDeclaringClass() == OptionMethod.class) {
				args = args.clone();
				args[0] = container;
			}
			if (!Modifier.isPublic(method.getDeclaringClass().getModifiers()))
				method.setAccessible(true);
			try {
				return method.invoke(callback, args);
			} catch (InvocationTargetException ex) {
				/*
				 * Unwrap, so that the caller sees the same exception the callback threw.
				 */
				throw ex.getCause();
			}
		}
		@Override
		public String toString() {
			return OwnerTrace.of(this).toString();
		}
	}
}
