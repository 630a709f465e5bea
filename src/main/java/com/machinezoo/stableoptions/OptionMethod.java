// Part of Stable Options
package com.machinezoo.stableoptions;

/*
 * Java lambdas have no receiver. Callbacks that need sibling options (a multiplier next to the multiplying function, for example)
 * would have to capture the whole options object, which would make them stale as soon as the options are recreated.
 * This interface passes the parent container explicitly instead. Live wrappers substitute the parent from the latest options,
 * so the callback always sees current siblings even if the caller passes something else or nothing at all.
 */
/**
 * Callback that receives its parent container as the first parameter.
 * When placed in options managed by {@link OptionsCache}, the live wrapper that replaces it
 * ignores the {@code self} argument supplied by the caller and passes
 * the immediate parent record or sequence from the latest options instead.
 * <p>
 * Callers of wrapped methods will usually use the {@link #invoke(Object...)} shorthand.
 *
 * @see LatestCallbacks
 */
@FunctionalInterface
public interface OptionMethod {
	/**
	 * Executes the callback.
	 *
	 * @param self
	 *            parent container of this callback (a {@link java.util.Map} or a sequence), or {@code null} for top-level callback
	 * @param args
	 *            callback arguments
	 * @return callback result or {@code null}
	 */
	Object call(Object self, Object... args);
	/**
	 * Executes the callback without specifying the parent container.
	 * This is only useful on live wrappers, which supply the parent container automatically.
	 *
	 * @param args
	 *            callback arguments
	 * @return callback result or {@code null}
	 */
	default Object invoke(Object... args) {
		return call(null, args);
	}
}
