// Part of Stable Options
package com.machinezoo.stableoptions;

import java.util.*;
import com.machinezoo.stableoptions.util.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * UI layers recreate options on every render. Stateful consumers (widgets) must not be reconfigured on every render,
 * because reconfiguration is expensive and it may reset widget state. Consumers detect changes by comparing references,
 * so we have to keep returning the same options object for as long as nothing meaningful changes.
 *
 * This is a single-entry cache. There's no point in keeping older entries around,
 * because options never return to earlier state in a way that would make the old consumer-side state valid again.
 *
 * Callbacks are ignored when deciding whether options changed. Returned options contain live wrappers instead of callbacks
 * and the wrappers forward to callbacks in the latest options, so the consumer always calls current callbacks
 * even though it keeps the old options object.
 */
/**
 * Single-entry cache that stabilizes identity of options objects across renders.
 * Every render calls {@link #update(Object)} with freshly created options.
 * The method returns the same shaped options object for as long as the options are
 * {@linkplain OptionEquality#equal(Object, Object) structurally equal} to the previously accepted options.
 * Callbacks in shaped options are {@linkplain LatestCallbacks live wrappers} that always call the callback from the latest options.
 * <p>
 * Cache is bound to one {@link OptionsCell}, which is updated on every call to {@link #update(Object)}.
 * <p>
 * {@code OptionsCache} is not thread-safe. It is expected to be updated from single thread, typically the UI thread.
 * Live wrappers can be called from any thread.
 *
 * @param <T>
 *            type of the options
 *
 * @see OptionEquality
 * @see LatestCallbacks
 */
public class OptionsCache<T> {
	private static final Counter reuses = Metrics.counter("stableoptions.cache.reuses");
	private static final Counter rebuilds = Metrics.counter("stableoptions.cache.rebuilds");
	private static final Timer shaping = Metrics.timer("stableoptions.cache.shaping");
	private final OptionsCell<T> cell;
	/**
	 * Returns the cell holding the latest options.
	 *
	 * @return cell this cache writes into
	 */
	public OptionsCell<T> cell() {
		return cell;
	}
	/*
	 * Accepted options and their shaped copy are always replaced together, so that they never disagree.
	 */
	private static class Entry<T> {
		final T snapshot;
		final T shaped;
		Entry(T snapshot, T shaped) {
			this.snapshot = snapshot;
			this.shaped = shaped;
		}
	}
	private Entry<T> entry;
	private long generation;
	/**
	 * Returns number of times the shaped options were rebuilt.
	 * This is zero before the first call to {@link #update(Object)}.
	 *
	 * @return number of rebuilds
	 */
	public long generation() {
		return generation;
	}
	/**
	 * Returns shaped options returned by the last call to {@link #update(Object)}.
	 *
	 * @return current shaped options or {@code null} if the cache was never updated
	 */
	public T current() {
		Entry<T> entry = this.entry;
		return entry != null ? entry.shaped : null;
	}
	/**
	 * Creates cache with its own private {@link OptionsCell}.
	 */
	public OptionsCache() {
		this(new OptionsCell<>());
	}
	/**
	 * Creates cache bound to the provided {@link OptionsCell}.
	 * Cell should not be shared with another cache. Caches would overwrite each other's options.
	 *
	 * @param cell
	 *            cell to write the latest options into
	 * @throws NullPointerException
	 *             if {@code cell} is {@code null}
	 */
	public OptionsCache(OptionsCell<T> cell) {
		Objects.requireNonNull(cell);
		this.cell = cell;
		OwnerTrace.of(this).alias("options").generateId();
		OwnerTrace.of(cell).parent(this);
	}
	/*
	 * Nothing in update() calls application callbacks, so reentrancy can only happen from application-defined collections
	 * that run arbitrary code while being iterated. It is nevertheless a bug in application code and we would rather report it
	 * than return options shaped from partially updated state.
	 *
	 * Comparison and shaping swallow exceptions thrown from inside collections, including the one thrown by the nested call.
	 * So the nested call also leaves a mark that makes the outer call fail.
	 */
	private boolean updating;
	private boolean reentered;
	/**
	 * Accepts new options and returns their shaped version.
	 * The options are always written into {@link #cell()}, so that live wrappers immediately forward to the new callbacks.
	 * If the options are {@linkplain OptionEquality#equal(Object, Object) structurally equal} to the previously accepted options,
	 * previously returned shaped options are returned again.
	 * Otherwise new shaped options are built, cached, and returned.
	 * <p>
	 * Shaped options mirror the structure of the accepted options.
	 * Records become unmodifiable {@link Map}s, lists become unmodifiable {@link List}s, arrays are copied,
	 * and callbacks are replaced with {@linkplain LatestCallbacks live wrappers}.
	 * Primitives and opaque objects are passed through unchanged. Cycles are reproduced.
	 * Subtrees reachable via several paths are copied once per path.
	 * Collections that fail while being iterated are passed through unchanged.
	 *
	 * @param snapshot
	 *            options for the current render, possibly {@code null}
	 * @return shaped options
	 * @throws IllegalStateException
	 *             if called while another {@code update(Object)} on the same cache is in progress,
	 *             in which case both calls fail and the cache keeps its previously shaped options
	 */
	public T update(T snapshot) {
		if (updating) {
			reentered = true;
			throw new IllegalStateException("Options cache is already being updated.");
		}
		updating = true;
		reentered = false;
		try {
			cell.set(snapshot);
			Entry<T> entry = this.entry;
			if (entry != null && OptionEquality.equal(entry.snapshot, snapshot)) {
				checkReentrancy();
				reuses.increment();
				return entry.shaped;
			}
			return rebuild(snapshot);
		} finally {
			updating = false;
		}
	}
	private void checkReentrancy() {
		if (reentered)
			throw new IllegalStateException("Options cache was updated from within update().");
	}
	/*
	 * Rebuilds are rare (they happen only when options actually change), so we can afford to trace every one of them.
	 */
	private T rebuild(T snapshot) {
		Span span = GlobalTracer.get().buildSpan("stableoptions.rebuild")
			.withTag("component", "stableoptions")
			.start();
		OwnerTrace.of(this).fill(span);
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			Timer.Sample sample = Timer.start(Clock.SYSTEM);
			T shaped = OptionsShaper.shape(cell, snapshot);
			sample.stop(shaping);
			checkReentrancy();
			entry = new Entry<>(snapshot, shaped);
			++generation;
			rebuilds.increment();
			span.setTag("generation", generation);
			return shaped;
		} finally {
			span.finish();
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " #" + generation;
	}
}
