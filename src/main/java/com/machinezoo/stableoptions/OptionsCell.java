// Part of Stable Options
package com.machinezoo.stableoptions;

import com.machinezoo.stableoptions.util.*;

/*
 * Callback wrappers must call the latest callback, which means they need access to the latest options.
 * The latest options could be kept in a static or thread-local field, but then independent caches would overwrite each other.
 * We instead keep them in an explicit cell object owned by one cache and shared with all wrappers created by that cache.
 *
 * Unlike the cache itself, the cell is overwritten on every update, even when the new options compare equal to the old ones.
 * Equal options may carry different callbacks and wrappers have to see them.
 */
/**
 * Mutable holder of the latest options.
 * Every {@link OptionsCache} writes into one cell and all callback wrappers created by the cache read from it.
 * <p>
 * Reads and writes are visible across threads, but concurrent writes are not supported.
 * Cell is normally written only by its owning {@link OptionsCache}.
 *
 * @param <T>
 *            type of the stored options
 *
 * @see OptionsCache
 * @see LatestCallbacks
 */
public class OptionsCell<T> {
	private volatile T value;
	/*
	 * Version is incremented on every write, including writes of equal or identical options.
	 * It tells how many renders the cell has seen, which is useful in debugging and tests.
	 * We start with version 1 for an empty cell, so that 0 can mean "never observed" in application code.
	 */
	private volatile long version = 1;
	/**
	 * Creates empty cell holding {@code null}.
	 */
	public OptionsCell() {
		OwnerTrace.of(this).alias("cell");
	}
	/**
	 * Creates cell holding the provided options.
	 *
	 * @param value
	 *            initial content of the cell, possibly {@code null}
	 */
	public OptionsCell(T value) {
		this();
		this.value = value;
	}
	/**
	 * Returns the latest options written into this cell.
	 *
	 * @return latest options or {@code null}
	 */
	public T get() {
		return value;
	}
	/**
	 * Replaces content of the cell and increments {@link #version()}.
	 * No equality check is performed. Every write is a new version.
	 *
	 * @param value
	 *            new content of the cell, possibly {@code null}
	 */
	public void set(T value) {
		this.value = value;
		++version;
	}
	/**
	 * Returns number of writes into this cell plus one.
	 *
	 * @return current version of the cell
	 */
	public long version() {
		return version;
	}
	/*
	 * Options are not printed. They may be large or even cyclic.
	 */
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " @ " + version;
	}
}
