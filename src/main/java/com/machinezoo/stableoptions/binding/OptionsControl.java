// Part of Stable Options
package com.machinezoo.stableoptions.binding;

import java.util.*;
import com.google.common.collect.*;

/*
 * Widgets consume handlers and configuration differently. Handlers are registered as event listeners once,
 * while configuration is pushed to the widget whenever it changes. So we split shaped options in two.
 *
 * Some callbacks follow handler naming convention but are really part of configuration (a tool callback for example).
 * Callers can exclude such keys from the handler partition.
 */
/**
 * Partition of shaped options into event handlers and widget configuration.
 * Instances are immutable.
 *
 * @see OptionsBinding
 */
public final class OptionsControl {
	private final Map<String, Object> handlers;
	/**
	 * Returns options entries with {@linkplain HandlerKeys#isHandler(String) handler keys}.
	 *
	 * @return unmodifiable map of handlers
	 */
	public Map<String, Object> handlers() {
		return handlers;
	}
	private final Map<String, Object> configuration;
	/**
	 * Returns all options entries that are not handlers.
	 *
	 * @return unmodifiable map of configuration entries
	 */
	public Map<String, Object> configuration() {
		return configuration;
	}
	private OptionsControl(Map<String, Object> handlers, Map<String, Object> configuration) {
		this.handlers = Collections.unmodifiableMap(handlers);
		this.configuration = Collections.unmodifiableMap(configuration);
	}
	/**
	 * Splits shaped options into handlers and configuration.
	 * Insertion order of the options is preserved in both partitions. Options entries may have {@code null} values.
	 *
	 * @param options
	 *            shaped options, usually returned from {@link com.machinezoo.stableoptions.OptionsCache#update(Object)}
	 * @param excluded
	 *            keys that follow handler naming convention but belong to configuration
	 * @return partitioned options
	 * @throws NullPointerException
	 *             if {@code options} or {@code excluded} is {@code null}
	 */
	public static OptionsControl split(Map<String, Object> options, Set<String> excluded) {
		Objects.requireNonNull(options);
		Objects.requireNonNull(excluded);
		Map<String, Object> handlers = new LinkedHashMap<>();
		Map<String, Object> configuration = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : options.entrySet()) {
			if (HandlerKeys.isHandler(entry.getKey()) && !excluded.contains(entry.getKey()))
				handlers.put(entry.getKey(), entry.getValue());
			else
				configuration.put(entry.getKey(), entry.getValue());
		}
		return new OptionsControl(handlers, configuration);
	}
	public static OptionsControl split(Map<String, Object> options) {
		return split(options, ImmutableSet.of());
	}
	@Override
	public String toString() {
		return "OptionsControl" + handlers.keySet() + configuration.keySet();
	}
}
