// Part of Stable Options
package com.machinezoo.stableoptions.binding;

import java.util.*;
import java.util.regex.*;

/*
 * Widgets emit dotted event names like "chatkit.response.end", while options use camel-case handler keys like "onResponseEnd".
 * Handler keys are recognized purely by naming convention, because handlers and other callbacks look the same in options.
 */
/**
 * Naming convention for event handler keys in options.
 */
public final class HandlerKeys {
	private HandlerKeys() {
	}
	private static final Pattern pattern = Pattern.compile("^on[A-Z]");
	/**
	 * Checks whether the options key names an event handler.
	 * Handler keys start with {@code on} followed by an uppercase letter, for example {@code onError}.
	 *
	 * @param key
	 *            options key
	 * @return {@code true} if the key follows handler naming convention
	 */
	public static boolean isHandler(String key) {
		return key != null && pattern.matcher(key).find();
	}
	/**
	 * Derives handler key from widget event name.
	 * Event name is split on dots. Leading {@code prefix} segment is dropped if present.
	 * Remaining segments are capitalized and joined after {@code on}.
	 * For example, event {@code chatkit.response.end} with prefix {@code chatkit} maps to {@code onResponseEnd}.
	 *
	 * @param prefix
	 *            widget-specific event prefix to drop or {@code null} to keep all segments
	 * @param event
	 *            dotted event name
	 * @return handler key for the event
	 * @throws IllegalArgumentException
	 *             if the event name has no segments after the prefix
	 */
	public static String fromEvent(String prefix, String event) {
		Objects.requireNonNull(event);
		List<String> segments = new ArrayList<>(Arrays.asList(event.split("\\.")));
		segments.removeIf(String::isEmpty);
		if (prefix != null && !segments.isEmpty() && segments.get(0).equals(prefix))
			segments.remove(0);
		if (segments.isEmpty())
			throw new IllegalArgumentException("Event name has no segments after prefix: " + event);
		StringBuilder key = new StringBuilder("on");
		for (String segment : segments)
			key.append(Character.toUpperCase(segment.charAt(0))).append(segment.substring(1));
		return key.toString();
	}
}
