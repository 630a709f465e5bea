// Part of Stable Options
package com.machinezoo.stableoptions.binding;

import java.util.*;
import java.util.function.*;

/**
 * Stateful consumer of options, typically a long-lived widget.
 * Reconfiguration via {@link #setOptions(Map)} is assumed to be expensive.
 *
 * @see OptionsBinding
 */
public interface OptionsWidget {
	/**
	 * Reconfigures the widget.
	 *
	 * @param options
	 *            configuration partition of shaped options
	 */
	void setOptions(Map<String, Object> options);
	/**
	 * Subscribes to widget event.
	 *
	 * @param event
	 *            dotted event name, for example {@code chatkit.response.end}
	 * @param listener
	 *            callback receiving event detail, which may be {@code null}
	 * @return action that removes the listener
	 */
	Runnable addListener(String event, Consumer<Object> listener);
}
