// Part of Stable Options
package com.machinezoo.stableoptions.binding;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.noexception.*;
import com.machinezoo.stableoptions.*;
import com.machinezoo.stableoptions.util.*;

/*
 * This is the glue between a UI layer that produces new options on every render and a widget that must not be reconfigured needlessly.
 *
 * Configuration is pushed to the widget only when the shaped options change identity, i.e. when something meaningful changed.
 * Event listeners are registered once per mount. They look up the handler in the current control at dispatch time,
 * and since handlers are live wrappers, they end up calling the callback from the latest render.
 *
 * Widget may be mounted after the first render or remounted later. Imperative calls to the widget made while nothing is mounted
 * are not errors. They happen routinely during UI transitions. We just log them and return null.
 */
/**
 * Binding of options produced on every render to a long-lived {@link OptionsWidget}.
 * Call {@link #render(Map)} on every render and {@link #mount(OptionsWidget)}/{@link #unmount()} when the widget appears or disappears.
 * <p>
 * Events the widget emits are listed via {@link #event(String)} before mounting.
 * Handler key for every event is derived via {@link HandlerKeys#fromEvent(String, String)}.
 * <p>
 * {@code OptionsBinding} is not thread-safe. It is expected to be used from the UI thread.
 *
 * @param <W>
 *            type of the widget
 */
public class OptionsBinding<W extends OptionsWidget> {
	private static final Logger logger = LoggerFactory.getLogger(OptionsBinding.class);
	private final OptionsCache<Map<String, Object>> cache = new OptionsCache<>();
	public OptionsCache<Map<String, Object>> cache() {
		return cache;
	}
	private final String prefix;
	/**
	 * Creates binding for widget with the given event prefix.
	 *
	 * @param prefix
	 *            leading segment of widget's event names that is dropped when deriving handler keys, or {@code null}
	 */
	public OptionsBinding(String prefix) {
		this.prefix = prefix;
		OwnerTrace.of(this)
			.alias("binding")
			.tag("prefix", prefix);
		OwnerTrace.of(cache).parent(this);
	}
	/*
	 * Event name to handler key. Ordered, so that listeners are registered in predictable order.
	 */
	private final Map<String, String> events = new LinkedHashMap<>();
	public Map<String, String> events() {
		return Collections.unmodifiableMap(events);
	}
	/**
	 * Registers widget event to listen to.
	 * Events must be registered before the widget is mounted.
	 *
	 * @param event
	 *            dotted event name
	 * @return {@code this} (fluent method)
	 * @throws IllegalStateException
	 *             if the widget is already mounted
	 */
	public OptionsBinding<W> event(String event) {
		if (widget != null)
			throw new IllegalStateException("Events must be registered before mounting the widget.");
		events.put(event, HandlerKeys.fromEvent(prefix, event));
		return this;
	}
	private final Set<String> excluded = new HashSet<>();
	/**
	 * Declares that the key follows handler naming convention but belongs to configuration.
	 * Exclusions must be declared before the first {@link #render(Map)}.
	 *
	 * @param key
	 *            options key
	 * @return {@code this} (fluent method)
	 */
	public OptionsBinding<W> exclude(String key) {
		Objects.requireNonNull(key);
		excluded.add(key);
		return this;
	}
	private Map<String, Object> shaped;
	private OptionsControl control;
	/**
	 * Returns control produced by the last call to {@link #render(Map)}.
	 *
	 * @return current control or {@code null} if nothing was rendered yet
	 */
	public OptionsControl control() {
		return control;
	}
	/**
	 * Accepts options for the current render.
	 * Returned control is the same object as long as the options are structurally equal to previously accepted options.
	 * When the control changes and a widget is mounted, widget's configuration is updated.
	 *
	 * @param options
	 *            options for this render
	 * @return control holding shaped handlers and configuration
	 * @throws NullPointerException
	 *             if {@code options} is {@code null}
	 */
	public OptionsControl render(Map<String, Object> options) {
		Objects.requireNonNull(options);
		Map<String, Object> shaped = cache.update(options);
		if (control == null || shaped != this.shaped) {
			this.shaped = shaped;
			control = OptionsControl.split(shaped, excluded);
			if (widget != null)
				widget.setOptions(control.configuration());
		}
		return control;
	}
	private W widget;
	public W widget() {
		return widget;
	}
	private final List<Runnable> subscriptions = new ArrayList<>();
	/**
	 * Attaches the widget. Current configuration is pushed to the widget and listeners are registered for all events.
	 * Previously mounted widget, if any, is unmounted first.
	 *
	 * @param widget
	 *            widget to attach
	 * @throws NullPointerException
	 *             if {@code widget} is {@code null}
	 */
	public void mount(W widget) {
		Objects.requireNonNull(widget);
		if (this.widget != null)
			unmount();
		this.widget = widget;
		if (control != null)
			widget.setOptions(control.configuration());
		for (Map.Entry<String, String> entry : events.entrySet()) {
			String handler = entry.getValue();
			subscriptions.add(widget.addListener(entry.getKey(), detail -> dispatch(handler, detail)));
		}
	}
	/**
	 * Detaches the widget and removes all listeners. Does nothing if no widget is mounted.
	 */
	public void unmount() {
		for (Runnable subscription : subscriptions)
			Exceptions.log(logger).run(subscription);
		subscriptions.clear();
		widget = null;
	}
	/*
	 * Handler exceptions must not propagate into the widget's event loop. Nobody there knows what to do with them.
	 */
	private void dispatch(String key, Object detail) {
		OptionsControl control = this.control;
		if (control == null)
			return;
		Object handler = control.handlers().get(key);
		Exceptions.log(logger).run(() -> invoke(handler, detail));
	}
	@SuppressWarnings("unchecked")
	private static void invoke(Object handler, Object detail) {
		if (handler instanceof Consumer)
			((Consumer<Object>)handler).accept(detail);
		else if (handler instanceof Runnable)
			((Runnable)handler).run();
		else if (handler instanceof OptionMethod)
			((OptionMethod)handler).invoke(detail);
	}
	/**
	 * Forwards imperative call to the mounted widget.
	 * If no widget is mounted, warning is logged and {@code null} is returned.
	 *
	 * @param <R>
	 *            type of the result
	 * @param method
	 *            call to perform on the widget
	 * @return result of the call or {@code null} if no widget is mounted
	 */
	public <R> R call(Function<W, R> method) {
		Objects.requireNonNull(method);
		if (widget == null) {
			logger.warn("Widget is not mounted: {}", this);
			return null;
		}
		return method.apply(widget);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
