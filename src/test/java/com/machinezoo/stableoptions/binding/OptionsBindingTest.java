// Part of Stable Options
package com.machinezoo.stableoptions.binding;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.function.*;
import org.junit.jupiter.api.*;
import com.machinezoo.stableoptions.*;

public class OptionsBindingTest {
	public static class FakeWidget implements OptionsWidget {
		final List<Map<String, Object>> configurations = new ArrayList<>();
		final Map<String, List<Consumer<Object>>> listeners = new LinkedHashMap<>();
		String status = "idle";
		@Override
		public void setOptions(Map<String, Object> options) {
			configurations.add(options);
		}
		@Override
		public Runnable addListener(String event, Consumer<Object> listener) {
			listeners.computeIfAbsent(event, e -> new ArrayList<>()).add(listener);
			return () -> listeners.get(event).remove(listener);
		}
		void emit(String event, Object detail) {
			for (Consumer<Object> listener : new ArrayList<>(listeners.getOrDefault(event, List.of())))
				listener.accept(detail);
		}
		int listenerCount() {
			return listeners.values().stream().mapToInt(List::size).sum();
		}
	}
	private final OptionsBinding<FakeWidget> binding = new OptionsBinding<FakeWidget>("chatkit")
		.event("chatkit.response.end")
		.event("chatkit.error")
		.event("chatkit.response.start");
	private final FakeWidget widget = new FakeWidget();
	private final List<Object> received = new ArrayList<>();
	private Map<String, Object> options(String theme, String tag) {
		Map<String, Object> options = new LinkedHashMap<>();
		options.put("theme", theme);
		options.put("onResponseEnd", (Consumer<Object>)detail -> received.add(tag + ":" + detail));
		return options;
	}
	@Test
	public void events() {
		assertThat(binding.events().keySet(), contains("chatkit.response.end", "chatkit.error", "chatkit.response.start"));
		assertEquals("onResponseEnd", binding.events().get("chatkit.response.end"));
	}
	// Equal options produce the same control and the widget is not reconfigured.
	@Test
	public void stableControl() {
		binding.mount(widget);
		OptionsControl first = binding.render(options("dark", "v1"));
		OptionsControl second = binding.render(options("dark", "v2"));
		assertSame(first, second);
		assertEquals(1, widget.configurations.size());
		assertEquals(Map.of("theme", "dark"), widget.configurations.get(0));
		binding.render(options("light", "v3"));
		assertEquals(2, widget.configurations.size());
		assertEquals("light", widget.configurations.get(1).get("theme"));
	}
	// Events reach the handler from the latest render, even though listeners were registered only once.
	@Test
	public void latestHandler() {
		binding.render(options("dark", "v1"));
		binding.mount(widget);
		assertEquals(3, widget.listenerCount());
		widget.emit("chatkit.response.end", "a");
		binding.render(options("dark", "v2"));
		widget.emit("chatkit.response.end", "b");
		assertThat(received, contains("v1:a", "v2:b"));
	}
	@Test
	public void mountPushesConfiguration() {
		binding.render(options("dark", "v1"));
		assertTrue(widget.configurations.isEmpty());
		binding.mount(widget);
		assertSame(widget, binding.widget());
		assertEquals(List.of(Map.of("theme", "dark")), widget.configurations);
	}
	@Test
	public void handlerTypes() {
		Map<String, Object> options = new LinkedHashMap<>();
		options.put("onResponseStart", (Runnable)() -> received.add("start"));
		options.put("onError", (OptionMethod)(self, args) -> received.add("error:" + args[0]));
		binding.render(options);
		binding.mount(widget);
		widget.emit("chatkit.response.start", null);
		widget.emit("chatkit.error", "boom");
		assertThat(received, contains("start", "error:boom"));
	}
	// Handler exceptions are logged and they don't reach the widget.
	@Test
	public void failingHandler() {
		Map<String, Object> options = new LinkedHashMap<>();
		options.put("onError", (Consumer<Object>)detail -> {
			throw new IllegalStateException("handler failure");
		});
		binding.render(options);
		binding.mount(widget);
		assertDoesNotThrow(() -> widget.emit("chatkit.error", "x"));
	}
	// Events without handler are ignored.
	@Test
	public void missingHandler() {
		binding.render(Map.of("theme", "dark"));
		binding.mount(widget);
		assertDoesNotThrow(() -> widget.emit("chatkit.response.end", "x"));
	}
	@Test
	public void excluded() {
		Map<String, Object> options = options("dark", "v1");
		options.put("onClientTool", (Function<Object, Object>)x -> x);
		binding.exclude("onClientTool");
		OptionsControl control = binding.render(options);
		assertThat(control.handlers().keySet(), contains("onResponseEnd"));
		assertThat(control.configuration().keySet(), contains("theme", "onClientTool"));
	}
	@Test
	public void unmount() {
		binding.render(options("dark", "v1"));
		binding.mount(widget);
		binding.unmount();
		assertNull(binding.widget());
		assertEquals(0, widget.listenerCount());
		widget.emit("chatkit.response.end", "x");
		assertThat(received, is(empty()));
		// Configuration changes are not pushed to unmounted widget.
		binding.render(options("light", "v1"));
		assertEquals(1, widget.configurations.size());
	}
	// Mounting another widget detaches the previous one.
	@Test
	public void remount() {
		binding.render(options("dark", "v1"));
		binding.mount(widget);
		FakeWidget replacement = new FakeWidget();
		binding.mount(replacement);
		assertEquals(0, widget.listenerCount());
		assertEquals(3, replacement.listenerCount());
		replacement.emit("chatkit.response.end", "x");
		assertThat(received, contains("v1:x"));
	}
	@Test
	public void eventsBeforeMount() {
		binding.mount(widget);
		assertThrows(IllegalStateException.class, () -> binding.event("chatkit.thread.change"));
	}
	@Test
	public void call() {
		assertNull(binding.call(w -> w.status));
		binding.mount(widget);
		assertEquals("idle", binding.call(w -> w.status));
	}
	@Test
	public void renderNull() {
		assertThrows(NullPointerException.class, () -> binding.render(null));
	}
}
