// Part of Stable Options
package com.machinezoo.stableoptions;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class OptionsCellTest {
	@Test
	public void empty() {
		OptionsCell<String> cell = new OptionsCell<>();
		assertNull(cell.get());
		assertEquals(1, cell.version());
	}
	@Test
	public void initial() {
		OptionsCell<String> cell = new OptionsCell<>("value");
		assertEquals("value", cell.get());
		assertEquals(1, cell.version());
	}
	// Every write counts, even if it writes the same value.
	@Test
	public void versions() {
		Map<String, Object> options = Map.of("a", 1);
		OptionsCell<Map<String, Object>> cell = new OptionsCell<>();
		cell.set(options);
		assertSame(options, cell.get());
		assertEquals(2, cell.version());
		cell.set(options);
		assertEquals(3, cell.version());
		cell.set(null);
		assertNull(cell.get());
		assertEquals(4, cell.version());
	}
	// Cyclic options must not break toString().
	@Test
	public void print() {
		Map<String, Object> options = new HashMap<>();
		options.put("self", options);
		OptionsCell<Map<String, Object>> cell = new OptionsCell<>(options);
		assertTrue(cell.toString().contains("cell"));
	}
}
