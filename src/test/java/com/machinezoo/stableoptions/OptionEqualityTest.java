// Part of Stable Options
package com.machinezoo.stableoptions;

import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.*;
import java.util.function.*;
import org.junit.jupiter.api.*;

public class OptionEqualityTest {
	private static Map<String, Object> record(Object... pairs) {
		Map<String, Object> map = new LinkedHashMap<>();
		for (int i = 0; i < pairs.length; i += 2)
			map.put((String)pairs[i], pairs[i + 1]);
		return map;
	}
	@Test
	public void primitives() {
		assertTrue(OptionEquality.equal(null, null));
		assertTrue(OptionEquality.equal(1, 1));
		assertTrue(OptionEquality.equal("a", "a"));
		assertTrue(OptionEquality.equal(true, true));
		assertFalse(OptionEquality.equal(1, 2));
		assertFalse(OptionEquality.equal(null, "a"));
		assertFalse(OptionEquality.equal("a", null));
		assertFalse(OptionEquality.equal(null, record()));
	}
	// No coercion between types.
	@Test
	public void types() {
		assertFalse(OptionEquality.equal("1", 1));
		assertFalse(OptionEquality.equal(1, 1L));
		assertFalse(OptionEquality.equal(1, 1.0));
		assertFalse(OptionEquality.equal(0, false));
	}
	// Value semantics of boxed doubles: NaN equals itself, but positive and negative zero differ.
	@Test
	public void floatingPoint() {
		assertTrue(OptionEquality.equal(Double.NaN, Double.NaN));
		assertTrue(OptionEquality.equal(Float.NaN, Float.NaN));
		assertFalse(OptionEquality.equal(0.0, -0.0));
	}
	// Callbacks are always considered equal, no matter what they do.
	@Test
	public void callbacks() {
		assertTrue(OptionEquality.equal(record("x", 1, "onClick", (Supplier<Integer>)() -> 1), record("x", 1, "onClick", (Supplier<Integer>)() -> 2)));
		// Even callbacks of different types compare equal.
		assertTrue(OptionEquality.equal((Runnable)() -> {
		}, (Supplier<Integer>)() -> 1));
		// But callback is not equal to data.
		assertFalse(OptionEquality.equal(record("onClick", (Runnable)() -> {
		}), record("onClick", null)));
		assertFalse(OptionEquality.equal(record("onClick", (Runnable)() -> {
		}), record("onClick", "handler")));
	}
	@Test
	public void nestedCallbacks() {
		Map<String, Object> a = record("handlers", List.of(record("name", "save", "run", (Runnable)() -> {
		})));
		Map<String, Object> b = record("handlers", List.of(record("name", "save", "run", (Runnable)() -> {
		})));
		Map<String, Object> c = record("handlers", List.of(record("name", "load", "run", (Runnable)() -> {
		})));
		assertTrue(OptionEquality.equal(a, b));
		assertFalse(OptionEquality.equal(a, c));
	}
	@Test
	public void records() {
		assertTrue(OptionEquality.equal(record(), record()));
		assertTrue(OptionEquality.equal(record("a", 1, "b", "x"), record("a", 1, "b", "x")));
		// Key order does not matter.
		assertTrue(OptionEquality.equal(record("a", 1, "b", 2), record("b", 2, "a", 1)));
		assertFalse(OptionEquality.equal(record("a", 1), record("a", 2)));
		assertFalse(OptionEquality.equal(record("a", 1), record("b", 1)));
		assertFalse(OptionEquality.equal(record("a", 1), record("a", 1, "b", 2)));
		// Key with null value differs from missing key.
		assertFalse(OptionEquality.equal(record("a", 1, "b", null), record("a", 1, "c", null)));
		// Different map implementations are fine.
		assertTrue(OptionEquality.equal(Map.of("a", 1), new TreeMap<>(Map.of("a", 1))));
	}
	@Test
	public void sequences() {
		assertTrue(OptionEquality.equal(List.of(), List.of()));
		assertTrue(OptionEquality.equal(List.of(1, 2, 3), List.of(1, 2, 3)));
		assertFalse(OptionEquality.equal(List.of(1, 2, 3), List.of(1, 3, 2)));
		assertFalse(OptionEquality.equal(List.of(1, 2), List.of(1, 2, 3)));
		assertTrue(OptionEquality.equal(new int[] { 1, 2 }, new int[] { 1, 2 }));
		assertFalse(OptionEquality.equal(new int[] { 1, 2 }, new int[] { 2, 1 }));
		// Lists and arrays are both sequences.
		assertTrue(OptionEquality.equal(List.of("a", "b"), new String[] { "a", "b" }));
		// Sequence is not a record.
		assertFalse(OptionEquality.equal(List.of(), record()));
	}
	@Test
	public void sequenceCallbacks() {
		List<Object> a = List.of((Runnable)() -> {
		}, 1);
		List<Object> b = List.of((Runnable)() -> {
		}, 1);
		assertTrue(OptionEquality.equal(a, b));
	}
	// Opaque objects are compared by reference, even when they would be equal by equals().
	@Test
	public void opaque() {
		Date date = new Date(0);
		assertTrue(OptionEquality.equal(date, date));
		assertFalse(OptionEquality.equal(new Date(0), new Date(0)));
		assertFalse(OptionEquality.equal(Instant.ofEpochSecond(100), Instant.ofEpochSecond(100)));
		assertFalse(OptionEquality.equal(new HashSet<>(Set.of(1)), new HashSet<>(Set.of(1))));
		assertFalse(OptionEquality.equal(Map.of(1, "a"), Map.of(1, "a")));
		assertFalse(OptionEquality.equal(record("when", new Date(0)), record("when", new Date(0))));
		assertTrue(OptionEquality.equal(record("when", date), record("when", date)));
	}
	@Test
	public void cycles() {
		Map<String, Object> a = record("x", 1);
		a.put("self", a);
		Map<String, Object> b = record("x", 1);
		b.put("self", b);
		Map<String, Object> c = record("x", 2);
		c.put("self", c);
		assertTrue(OptionEquality.equal(a, a));
		assertTrue(OptionEquality.equal(a, b));
		assertFalse(OptionEquality.equal(a, c));
	}
	// Cycles of different length still compare equal if they cannot be told apart by walking them.
	@Test
	public void unevenCycles() {
		Map<String, Object> single = record("x", 1);
		single.put("next", single);
		Map<String, Object> first = record("x", 1);
		Map<String, Object> second = record("x", 1, "next", first);
		first.put("next", second);
		assertTrue(OptionEquality.equal(single, first));
		second.put("x", 2);
		assertFalse(OptionEquality.equal(single, first));
	}
	@Test
	public void sequenceCycles() {
		List<Object> a = new ArrayList<>();
		a.add(1);
		a.add(a);
		List<Object> b = new ArrayList<>();
		b.add(1);
		b.add(b);
		assertTrue(OptionEquality.equal(a, b));
		b.set(0, 2);
		assertFalse(OptionEquality.equal(a, b));
	}
	// Shared subtree compared against two separate copies must not produce false negative.
	@Test
	public void sharedSubtrees() {
		Map<String, Object> shared = record("k", 1);
		Map<String, Object> left = record("p", shared, "q", shared);
		assertTrue(OptionEquality.equal(left, record("p", record("k", 1), "q", record("k", 1))));
		assertFalse(OptionEquality.equal(left, record("p", record("k", 1), "q", record("k", 2))));
	}
	// Misbehaving collections make options look changed, but they never throw.
	@Test
	public void brokenList() {
		List<Object> broken = new AbstractList<>() {
			@Override
			public Object get(int index) {
				throw new IllegalStateException();
			}
			@Override
			public int size() {
				return 1;
			}
		};
		assertFalse(OptionEquality.equal(broken, List.of(1)));
	}
}
