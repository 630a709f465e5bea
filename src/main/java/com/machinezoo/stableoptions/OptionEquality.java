// Part of Stable Options
package com.machinezoo.stableoptions;

import java.util.*;
import org.slf4j.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Equality testing decides whether the consumer of options has to be reconfigured.
 * Object.equals() is not usable for that. Callbacks are recreated on every render and they never compare equal.
 * Reference equality is not usable either, because the whole options tree is recreated on every render.
 * We need structural equality that looks through records and sequences and ignores callbacks entirely.
 *
 * Callbacks can be ignored, because options cache replaces them with wrappers that always call the latest callback.
 * Whether the callback changed is therefore irrelevant to the consumer. Only the presence of the callback matters.
 *
 * Opaque objects are compared by reference. Their equals() might be expensive or inconsistent
 * and they might be mutable, in which case the consumer has to see the new reference to notice the change.
 */
/**
 * Structural equality of options trees.
 * Records and sequences are compared recursively, callables are mutually equal, and everything else is compared by value or by reference.
 * See {@link OptionKind} for the classification of values.
 * <p>
 * Comparison is safe for cyclic and shared structures. It never throws.
 *
 * @see OptionKind
 * @see OptionsCache
 */
public final class OptionEquality {
	private static final Logger logger = LoggerFactory.getLogger(OptionEquality.class);
	/*
	 * Memo of node pairs that have been already compared or that are being compared right now.
	 * It is keyed by identity, because equals() and hashCode() of cyclic collections would recurse forever.
	 *
	 * Once we start comparing a pair, we assume it is equal. If the assumption is wrong,
	 * the comparison that made it fails too and the failure propagates up to the top-level call.
	 * Every pair is thus expanded only once, which guarantees termination on finite graphs.
	 *
	 * Most left nodes are only ever paired with one right node, but shared subtrees and cycles of different period
	 * can pair one left node with several right nodes, which is why we keep a set of partners.
	 *
	 * The memo lives only as long as one top-level comparison, so memory is bounded by the size of compared trees.
	 */
	private final Reference2ObjectMap<Object, ReferenceSet<Object>> seen = new Reference2ObjectOpenHashMap<>();
	private OptionEquality() {
	}
	/**
	 * Compares two options trees for structural equality.
	 * Rules are applied in this order:
	 * <ol>
	 * <li>Identical references and equal {@linkplain OptionKind#PRIMITIVE primitives} are equal.
	 * Boxed numbers must be of the same type. {@link Double#NaN} equals {@link Double#NaN}, but {@code 0.0} does not equal {@code -0.0}.</li>
	 * <li>Any two {@linkplain OptionKind#CALLABLE callables} are equal.</li>
	 * <li>{@linkplain OptionKind#SEQUENCE Sequences} are equal if they have the same length and equal elements in the same order.</li>
	 * <li>{@linkplain OptionKind#RECORD Records} are equal if they have the same key set and equal values under every key.</li>
	 * <li>Everything else is unequal, including {@linkplain OptionKind#OPAQUE opaque} objects that are not the same reference.</li>
	 * </ol>
	 *
	 * @param left
	 *            first options tree, possibly {@code null}
	 * @param right
	 *            second options tree, possibly {@code null}
	 * @return {@code true} if the two trees are structurally equal, {@code false} otherwise
	 */
	public static boolean equal(Object left, Object right) {
		try {
			return new OptionEquality().compare(left, right);
		} catch (RuntimeException ex) {
			/*
			 * Options may contain application-defined collections that throw during iteration.
			 * Treating such trees as changed is always safe. It just costs one extra rebuild.
			 */
			logger.debug("Options comparison failed, treating the options as changed.", ex);
			return false;
		}
	}
	private boolean compare(Object left, Object right) {
		if (left == right)
			return true;
		OptionKind kind = OptionKind.of(left);
		if (kind != OptionKind.of(right))
			return false;
		switch (kind) {
			case PRIMITIVE:
				/*
				 * Boxed floating point numbers already implement same-value semantics in equals().
				 * Different boxed types never compare equal, which is what we want, because they are different values.
				 */
				return Objects.equals(left, right);
			case CALLABLE:
				return true;
			case SEQUENCE:
				if (OptionNodes.length(left) != OptionNodes.length(right))
					return false;
				if (!enter(left, right))
					return true;
				return sequences(left, right);
			case RECORD:
				if (!enter(left, right))
					return true;
				return records(OptionNodes.record(left), OptionNodes.record(right));
			case OPAQUE:
			default:
				return false;
		}
	}
	/*
	 * Returns false if the pair was already entered, in which case it is assumed to be equal.
	 */
	private boolean enter(Object left, Object right) {
		ReferenceSet<Object> partners = seen.get(left);
		if (partners == null) {
			partners = new ReferenceOpenHashSet<>(1);
			seen.put(left, partners);
		}
		return partners.add(right);
	}
	private boolean sequences(Object left, Object right) {
		List<Object> lefts = OptionNodes.elements(left);
		List<Object> rights = OptionNodes.elements(right);
		/*
		 * Length was checked before, but the collection might have been modified in the meantime.
		 */
		if (lefts.size() != rights.size())
			return false;
		for (int i = 0; i < lefts.size(); ++i)
			if (!compare(lefts.get(i), rights.get(i)))
				return false;
		return true;
	}
	private boolean records(Map<String, Object> left, Map<String, Object> right) {
		if (left.size() != right.size())
			return false;
		for (Map.Entry<String, Object> entry : left.entrySet()) {
			/*
			 * Key presence must be checked separately, because null value is indistinguishable from missing key.
			 */
			if (!right.containsKey(entry.getKey()))
				return false;
			if (!compare(entry.getValue(), right.get(entry.getKey())))
				return false;
		}
		return true;
	}
}
