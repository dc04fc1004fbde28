package works.bosk.pvl.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An unordered collection of distinct values.
 * Iteration follows the order in which the values were first seen,
 * so that encoding is deterministic, but equality ignores order.
 */
public record SetValue(Set<Value> values) implements Value {
	public SetValue {
		values = Collections.unmodifiableSet(new LinkedHashSet<>(values));
	}

	public static SetValue copyOf(Collection<? extends Value> values) {
		return new SetValue(new LinkedHashSet<>(values));
	}

	public static SetValue of(Value... values) {
		return copyOf(Arrays.asList(values));
	}

	@Override
	public String toString() {
		return values.toString();
	}
}
