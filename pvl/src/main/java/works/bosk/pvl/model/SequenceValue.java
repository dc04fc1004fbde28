package works.bosk.pvl.model;

import java.util.List;

/**
 * An ordered list of values, duplicates allowed.
 */
public record SequenceValue(List<Value> values) implements Value {
	public SequenceValue {
		values = List.copyOf(values);
	}

	public static SequenceValue of(Value... values) {
		return new SequenceValue(List.of(values));
	}

	public int dimensions() {
		int inner = 0;
		for (Value v : values) {
			if (v instanceof SequenceValue s) {
				inner = Math.max(inner, s.dimensions());
			}
		}
		return 1 + inner;
	}

	@Override
	public String toString() {
		return values.toString();
	}
}
