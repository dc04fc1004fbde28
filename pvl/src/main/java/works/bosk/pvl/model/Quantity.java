package works.bosk.pvl.model;

import static java.util.Objects.requireNonNull;

/**
 * A value followed by a units expression, like <code>5 &lt;km&gt;</code>.
 *
 * @param units the text between the units delimiters, trimmed
 */
public record Quantity(Value value, String units) implements Value {
	public Quantity {
		requireNonNull(value);
		requireNonNull(units);
		if (value instanceof Quantity) {
			throw new IllegalArgumentException("Quantity cannot contain another Quantity: " + value);
		}
	}

	@Override
	public boolean isNumeric() {
		return value.isNumeric();
	}

	@Override
	public String toString() {
		return value + " <" + units + ">";
	}
}
