package works.bosk.pvl.model;

import java.math.BigDecimal;

import static java.util.Objects.requireNonNull;

/**
 * Equality is numeric: <code>1.50</code> equals <code>1.5</code>.
 */
public record RealValue(BigDecimal value) implements Value {
	public RealValue {
		requireNonNull(value);
	}

	public static RealValue of(String text) {
		return new RealValue(new BigDecimal(text));
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof RealValue other && value.compareTo(other.value) == 0;
	}

	@Override
	public int hashCode() {
		return value.stripTrailingZeros().hashCode();
	}

	@Override
	public String toString() {
		return value.toString();
	}
}
