package works.bosk.pvl.model;

import java.math.BigInteger;

import static java.util.Objects.requireNonNull;

public record IntegerValue(BigInteger value) implements Value {
	public IntegerValue {
		requireNonNull(value);
	}

	public static IntegerValue of(long value) {
		return new IntegerValue(BigInteger.valueOf(value));
	}

	@Override
	public String toString() {
		return value.toString();
	}
}
