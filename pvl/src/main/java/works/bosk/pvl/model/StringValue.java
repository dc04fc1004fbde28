package works.bosk.pvl.model;

import static java.util.Objects.requireNonNull;

public record StringValue(String value) implements Value {
	public StringValue {
		requireNonNull(value);
	}

	public static StringValue of(String value) {
		return new StringValue(value);
	}

	@Override
	public String toString() {
		return value;
	}
}
