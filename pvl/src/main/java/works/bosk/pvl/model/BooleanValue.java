package works.bosk.pvl.model;

public record BooleanValue(boolean value) implements Value {
	public static final BooleanValue TRUE = new BooleanValue(true);
	public static final BooleanValue FALSE = new BooleanValue(false);

	public static BooleanValue of(boolean value) {
		return value ? TRUE : FALSE;
	}

	@Override
	public String toString() {
		return value ? "TRUE" : "FALSE";
	}
}
