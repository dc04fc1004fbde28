package works.bosk.pvl.model;

public enum NullValue implements Value {
	NULL;

	@Override
	public String toString() {
		return "NULL";
	}
}
