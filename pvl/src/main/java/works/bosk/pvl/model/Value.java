package works.bosk.pvl.model;

/**
 * Anything that can appear on the right-hand side of an assignment statement.
 */
public sealed interface Value permits
	NullValue,
	BooleanValue,
	IntegerValue,
	RealValue,
	StringValue,
	DateValue,
	TimeValue,
	DateTimeValue,
	SequenceValue,
	SetValue,
	Quantity,
	EmptyValue,
	PvlGroup,
	PvlObject {

	/**
	 * @return true for the values that ODL calls "scalar": numbers,
	 * dates and times, and strings, as well as quantities of numbers.
	 */
	default boolean isScalar() {
		return this instanceof IntegerValue
			|| this instanceof RealValue
			|| this instanceof StringValue
			|| this instanceof DateValue
			|| this instanceof TimeValue
			|| this instanceof DateTimeValue
			|| (this instanceof Quantity q && q.isNumeric());
	}

	default boolean isNumeric() {
		return this instanceof IntegerValue || this instanceof RealValue;
	}
}
