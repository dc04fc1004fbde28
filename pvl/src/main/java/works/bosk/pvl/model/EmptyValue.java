package works.bosk.pvl.model;

/**
 * Stands in for the missing value of a broken assignment statement
 * that a lenient parser skipped over.
 * <p>
 * All empty values are equal to each other; the line number is diagnostic only.
 *
 * @param line 1-based line number of the statement in the source text
 */
public record EmptyValue(int line) implements Value {
	@Override
	public boolean equals(Object obj) {
		return obj instanceof EmptyValue;
	}

	@Override
	public int hashCode() {
		return EmptyValue.class.hashCode();
	}

	@Override
	public String toString() {
		return "EmptyValue(line " + line + ")";
	}
}
