package works.bosk.pvl.parser;

/**
 * What the {@link Parser} does with a malformed assignment statement.
 */
public enum Leniency {
	/**
	 * Throw {@link works.bosk.pvl.exceptions.PvlParseException}.
	 */
	STRICT,

	/**
	 * Record an {@link works.bosk.pvl.model.EmptyValue} for the statement,
	 * add its line number to {@link works.bosk.pvl.model.PvlModule#errors()},
	 * and keep going.
	 * Also joins lines broken with a trailing dash before parsing begins.
	 */
	LENIENT,
}
