package works.bosk.pvl.lexer;

/**
 * What the lexer is in the middle of, if anything,
 * that causes it to accumulate characters verbatim until a terminator.
 */
enum Preserve {
	NONE,
	COMMENT,
	QUOTE,
	UNITS,
	NON_DECIMAL,
}
