package works.bosk.pvl.encoder;

/**
 * The published rules an {@link Encoder} enforces beyond "it must decode back to the same value".
 */
public enum Conformance {
	/**
	 * CCSDS PVL: times must be UTC.
	 */
	PVL,

	/**
	 * PDS3 chapter 12 ODL:
	 * identifiers of at most 30 characters,
	 * units expressions only on numbers and only from a restricted syntax,
	 * non-empty sequences of one or two dimensions of scalars,
	 * sets of scalars,
	 * no leap seconds.
	 */
	ODL,

	/**
	 * ODL plus the PDS3 label rules:
	 * UTC times only,
	 * sets contain only integers and symbols,
	 * and groups that break the PDS group rules are written as objects.
	 */
	PDS3,
}
