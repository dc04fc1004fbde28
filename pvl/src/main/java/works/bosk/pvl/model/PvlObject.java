package works.bosk.pvl.model;

/**
 * An aggregation introduced by <code>OBJECT</code> or <code>BEGIN_OBJECT</code>.
 */
public final class PvlObject extends PvlContainer implements Value {
	public PvlObject() { }

	public PvlObject(Iterable<Entry> entries) {
		super(entries);
	}

	@Override
	public PvlObject copy() {
		return new PvlObject(copiedEntries());
	}
}
