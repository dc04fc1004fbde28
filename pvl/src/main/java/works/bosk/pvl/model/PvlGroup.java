package works.bosk.pvl.model;

/**
 * An aggregation introduced by <code>GROUP</code> or <code>BEGIN_GROUP</code>.
 */
public final class PvlGroup extends PvlContainer implements Value {
	public PvlGroup() { }

	public PvlGroup(Iterable<Entry> entries) {
		super(entries);
	}

	@Override
	public PvlGroup copy() {
		return new PvlGroup(copiedEntries());
	}
}
