package works.bosk.pvl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The top-level container produced by decoding a whole document.
 * <p>
 * {@link #errors()} holds the line numbers of statements that a lenient parser
 * replaced with an {@link EmptyValue}. It does not participate in equality.
 */
public final class PvlModule extends PvlContainer {
	private final List<Integer> errors = new ArrayList<>();

	public PvlModule() { }

	public PvlModule(Iterable<Entry> entries) {
		super(entries);
	}

	/**
	 * @return 1-based line numbers in ascending order
	 */
	public List<Integer> errors() {
		return Collections.unmodifiableList(errors);
	}

	public void addError(int line) {
		errors.add(line);
		Collections.sort(errors);
	}

	@Override
	public PvlModule copy() {
		PvlModule result = new PvlModule(copiedEntries());
		result.errors.addAll(errors);
		return result;
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}
}
