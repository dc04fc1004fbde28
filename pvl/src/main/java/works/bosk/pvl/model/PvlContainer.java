package works.bosk.pvl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * An ordered sequence of key-value entries in which a key may appear more than once.
 * <p>
 * Single-key lookups see the first occurrence of the key,
 * and every operation preserves the relative order of the entries it doesn't touch.
 * <p>
 * Equality is structural: two containers are equal if they hold equal entries
 * in the same order, regardless of whether each is a module, group or object.
 * <p>
 * Not thread-safe.
 */
public sealed abstract class PvlContainer implements Iterable<PvlContainer.Entry> permits PvlModule, PvlGroup, PvlObject {
	private final List<Entry> entries = new ArrayList<>();

	public record Entry(String key, Value value) {
		public Entry {
			requireNonNull(key);
			requireNonNull(value);
		}

		@Override
		public String toString() {
			return key + "=" + value;
		}
	}

	protected PvlContainer() { }

	protected PvlContainer(Iterable<Entry> initialEntries) {
		initialEntries.forEach(entries::add);
	}

	/**
	 * Adds a new entry at the end, even if <code>key</code> is already present.
	 */
	public void append(@NotNull String key, @NotNull Value value) {
		entries.add(new Entry(key, value));
	}

	public void appendAll(@NotNull Iterable<Entry> newEntries) {
		newEntries.forEach(e -> entries.add(requireNonNull(e)));
	}

	/**
	 * If <code>key</code> is absent, equivalent to {@link #append}.
	 * Otherwise, replaces the value of the first occurrence and removes all the others.
	 */
	public void set(@NotNull String key, @NotNull Value value) {
		Entry replacement = new Entry(key, value);
		int first = indexOf(key);
		if (first == -1) {
			entries.add(replacement);
		} else {
			entries.set(first, replacement);
			for (int i = entries.size() - 1; i > first; i--) {
				if (entries.get(i).key().equals(key)) {
					entries.remove(i);
				}
			}
		}
	}

	/**
	 * @return the value of the first entry with the given key
	 * @throws NoSuchElementException if there is none
	 */
	public Value get(String key) {
		int index = indexOf(key);
		if (index == -1) {
			throw new NoSuchElementException("No such key: \"" + key + "\"");
		}
		return entries.get(index).value();
	}

	/**
	 * @return the values of all entries with the given key, in order; possibly empty
	 */
	public List<Value> getAll(String key) {
		List<Value> result = new ArrayList<>();
		for (Entry e : entries) {
			if (e.key().equals(key)) {
				result.add(e.value());
			}
		}
		return result;
	}

	public boolean containsKey(String key) {
		return indexOf(key) != -1;
	}

	/**
	 * Removes every entry with the given key.
	 *
	 * @return the number of entries removed
	 */
	public int delete(String key) {
		int before = entries.size();
		entries.removeIf(e -> e.key().equals(key));
		return before - entries.size();
	}

	/**
	 * Inserts <code>newEntries</code> immediately before the
	 * <code>occurrence</code>th (zero-based) entry having the given key.
	 *
	 * @throws NoSuchElementException if <code>key</code> is absent
	 * @throws IndexOutOfBoundsException if there are not that many occurrences of <code>key</code>
	 */
	public void insertBefore(String key, int occurrence, List<Entry> newEntries) {
		entries.addAll(indexOfOccurrence(key, occurrence), List.copyOf(newEntries));
	}

	/**
	 * Like {@link #insertBefore} but inserts after the located entry.
	 */
	public void insertAfter(String key, int occurrence, List<Entry> newEntries) {
		entries.addAll(indexOfOccurrence(key, occurrence) + 1, List.copyOf(newEntries));
	}

	/**
	 * Removes and returns the final entry.
	 *
	 * @throws NoSuchElementException if this container is empty
	 */
	public Entry popLast() {
		if (entries.isEmpty()) {
			throw new NoSuchElementException("Container is empty");
		}
		return entries.remove(entries.size() - 1);
	}

	public void clear() {
		entries.clear();
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	/**
	 * @return distinct keys in order of first appearance
	 */
	public Set<String> keys() {
		Set<String> result = new LinkedHashSet<>();
		entries.forEach(e -> result.add(e.key()));
		return result;
	}

	/**
	 * @return an unmodifiable live view
	 */
	public List<Entry> entries() {
		return Collections.unmodifiableList(entries);
	}

	/**
	 * @return a container of the same kind whose nested containers are copies too,
	 * so that modifying either one leaves the other unchanged
	 */
	public abstract PvlContainer copy();

	List<Entry> copiedEntries() {
		List<Entry> result = new ArrayList<>(entries.size());
		for (Entry e : entries) {
			result.add(new Entry(e.key(), copyOf(e.value())));
		}
		return result;
	}

	private static Value copyOf(Value value) {
		if (value instanceof PvlContainer c) {
			return (Value) c.copy();
		} else if (value instanceof SequenceValue s) {
			return new SequenceValue(s.values().stream().map(PvlContainer::copyOf).toList());
		} else if (value instanceof SetValue s) {
			return SetValue.copyOf(s.values().stream().map(PvlContainer::copyOf).toList());
		} else {
			return value;
		}
	}

	@Override
	public Iterator<Entry> iterator() {
		return entries().iterator();
	}

	private int indexOf(String key) {
		for (int i = 0; i < entries.size(); i++) {
			if (entries.get(i).key().equals(key)) {
				return i;
			}
		}
		return -1;
	}

	private int indexOfOccurrence(String key, int occurrence) {
		int seen = 0;
		for (int i = 0; i < entries.size(); i++) {
			if (entries.get(i).key().equals(key)) {
				if (seen == occurrence) {
					return i;
				}
				seen++;
			}
		}
		if (seen == 0) {
			throw new NoSuchElementException("No such key: \"" + key + "\"");
		}
		throw new IndexOutOfBoundsException("Key \"" + key + "\" has " + seen + " occurrences; cannot address occurrence " + occurrence);
	}

	@Override
	public final boolean equals(Object obj) {
		return obj instanceof PvlContainer other && entries.equals(other.entries);
	}

	@Override
	public final int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + entries;
	}
}
