package works.bosk.pvl.grammar;

import static java.util.Objects.requireNonNull;

/**
 * The pair of keywords the encoder writes to begin and end an aggregation block.
 */
public record Keywords(String begin, String end) {
	public Keywords {
		requireNonNull(begin);
		requireNonNull(end);
	}
}
