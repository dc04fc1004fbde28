package works.bosk.pvl.model;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;

import static java.util.Objects.requireNonNull;

/**
 * A time of day with a UTC offset.
 * <p>
 * Unlike {@link LocalTime}, this can represent a leap second:
 * {@link #second()} may be 60, and it is kept exactly as written.
 * Converting such a time to a {@link java.time} type throws {@link DateTimeException}
 * rather than rounding it to a neighbouring second.
 *
 * @param offset {@link ZoneOffset#UTC} when the text had no zone designator
 */
public record TimeValue(int hour, int minute, int second, int nanos, ZoneOffset offset) implements Value {
	public TimeValue {
		requireNonNull(offset);
		if (hour < 0 || hour > 23) {
			throw new IllegalArgumentException("Hour out of range: " + hour);
		}
		if (minute < 0 || minute > 59) {
			throw new IllegalArgumentException("Minute out of range: " + minute);
		}
		if (second < 0 || second > LEAP_SECOND) {
			throw new IllegalArgumentException("Second out of range: " + second);
		}
		if (nanos < 0 || nanos > 999_999_999) {
			throw new IllegalArgumentException("Nanoseconds out of range: " + nanos);
		}
	}

	public static TimeValue of(LocalTime time) {
		return of(time, ZoneOffset.UTC);
	}

	public static TimeValue of(LocalTime time, ZoneOffset offset) {
		return new TimeValue(time.getHour(), time.getMinute(), time.getSecond(), time.getNano(), offset);
	}

	public static TimeValue of(OffsetTime time) {
		return of(time.toLocalTime(), time.getOffset());
	}

	public boolean isLeapSecond() {
		return second == LEAP_SECOND;
	}

	public boolean isUtc() {
		return offset.equals(ZoneOffset.UTC);
	}

	/**
	 * @throws DateTimeException if this is a leap second
	 */
	public LocalTime toLocalTime() {
		if (isLeapSecond()) {
			throw new DateTimeException("Leap second cannot be represented as LocalTime: " + this);
		}
		return LocalTime.of(hour, minute, second, nanos);
	}

	/**
	 * @throws DateTimeException if this is a leap second
	 */
	public OffsetTime toOffsetTime() {
		return OffsetTime.of(toLocalTime(), offset);
	}

	/**
	 * ISO-8601 text, with seconds only when they are nonzero.
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(twoDigits(hour)).append(':').append(twoDigits(minute));
		if (second != 0 || nanos != 0) {
			sb.append(':').append(twoDigits(second));
			if (nanos != 0) {
				sb.append('.').append(fraction(nanos));
			}
		}
		sb.append(offset.getId());
		return sb.toString();
	}

	static String twoDigits(int n) {
		return (n < 10) ? "0" + n : Integer.toString(n);
	}

	/**
	 * @return the decimal digits of the fraction of a second, with trailing zeros removed
	 */
	public static String fraction(int nanos) {
		String digits = String.format("%09d", nanos);
		int end = digits.length();
		while (end > 1 && digits.charAt(end - 1) == '0') {
			end--;
		}
		return digits.substring(0, end);
	}

	public static final int LEAP_SECOND = 60;
}
