package works.bosk.pvl.model;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.OffsetDateTime;

import static java.util.Objects.requireNonNull;

public record DateTimeValue(LocalDate date, TimeValue time) implements Value {
	public DateTimeValue {
		requireNonNull(date);
		requireNonNull(time);
	}

	public static DateTimeValue of(OffsetDateTime dateTime) {
		return new DateTimeValue(dateTime.toLocalDate(), TimeValue.of(dateTime.toOffsetTime()));
	}

	/**
	 * @throws DateTimeException if the time is a leap second
	 */
	public OffsetDateTime toOffsetDateTime() {
		return OffsetDateTime.of(date, time.toLocalTime(), time.offset());
	}

	@Override
	public String toString() {
		return date + "T" + time;
	}
}
