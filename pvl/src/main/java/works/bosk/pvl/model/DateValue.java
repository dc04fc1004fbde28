package works.bosk.pvl.model;

import java.time.LocalDate;

import static java.util.Objects.requireNonNull;

public record DateValue(LocalDate date) implements Value {
	public DateValue {
		requireNonNull(date);
	}

	public static DateValue of(int year, int month, int day) {
		return new DateValue(LocalDate.of(year, month, day));
	}

	@Override
	public String toString() {
		return date.toString();
	}
}
