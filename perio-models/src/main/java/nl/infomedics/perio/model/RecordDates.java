package nl.infomedics.perio.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

import nl.infomedics.perio.error.ValidationException;

/**
 * Codec for the {@code yyyyMMdd} dates used in records and on the command line.
 */
public final class RecordDates {
	public static final DateTimeFormatter RECORD_DATE_FORMATTER = DateTimeFormatter.ofPattern("uuuuMMdd")
			.withResolverStyle(ResolverStyle.STRICT);

	private RecordDates() {
	}

	/**
	 * Parses a record date. Numbers are accepted because an unquoted
	 * {@code 20210101} in a YAML file reads back as an integer.
	 *
	 * @param value raw value, a {@link String} or a {@link Number}
	 * @param field field name used in the error message
	 * @return the parsed date
	 * @throws ValidationException when the value is missing or not a valid {@code yyyyMMdd} date
	 */
	public static LocalDate parse(Object value, String field) {
		if (value == null) {
			throw new ValidationException(field, "Missing required date field '" + field + "'");
		}
		if (value instanceof LocalDate) {
			return (LocalDate) value;
		}
		if (!(value instanceof String) && !(value instanceof Number)) {
			throw new ValidationException(field, "Field '" + field + "' must be a yyyyMMdd date, got " + value.getClass().getSimpleName());
		}
		String text = value.toString().trim();
		try {
			return LocalDate.parse(text, RECORD_DATE_FORMATTER);
		} catch (DateTimeParseException e) {
			throw new ValidationException(field, "Field '" + field + "' is not a yyyyMMdd date: '" + text + "'", e);
		}
	}

	public static String format(LocalDate date) {
		return date.format(RECORD_DATE_FORMATTER);
	}
}
