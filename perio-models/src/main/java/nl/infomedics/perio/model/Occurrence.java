package nl.infomedics.perio.model;

import java.util.Locale;

import lombok.EqualsAndHashCode;
import nl.infomedics.perio.error.ValidationException;

/**
 * A procedure that took place during an appointment. The value is either
 * {@code true} or a short free-text detail; a procedure that did not occur
 * is represented by {@code null}, never by an {@code Occurrence}.
 */
@EqualsAndHashCode
public final class Occurrence {
	public static final Occurrence YES = new Occurrence(Boolean.TRUE);

	private final Object value;

	private Occurrence(Object value) {
		this.value = value;
	}

	/**
	 * @return the occurrence, or {@code null} when the raw value is absent, {@code false},
	 *         blank, the text {@code "false"} or zero
	 */
	public static Occurrence from(Object raw, String field) {
		if (raw == null) {
			return null;
		}
		if (raw instanceof Boolean) {
			return ((Boolean) raw) ? YES : null;
		}
		if (raw instanceof String) {
			String text = (String) raw;
			if (text.isBlank() || "false".equals(text.trim().toLowerCase(Locale.ROOT))) {
				return null;
			}
			return new Occurrence(text);
		}
		if (raw instanceof Number) {
			return ((Number) raw).doubleValue() == 0d ? null : new Occurrence(raw);
		}
		throw new ValidationException(field, "Procedure '" + field + "' must be a boolean or text, got " + raw.getClass().getSimpleName());
	}

	/** Value written back to the record: {@code Boolean.TRUE}, a {@link String} or a {@link Number}. */
	public Object getValue() {
		return value;
	}

	@Override
	public String toString() {
		return String.valueOf(value);
	}
}
