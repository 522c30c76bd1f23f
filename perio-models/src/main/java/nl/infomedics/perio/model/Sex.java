package nl.infomedics.perio.model;

import java.util.Locale;

import nl.infomedics.perio.error.ValidationException;

public enum Sex {
	MALE("male"),
	FEMALE("female");

	private final String value;

	Sex(String value) {
		this.value = value;
	}

	/** Lower-case form written to the records file. */
	public String getValue() {
		return value;
	}

	public static Sex fromValue(Object raw) {
		if (raw == null) {
			throw new ValidationException(FlatRecord.SEX, "Missing required field '" + FlatRecord.SEX + "'");
		}
		String text = raw.toString().trim().toLowerCase(Locale.ROOT);
		for (Sex sex : values()) {
			if (sex.value.equals(text)) {
				return sex;
			}
		}
		throw new ValidationException(FlatRecord.SEX, "Sex must be male or female, got '" + raw + "'");
	}
}
