package nl.infomedics.perio.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import nl.infomedics.perio.error.ValidationException;

/**
 * One self-describing, flat record: the patient attributes merged with the
 * attributes of a single appointment. Instances are immutable; the {@code with}
 * and {@code without} methods return copies.
 */
@EqualsAndHashCode
public final class FlatRecord {
	public static final String MRN = "mrn";
	public static final String FIRST = "first";
	public static final String LAST = "last";
	public static final String BIRTHDAY = "birthday";
	public static final String SEX = "sex";
	public static final String TYPE = "_type";
	public static final String DATE = "date";
	public static final String ASA = "asa";
	public static final String NOTE = "note";

	private static final FlatRecord EMPTY = new FlatRecord(new LinkedHashMap<>());

	private final Map<String, Object> values;

	private FlatRecord(LinkedHashMap<String, Object> values) {
		this.values = Collections.unmodifiableMap(values);
	}

	public static FlatRecord empty() {
		return EMPTY;
	}

	public static FlatRecord of(Map<String, ?> values) {
		return new FlatRecord(new LinkedHashMap<>(values));
	}

	/** Raw value, {@code null} when the key is absent or explicitly null. */
	public Object get(String key) {
		return values.get(key);
	}

	public boolean containsKey(String key) {
		return values.containsKey(key);
	}

	/** The value as read, a {@link String}, {@link Number} or {@link Boolean}. */
	public Optional<Object> findScalar(String key) {
		Object value = values.get(key);
		if (value == null) {
			return Optional.empty();
		}
		if (value instanceof String || value instanceof Number || value instanceof Boolean) {
			return Optional.of(value);
		}
		throw new ValidationException(key, "Field '" + key + "' must be text, got " + value.getClass().getSimpleName());
	}

	public Optional<String> findString(String key) {
		return findScalar(key).map(Object::toString);
	}

	public String requireString(String key) {
		String value = findString(key).orElse(null);
		if (value == null || value.isBlank()) {
			throw new ValidationException(key, "Missing required field '" + key + "'");
		}
		return value;
	}

	public FlatRecord with(String key, Object value) {
		LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
		copy.put(key, value);
		return new FlatRecord(copy);
	}

	/** Copy of this record with every entry of {@code other} laid over it. */
	public FlatRecord merge(FlatRecord other) {
		LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
		copy.putAll(other.values);
		return new FlatRecord(copy);
	}

	public FlatRecord without(String... keys) {
		LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
		for (String key : keys) {
			copy.remove(key);
		}
		return new FlatRecord(copy);
	}

	/** Read-only view in insertion order. */
	public Map<String, Object> asMap() {
		return values;
	}

	public int size() {
		return values.size();
	}

	@Override
	public String toString() {
		return values.toString();
	}
}
