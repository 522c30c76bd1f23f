package nl.infomedics.perio.model;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * A visit of one patient on one date. Concrete types are closed: see
 * {@link AppointmentType} for the discriminator and the constructor table.
 * Within a patient, the date and the type together identify an appointment slot.
 */
@Getter
public abstract class Appointment {
	private final LocalDate date;
	// scalars as read: a numeric asa stays a number in the record
	@Getter(AccessLevel.NONE)
	private final Object asa; // health status, 1 to 5 in practice
	@Getter(AccessLevel.NONE)
	private final Object note;

	protected Appointment(FlatRecord record) {
		this.date = RecordDates.parse(record.get(FlatRecord.DATE), FlatRecord.DATE);
		this.asa = record.findScalar(FlatRecord.ASA).orElse(null);
		this.note = record.findScalar(FlatRecord.NOTE).orElse(null);
	}

	public abstract AppointmentType getType();

	/**
	 * Adds every procedure field of this type to {@code target}, in declaration
	 * order, with {@code null} for procedures that did not occur.
	 */
	protected abstract void collectProcedures(Map<String, Occurrence> target);

	public Optional<String> getAsa() {
		return Optional.ofNullable(asa).map(Object::toString);
	}

	public Optional<String> getNote() {
		return Optional.ofNullable(note).map(Object::toString);
	}

	/** Procedures that occurred, keyed by record field name. */
	public Map<String, Occurrence> getProcedures() {
		Map<String, Occurrence> all = new LinkedHashMap<>();
		collectProcedures(all);
		all.values().removeIf(Objects::isNull);
		return all;
	}

	/** Date-only lookup; the appointment type is ignored. */
	public boolean matchesDate(LocalDate other) {
		return date.equals(other);
	}

	/** Same slot: identical type and identical date. */
	public boolean matchesSlot(Appointment other) {
		return other != null && getType() == other.getType() && date.equals(other.date);
	}

	/**
	 * Flat representation of this appointment: discriminator, date, asa and note
	 * (null when absent), then the procedures that occurred.
	 */
	public FlatRecord toRecord() {
		Map<String, Object> record = new LinkedHashMap<>();
		record.put(FlatRecord.TYPE, getType().getDiscriminator());
		record.put(FlatRecord.DATE, RecordDates.format(date));
		record.put(FlatRecord.ASA, asa);
		record.put(FlatRecord.NOTE, note);
		getProcedures().forEach((field, occurrence) -> record.put(field, occurrence.getValue()));
		return FlatRecord.of(record);
	}

	/** The record used for statistics: {@link #toRecord()} without note and asa. */
	public FlatRecord toStatsRecord() {
		return toRecord().without(FlatRecord.NOTE, FlatRecord.ASA);
	}

	protected static Occurrence procedure(FlatRecord record, String field) {
		return Occurrence.from(record.get(field), field);
	}

	@Override
	public String toString() {
		return getType().getDiscriminator() + " on " + date;
	}
}
