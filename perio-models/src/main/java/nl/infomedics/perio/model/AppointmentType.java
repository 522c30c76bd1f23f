package nl.infomedics.perio.model;

import java.util.List;
import java.util.function.Function;

import nl.infomedics.perio.error.UnknownVariantException;

/**
 * The closed set of appointment types. Declaration order is the order of the
 * statistics buckets.
 */
public enum AppointmentType {
	PERIODIC_EXAM("PeriodicExam", PeriodicExam::new, PeriodicExam.PROCEDURES),
	LIMITED_EXAM("LimitedExam", LimitedExam::new, LimitedExam.PROCEDURES),
	COMPREHENSIVE_EXAM("ComprehensiveExam", ComprehensiveExam::new, ComprehensiveExam.PROCEDURES),
	SURGERY("Surgery", Surgery::new, Surgery.PROCEDURES);

	private final String discriminator;
	private final Function<FlatRecord, Appointment> constructor;
	private final List<String> procedures;

	AppointmentType(String discriminator, Function<FlatRecord, Appointment> constructor, List<String> procedures) {
		this.discriminator = discriminator;
		this.constructor = constructor;
		this.procedures = procedures;
	}

	/** Value of the {@code _type} field. */
	public String getDiscriminator() {
		return discriminator;
	}

	/** Procedure field names this type understands, in record order. */
	public List<String> getProcedures() {
		return procedures;
	}

	public Appointment create(FlatRecord record) {
		return constructor.apply(record);
	}

	public static AppointmentType fromDiscriminator(Object raw) {
		if (raw != null) {
			for (AppointmentType type : values()) {
				if (type.discriminator.equals(raw.toString())) {
					return type;
				}
			}
		}
		throw new UnknownVariantException(raw);
	}

	/**
	 * Builds the appointment described by {@code record}.
	 *
	 * @throws UnknownVariantException when {@code _type} is absent or not one of the four types
	 * @throws nl.infomedics.perio.error.ValidationException when the date or a procedure value is malformed
	 */
	public static Appointment fromRecord(FlatRecord record) {
		return fromDiscriminator(record.get(FlatRecord.TYPE)).create(record);
	}
}
