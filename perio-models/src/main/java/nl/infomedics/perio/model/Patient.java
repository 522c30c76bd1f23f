package nl.infomedics.perio.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;
import nl.infomedics.perio.error.ValidationException;

/**
 * A periodontal patient, identified by the clinic-assigned MRN. The patient
 * exclusively owns its appointments.
 */
@Getter
public class Patient {
	private final String mrn;
	private final String first;
	private final String last;
	private final LocalDate birthday;
	private final Sex sex;
	@Getter(AccessLevel.NONE)
	private final List<Appointment> appointments = new ArrayList<>();

	/**
	 * Builds a patient from the patient-shaped fields of a record
	 * ({@code mrn}, {@code first}, {@code last}, {@code birthday}, {@code sex}).
	 * Any other field is ignored.
	 *
	 * @throws ValidationException when a field is missing or malformed
	 */
	public Patient(FlatRecord record) {
		this.mrn = record.requireString(FlatRecord.MRN).trim();
		this.first = record.requireString(FlatRecord.FIRST);
		this.last = record.requireString(FlatRecord.LAST);
		this.birthday = RecordDates.parse(record.get(FlatRecord.BIRTHDAY), FlatRecord.BIRTHDAY);
		this.sex = Sex.fromValue(record.get(FlatRecord.SEX));
	}

	public List<Appointment> getAppointments() {
		return Collections.unmodifiableList(appointments);
	}

	public void addAppointment(Appointment appointment) {
		appointments.add(appointment);
	}

	public boolean removeAppointment(Appointment appointment) {
		for (int i = 0; i < appointments.size(); i++) {
			if (appointments.get(i) == appointment) {
				appointments.remove(i);
				return true;
			}
		}
		return false;
	}

	/** First appointment on {@code date}, whatever its type. */
	public Optional<Appointment> findAppointment(LocalDate date) {
		return appointments.stream().filter(a -> a.matchesDate(date)).findFirst();
	}

	/** First appointment with the same type and date as {@code candidate}. */
	public Optional<Appointment> findSlot(Appointment candidate) {
		return appointments.stream().filter(a -> a.matchesSlot(candidate)).findFirst();
	}

	/** Moves every appointment of {@code previous} onto this patient. */
	public void adoptAppointments(Patient previous) {
		appointments.addAll(previous.appointments);
	}

	public boolean matchesMrn(String key) {
		return key != null && mrn.equals(key.trim());
	}

	public boolean matchesMrn(FlatRecord record) {
		return record != null && matchesMrn(record.findString(FlatRecord.MRN).orElse(null));
	}

	public boolean matchesMrn(Patient other) {
		return other != null && mrn.equals(other.mrn);
	}

	/** Patient attributes as a flat record, appointments excluded. */
	public FlatRecord toRecord() {
		Map<String, Object> record = new LinkedHashMap<>();
		record.put(FlatRecord.MRN, mrn);
		record.put(FlatRecord.FIRST, first);
		record.put(FlatRecord.LAST, last);
		record.put(FlatRecord.BIRTHDAY, RecordDates.format(birthday));
		record.put(FlatRecord.SEX, sex.getValue());
		return FlatRecord.of(record);
	}

	/** e.g. {@code Patient: Tom Wagar, MRN: 222, Male, Birthday: 1983-03-03} */
	public String describe() {
		return "Patient: " + titleCase(first) + " " + titleCase(last) + ", MRN: " + mrn + ", "
				+ titleCase(sex.getValue()) + ", Birthday: " + birthday;
	}

	@Override
	public String toString() {
		return "Patient(mrn=" + mrn + ", first=" + first + ", last=" + last + ", birthday=" + birthday + ", sex="
				+ sex.getValue() + ", appointments=" + appointments.size() + ")";
	}

	private static String titleCase(String text) {
		StringBuilder sb = new StringBuilder(text.length());
		boolean startOfWord = true;
		for (char c : text.toCharArray()) {
			sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
			startOfWord = !Character.isLetter(c);
		}
		return sb.toString();
	}
}
