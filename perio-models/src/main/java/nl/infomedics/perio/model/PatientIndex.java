package nl.infomedics.perio.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import nl.infomedics.perio.error.ValidationException;

/**
 * The in-memory patient collection, keyed by MRN. Iteration follows the order
 * in which patients were first seen. Not thread-safe: one mutator at a time.
 */
public class PatientIndex {
	private final Map<String, Patient> patients = new LinkedHashMap<>();

	/**
	 * Attaches the appointment described by {@code record} to the patient with the
	 * record's MRN, creating that patient from the record when it is not known yet.
	 * The appointment is built first, so a malformed record leaves the index untouched.
	 *
	 * @return the patient the appointment was added to
	 */
	public Patient upsert(FlatRecord record) {
		Appointment appointment = AppointmentType.fromRecord(record);
		String mrn = record.requireString(FlatRecord.MRN).trim();
		Patient patient = patients.get(mrn);
		if (patient == null) {
			patient = new Patient(record);
			patients.put(patient.getMrn(), patient);
		}
		patient.addAppointment(appointment);
		return patient;
	}

	/** A blank key matches no patient. */
	public Optional<Patient> find(String mrn) {
		return Optional.ofNullable(patients.get(key(mrn)));
	}

	/** Puts {@code patient} in place of the patient with the same MRN, keeping its position. */
	public void replace(Patient patient) {
		patients.put(patient.getMrn(), patient);
	}

	public Optional<Patient> remove(String mrn) {
		return Optional.ofNullable(patients.remove(key(mrn)));
	}

	public Collection<Patient> patients() {
		return Collections.unmodifiableCollection(patients.values());
	}

	public int size() {
		return patients.size();
	}

	public boolean isEmpty() {
		return patients.isEmpty();
	}

	private static String key(String mrn) {
		if (mrn == null) {
			throw new ValidationException(FlatRecord.MRN, "MRN must be a string or an integer, got null");
		}
		return mrn.trim();
	}
}
