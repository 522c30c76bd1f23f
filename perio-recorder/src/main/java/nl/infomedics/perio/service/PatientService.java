package nl.infomedics.perio.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import nl.infomedics.perio.error.ValidationException;
import nl.infomedics.perio.model.Appointment;
import nl.infomedics.perio.model.AppointmentType;
import nl.infomedics.perio.model.FlatRecord;
import nl.infomedics.perio.model.Patient;
import nl.infomedics.perio.model.PatientIndex;
import nl.infomedics.perio.model.RecordDates;
import nl.infomedics.perio.storage.LoadResult;
import nl.infomedics.perio.storage.RecordCorruptException;
import nl.infomedics.perio.storage.RecordRepository;
import nl.infomedics.perio.storage.StorageUnavailableException;

/**
 * Queries and mutations over the in-memory patient collection. Changes are
 * only written to disk by an explicit {@link #save()}.
 */
@Slf4j
@Service
public class PatientService {
    private final RecordRepository repository;
    private final StatisticsService statistics;
    private final Clock clock;

    private PatientIndex index = new PatientIndex();
    @Getter
    private List<RecordCorruptException> skippedRecords = List.of();

    public PatientService(RecordRepository repository, StatisticsService statistics, Clock clock) {
        this.repository = repository;
        this.statistics = statistics;
        this.clock = clock;
    }

    /** Replaces the in-memory collection with the contents of the records file. */
    @PostConstruct
    public void load() throws StorageUnavailableException {
        LoadResult result = repository.load();
        this.index = result.getPatients();
        this.skippedRecords = List.copyOf(result.getSkipped());
    }

    /** Writes the collection back, together with any records skipped on load. */
    public void save() throws StorageUnavailableException {
        repository.save(index.patients(), skippedRecords);
    }

    public Collection<Patient> getPatients() {
        return index.patients();
    }

    /**
     * Adds the appointment described by {@code record}, creating the patient when
     * the MRN is new. Adding the same appointment twice keeps both; use
     * {@link #modifyAppointment(FlatRecord)} to replace.
     *
     * @return the patient that received the appointment
     */
    public Patient addAppointment(FlatRecord record) {
        Patient patient = index.upsert(record);
        log.debug("addAppointment(): {} for patient {}", record.get(FlatRecord.TYPE), patient.getMrn());
        return patient;
    }

    /**
     * Replaces the appointment with the same type and date as the one described
     * by {@code record}. The patient's appointment count does not change.
     */
    public MutationResult modifyAppointment(FlatRecord record) {
        Appointment replacement = AppointmentType.fromRecord(record);
        String mrn = record.requireString(FlatRecord.MRN);
        Optional<Patient> patient = index.find(mrn);
        if (patient.isEmpty()) {
            log.debug("modifyAppointment(): patient {} not found", mrn);
            return MutationResult.notFound("Patient " + mrn + " not found.");
        }
        Optional<Appointment> existing = patient.get().findSlot(replacement);
        if (existing.isEmpty()) {
            log.debug("modifyAppointment(): no {} for patient {}", replacement, mrn);
            return MutationResult.notFound("No " + replacement + " for patient " + mrn + ".");
        }
        patient.get().removeAppointment(existing.get());
        patient.get().addAppointment(replacement);
        String message = patient.get().describe() + " appointment on " + replacement.getDate() + " has been updated.";
        log.debug("modifyAppointment(): {}", message);
        return MutationResult.applied(message);
    }

    /**
     * Replaces the patient attributes with those in {@code record}. The
     * appointments of the existing patient are carried over untouched.
     */
    public MutationResult modifyPatient(FlatRecord record) {
        String mrn = record.requireString(FlatRecord.MRN);
        Optional<Patient> existing = index.find(mrn);
        if (existing.isEmpty()) {
            log.debug("modifyPatient(): patient {} not found", mrn);
            return MutationResult.notFound("Patient " + mrn + " not found.");
        }
        Patient replacement = new Patient(record);
        Map<String, Object> before = new LinkedHashMap<>();
        Map<String, Object> after = new LinkedHashMap<>();
        FlatRecord original = existing.get().toRecord();
        FlatRecord updated = replacement.toRecord();
        for (Map.Entry<String, Object> entry : original.asMap().entrySet()) {
            Object newValue = updated.get(entry.getKey());
            if (!Objects.equals(entry.getValue(), newValue)) {
                before.put(entry.getKey(), entry.getValue());
                after.put(entry.getKey(), newValue);
            }
        }
        replacement.adoptAppointments(existing.get());
        index.replace(replacement);
        log.debug("modifyPatient(): {} has been changed to {}", before, after);
        return MutationResult.patientModified(replacement.describe() + " has been updated.", before, after);
    }

    public MutationResult deleteAppointment(String mrn, String date) {
        return deleteAppointment(mrn, RecordDates.parse(date, FlatRecord.DATE));
    }

    /** Removes the first appointment on {@code date}, whatever its type. */
    public MutationResult deleteAppointment(String mrn, LocalDate date) {
        Optional<Patient> patient = index.find(mrn);
        Optional<Appointment> appointment = patient.flatMap(p -> p.findAppointment(date));
        if (appointment.isEmpty()) {
            log.debug("deleteAppointment({}, {}): appointment not found", mrn, date);
            return MutationResult.notFound("Appointment on " + date + " for patient " + mrn + " not found.");
        }
        patient.get().removeAppointment(appointment.get());
        String message = appointment.get() + " for " + patient.get().describe() + " has been deleted.";
        log.debug("deleteAppointment(): {}", message);
        return MutationResult.applied(message);
    }

    public MutationResult deletePatient(Patient patient) {
        return deletePatient(patient.getMrn());
    }

    public MutationResult deletePatient(FlatRecord record) {
        return deletePatient(record.requireString(FlatRecord.MRN));
    }

    /** Removes the patient and, with it, all of its appointments. */
    public MutationResult deletePatient(String mrn) {
        Optional<Patient> removed = index.remove(mrn);
        if (removed.isEmpty()) {
            log.debug("deletePatient({}): patient not found", mrn);
            return MutationResult.notFound("Patient " + mrn + " not found.");
        }
        log.debug("deletePatient(): {} has been deleted", removed.get());
        return MutationResult.applied(removed.get().describe() + " has been deleted.");
    }

    /**
     * @return the patient, or empty when no patient has this MRN (a blank MRN never matches)
     * @throws ValidationException when {@code mrn} is null
     */
    public Optional<Patient> findPatient(String mrn) {
        if (mrn == null) {
            throw new ValidationException(FlatRecord.MRN, "MRN must be a string or an integer, got null");
        }
        Optional<Patient> patient = index.find(mrn);
        log.debug("findPatient({}): {}", mrn, patient.map(Patient::describe).orElse("not found"));
        return patient;
    }

    public Optional<Patient> findPatient(long mrn) {
        return findPatient(Long.toString(mrn));
    }

    /** Patient attributes plus every appointment as a record, most recent first. */
    public Optional<PatientRecords> returnPatientRecords(String mrn) {
        return findPatient(mrn).map(patient -> {
            List<Appointment> appointments = new ArrayList<>(patient.getAppointments());
            // List.sort is stable: same-day appointments keep insertion order
            appointments.sort(Comparator.comparing(Appointment::getDate).reversed());
            List<FlatRecord> records = new ArrayList<>(appointments.size());
            for (Appointment appointment : appointments) {
                records.add(appointment.toRecord());
            }
            return new PatientRecords(patient.toRecord(), records);
        });
    }

    public Optional<PatientRecords> returnPatientRecords(long mrn) {
        return returnPatientRecords(Long.toString(mrn));
    }

    public List<Map<String, Integer>> tally() {
        return statistics.tally(index.patients(), null, null);
    }

    public List<Map<String, Integer>> tally(LocalDate from, LocalDate to) {
        return statistics.tally(index.patients(), from, to);
    }

    public List<Map<String, Integer>> tally(String from, String to) {
        return tally(from == null ? null : RecordDates.parse(from, "from"),
                to == null ? null : RecordDates.parse(to, "to"));
    }

    public LocalDate todayDate() {
        return LocalDate.now(clock);
    }
}
