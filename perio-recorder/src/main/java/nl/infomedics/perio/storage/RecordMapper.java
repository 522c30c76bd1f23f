package nl.infomedics.perio.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import nl.infomedics.perio.error.ValidationException;
import nl.infomedics.perio.model.Appointment;
import nl.infomedics.perio.model.FlatRecord;
import nl.infomedics.perio.model.Patient;
import nl.infomedics.perio.model.PatientIndex;

/**
 * Converts between the patient graph and the flat records kept on disk.
 * One record per appointment; a record carries the patient attributes too.
 */
@Slf4j
@Component
public class RecordMapper {

    /**
     * Flattens every appointment of every patient, in traversal order.
     * A patient without appointments produces no record and is therefore
     * lost on the next load.
     */
    public List<FlatRecord> denormalize(Collection<Patient> patients) {
        List<FlatRecord> records = new ArrayList<>();
        for (Patient patient : patients) {
            if (patient.getAppointments().isEmpty()) {
                log.warn("Patient {} has no appointments and is not written to the records file", patient.getMrn());
                continue;
            }
            FlatRecord patientRecord = patient.toRecord();
            for (Appointment appointment : patient.getAppointments()) {
                records.add(patientRecord.merge(appointment.toRecord()));
                log.debug("Patient {}, {} converted to record", patient.getMrn(), appointment);
            }
        }
        return records;
    }

    /**
     * Rebuilds the patient graph from raw entries (maps or {@link FlatRecord}s).
     * Entries that cannot be normalized are skipped and reported in the result.
     */
    public LoadResult normalize(List<?> entries) {
        PatientIndex index = new PatientIndex();
        List<RecordCorruptException> skipped = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            try {
                FlatRecord record = toFlatRecord(i, entry);
                Patient patient = index.upsert(record);
                log.debug("Patient {}, appointment on {} added from record #{}", patient.getMrn(),
                        record.get(FlatRecord.DATE), i);
            } catch (RecordCorruptException e) {
                skipped.add(e);
            } catch (ValidationException e) {
                skipped.add(new RecordCorruptException(i, entry, e.getMessage(), e));
            }
        }
        for (RecordCorruptException e : skipped) {
            log.warn("Skipped corrupt record: {}", e.getMessage());
        }
        return new LoadResult(index, skipped);
    }

    private static FlatRecord toFlatRecord(int position, Object entry) throws RecordCorruptException {
        if (entry instanceof FlatRecord) {
            return (FlatRecord) entry;
        }
        if (!(entry instanceof Map)) {
            throw new RecordCorruptException(position, entry, "expected a mapping, got "
                    + (entry == null ? "null" : entry.getClass().getSimpleName()), null);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        ((Map<?, ?>) entry).forEach((key, value) -> values.put(String.valueOf(key), value));
        return FlatRecord.of(values);
    }
}
