package nl.infomedics.perio.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import nl.infomedics.perio.model.FlatRecord;
import nl.infomedics.perio.model.Patient;
import nl.infomedics.perio.model.PatientIndex;

public class RecordMapperTest {
    private final RecordMapper mapper = new RecordMapper();

    private static Map<String, Object> entry(String mrn, String type, String date) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("mrn", mrn);
        values.put("first", "ann");
        values.put("last", "smith");
        values.put("birthday", "19800101");
        values.put("sex", "female");
        values.put("_type", type);
        values.put("date", date);
        return values;
    }

    @Test
    public void denormalizeWritesOneRecordPerAppointment() {
        PatientIndex index = new PatientIndex();
        index.upsert(FlatRecord.of(entry("100", "PeriodicExam", "20210101")));
        index.upsert(FlatRecord.of(entry("100", "Surgery", "20210601")));

        List<FlatRecord> records = mapper.denormalize(index.patients());

        assertEquals(2, records.size());
        FlatRecord surgery = records.get(1);
        assertEquals("100", surgery.get("mrn"));
        assertEquals("female", surgery.get("sex"));
        assertEquals("Surgery", surgery.get("_type"));
        assertEquals("20210601", surgery.get("date"));
        assertTrue(surgery.containsKey("note"));
    }

    @Test
    public void patientWithoutAppointmentsIsNotWritten() {
        Patient lonely = new Patient(FlatRecord.of(entry("300", "PeriodicExam", "20210101")));

        assertTrue(mapper.denormalize(List.of(lonely)).isEmpty());
    }

    @Test
    public void normalizeRebuildsPatientsFromMapsAndRecords() {
        List<Object> entries = new ArrayList<>();
        entries.add(entry("100", "PeriodicExam", "20210101"));
        entries.add(FlatRecord.of(entry("100", "Surgery", "20210601")));
        entries.add(entry("200", "LimitedExam", "20210701"));

        LoadResult result = mapper.normalize(entries);

        assertTrue(result.isClean());
        assertEquals(2, result.getPatients().size());
        assertEquals(2, result.getPatients().find("100").orElseThrow().getAppointments().size());
    }

    @Test
    public void corruptEntriesAreSkippedAndReported() {
        List<Object> entries = new ArrayList<>();
        entries.add(entry("100", "PeriodicExam", "20210101"));
        entries.add("not a mapping");
        entries.add(entry("100", "Cleaning", "20210201"));
        entries.add(entry("200", "Surgery", "2021-02-01"));
        entries.add(null);

        LoadResult result = mapper.normalize(entries);

        assertEquals(1, result.getPatients().size());
        assertEquals(List.of(1, 2, 3, 4),
                result.getSkipped().stream().map(RecordCorruptException::getPosition).collect(Collectors.toList()));
        assertEquals("not a mapping", result.getSkipped().get(0).getRecord());
        assertTrue(result.getSkipped().get(1).getMessage().startsWith("Record #2: "));
    }

    @Test
    public void roundTripKeepsTheGraph() {
        LoadResult first = mapper.normalize(List.of(entry("100", "PeriodicExam", "20210101"),
                entry("200", "Surgery", "20210601"), entry("100", "ComprehensiveExam", "20210301")));

        List<FlatRecord> records = mapper.denormalize(first.getPatients().patients());
        LoadResult second = mapper.normalize(records);

        assertEquals(mapper.denormalize(second.getPatients().patients()), records);
    }
}
