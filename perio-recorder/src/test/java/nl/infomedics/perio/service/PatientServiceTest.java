package nl.infomedics.perio.service;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import nl.infomedics.perio.config.RecordsProperties;
import nl.infomedics.perio.error.ValidationException;
import nl.infomedics.perio.metrics.DiagnosticsRecorder;
import nl.infomedics.perio.model.Appointment;
import nl.infomedics.perio.model.FlatRecord;
import nl.infomedics.perio.model.Patient;
import nl.infomedics.perio.storage.RecordMapper;
import nl.infomedics.perio.storage.RecordRepository;

public class PatientServiceTest {

    @TempDir
    Path tempDir;

    private RecordRepository repository;
    private PatientService service;

    @BeforeEach
    public void setUp() throws Exception {
        repository = new RecordRepository(new RecordsProperties(tempDir.resolve("records.yaml").toString(), true, false),
                new RecordMapper(), DiagnosticsRecorder.disabled());
        Clock clock = Clock.fixed(Instant.parse("2021-06-15T10:00:00Z"), ZoneOffset.UTC);
        service = new PatientService(repository, new StatisticsService(DiagnosticsRecorder.disabled()), clock);
        service.load();
    }

    private static FlatRecord tom(String type, String date, Object... procedures) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("mrn", "222");
        values.put("first", "tom");
        values.put("last", "wagar");
        values.put("birthday", "19830303");
        values.put("sex", "male");
        values.put("_type", type);
        values.put("date", date);
        for (int i = 0; i < procedures.length; i += 2) {
            values.put((String) procedures[i], procedures[i + 1]);
        }
        return FlatRecord.of(values);
    }

    private static List<String> appointments(Patient patient) {
        return patient.getAppointments().stream().map(Appointment::toString).collect(Collectors.toList());
    }

    @Test
    public void addedAppointmentIsFoundWithItsPatient() {
        service.addAppointment(tom("PeriodicExam", "20210101"));

        Patient patient = service.findPatient("222").orElseThrow();
        assertEquals(List.of("PeriodicExam on 2021-01-01"), appointments(patient));
        assertEquals(patient, service.findPatient(222L).orElseThrow());
    }

    @Test
    public void addingTheSameAppointmentTwiceKeepsBoth() {
        service.addAppointment(tom("PeriodicExam", "20210101"));
        service.addAppointment(tom("PeriodicExam", "20210101"));

        assertEquals(2, service.findPatient("222").orElseThrow().getAppointments().size());
    }

    @Test
    public void modifyAppointmentReplacesTheSlot() {
        service.addAppointment(tom("PeriodicExam", "20210101"));
        service.addAppointment(tom("Surgery", "20210601"));

        MutationResult result = service.modifyAppointment(tom("Surgery", "20210601", "biopsy", true, "note", "healing"));

        assertTrue(result.isApplied());
        Patient patient = service.findPatient("222").orElseThrow();
        assertEquals(2, patient.getAppointments().size());
        Appointment surgery = patient.findAppointment(LocalDate.of(2021, 6, 1)).orElseThrow();
        assertEquals("healing", surgery.getNote().orElseThrow());
        assertTrue(surgery.getProcedures().containsKey("biopsy"));
    }

    @Test
    public void modifyAppointmentNeedsSameTypeAndDate() {
        service.addAppointment(tom("PeriodicExam", "20210101"));

        assertEquals(MutationResult.Outcome.NOT_FOUND, service.modifyAppointment(tom("Surgery", "20210101")).getOutcome());
        assertFalse(service.modifyAppointment(tom("PeriodicExam", "20210102")).isApplied());
        assertFalse(service.modifyAppointment(tom("PeriodicExam", "20210101").with("mrn", "999")).isApplied());
        assertEquals(List.of("PeriodicExam on 2021-01-01"), appointments(service.findPatient("222").orElseThrow()));
    }

    @Test
    public void deleteAppointmentIgnoresTheType() {
        service.addAppointment(tom("PeriodicExam", "20210101"));
        service.addAppointment(tom("Surgery", "20210601"));

        MutationResult result = service.deleteAppointment("222", "20210601");

        assertTrue(result.isApplied());
        assertEquals("Surgery on 2021-06-01 for Patient: Tom Wagar, MRN: 222, Male, Birthday: 1983-03-03 has been deleted.",
                result.getMessage());
        assertEquals(List.of("PeriodicExam on 2021-01-01"), appointments(service.findPatient("222").orElseThrow()));
    }

    @Test
    public void deleteAppointmentNotFoundLeavesStateUnchanged() {
        service.addAppointment(tom("PeriodicExam", "20210101"));

        assertFalse(service.deleteAppointment("222", "20210102").isApplied());
        assertFalse(service.deleteAppointment("999", "20210101").isApplied());
        assertThrows(ValidationException.class, () -> service.deleteAppointment("222", "01/01/2021"));
        assertEquals(1, service.findPatient("222").orElseThrow().getAppointments().size());
    }

    @Test
    public void modifyPatientReportsChangesAndKeepsAppointments() {
        service.addAppointment(tom("PeriodicExam", "20210101"));
        service.addAppointment(tom("Surgery", "20210601"));
        FlatRecord changed = tom("PeriodicExam", "20210101").with("first", "thomas").without("_type", "date");

        MutationResult result = service.modifyPatient(changed);

        assertTrue(result.isApplied());
        assertEquals(Map.of("first", "tom"), result.getBefore());
        assertEquals(Map.of("first", "thomas"), result.getAfter());
        Patient patient = service.findPatient("222").orElseThrow();
        assertEquals("thomas", patient.getFirst());
        assertEquals(2, patient.getAppointments().size());
    }

    @Test
    public void modifyUnknownPatientIsNotFound() {
        assertEquals(MutationResult.Outcome.NOT_FOUND, service.modifyPatient(tom("PeriodicExam", "20210101")).getOutcome());
        assertTrue(service.getPatients().isEmpty());
    }

    @Test
    public void deletePatientRemovesAllAppointments() throws Exception {
        service.addAppointment(tom("PeriodicExam", "20210101"));
        service.addAppointment(tom("Surgery", "20210601"));

        assertTrue(service.deletePatient("222").isApplied());
        assertTrue(service.findPatient("222").isEmpty());
        assertFalse(service.deletePatient("222").isApplied());

        service.save();
        assertTrue(repository.read().isEmpty());
    }

    @Test
    public void deletePatientAcceptsPatientOrRecord() {
        Patient patient = service.addAppointment(tom("PeriodicExam", "20210101"));
        assertTrue(service.deletePatient(patient).isApplied());

        service.addAppointment(tom("PeriodicExam", "20210101"));
        assertTrue(service.deletePatient(FlatRecord.of(Map.of("mrn", "222"))).isApplied());
    }

    @Test
    public void recordsAreReturnedMostRecentFirst() {
        service.addAppointment(tom("PeriodicExam", "20210101"));
        service.addAppointment(tom("Surgery", "20210601", "sinus", true));
        service.addAppointment(tom("LimitedExam", "20210301"));

        PatientRecords records = service.returnPatientRecords("222").orElseThrow();

        assertEquals("tom", records.getPatient().get("first"));
        assertFalse(records.getPatient().containsKey("_type"));
        assertEquals(List.of("20210601", "20210301", "20210101"),
                records.getAppointments().stream().map(r -> r.get("date")).collect(Collectors.toList()));
        assertEquals(Boolean.TRUE, records.getAppointments().get(0).get("sinus"));
        assertTrue(service.returnPatientRecords(999L).isEmpty());
    }

    @Test
    public void sameDayRecordsKeepInsertionOrder() {
        service.addAppointment(tom("PeriodicExam", "20210101"));
        service.addAppointment(tom("Surgery", "20210101"));

        PatientRecords records = service.returnPatientRecords("222").orElseThrow();

        assertEquals(List.of("PeriodicExam", "Surgery"),
                records.getAppointments().stream().map(r -> r.get("_type")).collect(Collectors.toList()));
    }

    @Test
    public void nullMrnIsInvalid() {
        assertThrows(ValidationException.class, () -> service.findPatient((String) null));
        assertThrows(ValidationException.class, () -> service.deletePatient((String) null));
    }

    @Test
    public void blankMrnIsNotFound() {
        service.addAppointment(tom("PeriodicExam", "20210101"));

        assertTrue(service.findPatient("").isEmpty());
        assertTrue(service.findPatient("  ").isEmpty());
        assertTrue(service.returnPatientRecords("").isEmpty());
        assertEquals(MutationResult.Outcome.NOT_FOUND, service.deletePatient("").getOutcome());
        assertFalse(service.deleteAppointment(" ", "20210101").isApplied());
        assertTrue(service.findPatient("12345").isEmpty());
        assertEquals(1, service.getPatients().size());
    }

    @Test
    public void changesPersistOnlyOnSave() throws Exception {
        service.addAppointment(tom("PeriodicExam", "20210101"));
        assertTrue(repository.read().isEmpty());

        service.save();
        service.load();

        assertEquals(1, repository.read().size());
        assertEquals(1, service.getPatients().size());
        assertTrue(service.getSkippedRecords().isEmpty());
    }

    @Test
    public void corruptRecordSurvivesLookupAndSave() throws Exception {
        Files.writeString(tempDir.resolve("records.yaml"), String.join("\n",
                "- {mrn: '100', first: ann, last: smith, birthday: '19800101', sex: female, _type: PeriodicExam, date: '20210101'}",
                "- {mrn: '100', first: ann, last: smith, birthday: '19800101', sex: female, _type: Cleaning, date: '20210201'}",
                ""), StandardCharsets.UTF_8);
        service.load();
        assertEquals(1, service.getSkippedRecords().size());

        assertTrue(service.findPatient("100").isPresent());
        service.save();

        List<Object> entries = repository.read();
        assertEquals(2, entries.size());
        assertEquals("Cleaning", ((Map<?, ?>) entries.get(1)).get("_type"));
        service.load();
        assertEquals(1, service.getSkippedRecords().size());
        assertEquals(1, service.findPatient("100").orElseThrow().getAppointments().size());
    }

    @Test
    public void todayComesFromTheClock() {
        assertEquals(LocalDate.of(2021, 6, 15), service.todayDate());
    }

    @Test
    public void tallyParsesStringBounds() {
        service.addAppointment(tom("PeriodicExam", "20210101"));

        assertEquals(Map.of("PeriodicExam", 1), service.tally("20201231", "20210102").get(0));
        assertEquals(Map.of("PeriodicExam", 0), service.tally("20210101", "20210102").get(0));
        assertThrows(ValidationException.class, () -> service.tally("2021", "20210102"));
    }
}
