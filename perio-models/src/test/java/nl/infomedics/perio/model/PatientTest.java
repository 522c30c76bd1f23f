package nl.infomedics.perio.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.Map;

import org.junit.jupiter.api.Test;

import nl.infomedics.perio.error.ValidationException;

public class PatientTest {

    private static FlatRecord patientRecord(String mrn) {
        return FlatRecord.of(Map.of("mrn", mrn, "first", "tom", "last", "wagar", "birthday", "19830303", "sex", "male"));
    }

    @Test
    public void buildsFromPatientShapedFields() {
        Patient patient = new Patient(patientRecord("222").with("_type", "Surgery"));

        assertEquals("222", patient.getMrn());
        assertEquals(LocalDate.of(1983, 3, 3), patient.getBirthday());
        assertEquals(Sex.MALE, patient.getSex());
        assertTrue(patient.getAppointments().isEmpty());
    }

    @Test
    public void rejectsMissingOrMalformedFields() {
        assertThrows(ValidationException.class, () -> new Patient(patientRecord("222").without("first")));
        assertThrows(ValidationException.class, () -> new Patient(patientRecord("222").with("sex", "unknown")));
        assertThrows(ValidationException.class, () -> new Patient(patientRecord("222").with("birthday", "3/3/1983")));
        assertThrows(ValidationException.class, () -> new Patient(patientRecord(" ")));
    }

    @Test
    public void integerMrnReadsAsText() {
        Patient patient = new Patient(patientRecord("1").with("mrn", 100));
        assertEquals("100", patient.getMrn());
    }

    @Test
    public void matchesByMrnWhateverTheKeyShape() {
        Patient patient = new Patient(patientRecord("222"));

        assertTrue(patient.matchesMrn("222"));
        assertTrue(patient.matchesMrn(FlatRecord.of(Map.of("mrn", "222"))));
        assertTrue(patient.matchesMrn(new Patient(patientRecord("222").with("first", "thomas"))));
        assertFalse(patient.matchesMrn("223"));
        assertFalse(patient.matchesMrn(FlatRecord.empty()));
        assertFalse(patient.matchesMrn((String) null));
    }

    @Test
    public void recordCarriesPatientAttributesOnly() {
        Patient patient = new Patient(patientRecord("222"));
        patient.addAppointment(AppointmentType.fromRecord(FlatRecord.of(Map.of("_type", "PeriodicExam", "date", "20210101"))));

        FlatRecord record = patient.toRecord();
        assertEquals(patientRecord("222"), record);
        assertFalse(record.containsKey("appointments"));
    }

    @Test
    public void findsAndRemovesAppointments() {
        Patient patient = new Patient(patientRecord("222"));
        Appointment periodic = AppointmentType.fromRecord(FlatRecord.of(Map.of("_type", "PeriodicExam", "date", "20210101")));
        Appointment surgery = AppointmentType.fromRecord(FlatRecord.of(Map.of("_type", "Surgery", "date", "20210601")));
        patient.addAppointment(periodic);
        patient.addAppointment(surgery);

        assertSame(surgery, patient.findAppointment(LocalDate.of(2021, 6, 1)).orElseThrow());
        assertTrue(patient.findAppointment(LocalDate.of(2021, 6, 2)).isEmpty());
        assertTrue(patient.removeAppointment(periodic));
        assertFalse(patient.removeAppointment(periodic));
        assertEquals(1, patient.getAppointments().size());
        assertThrows(UnsupportedOperationException.class, () -> patient.getAppointments().clear());
    }

    @Test
    public void describe() {
        Patient patient = new Patient(patientRecord("222"));
        assertEquals("Patient: Tom Wagar, MRN: 222, Male, Birthday: 1983-03-03", patient.describe());
    }
}
