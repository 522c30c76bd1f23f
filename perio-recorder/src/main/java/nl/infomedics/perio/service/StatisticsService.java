package nl.infomedics.perio.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import nl.infomedics.perio.metrics.DiagnosticsRecorder;
import nl.infomedics.perio.model.Appointment;
import nl.infomedics.perio.model.AppointmentType;
import nl.infomedics.perio.model.FlatRecord;
import nl.infomedics.perio.model.Patient;

/**
 * Procedure counts per appointment type. Read-only over the patient collection.
 */
@Slf4j
@Service
public class StatisticsService {
    private final DiagnosticsRecorder diagnostics;

    public StatisticsService(DiagnosticsRecorder diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Tallies appointments into one bucket per type, always in the order
     * PeriodicExam, LimitedExam, ComprehensiveExam, Surgery. Each bucket maps the
     * type name to the number of appointments of that type, and every procedure
     * that occurred to the number of those appointments it occurred in.
     * <p>
     * With both bounds given only appointments strictly between them are counted;
     * appointments on either boundary date are left out. With a bound missing
     * every appointment is counted.
     */
    public List<Map<String, Integer>> tally(Collection<Patient> patients, LocalDate from, LocalDate to) {
        try (DiagnosticsRecorder.SampleTimer ignored = diagnostics.start(DiagnosticsRecorder.STATS_TALLY)) {
            boolean bounded = from != null && to != null;
            Map<AppointmentType, Map<String, Integer>> buckets = new EnumMap<>(AppointmentType.class);
            for (AppointmentType type : AppointmentType.values()) {
                Map<String, Integer> bucket = new LinkedHashMap<>();
                bucket.put(type.getDiscriminator(), 0);
                buckets.put(type, bucket);
            }

            for (Patient patient : patients) {
                for (Appointment appointment : patient.getAppointments()) {
                    if (bounded && !(from.isBefore(appointment.getDate()) && appointment.getDate().isBefore(to))) {
                        continue;
                    }
                    count(buckets.get(appointment.getType()), appointment);
                }
            }

            List<Map<String, Integer>> stats = new ArrayList<>(buckets.values());
            log.debug("tally({}, {}) = {}", from, to, stats);
            return stats;
        }
    }

    private static void count(Map<String, Integer> bucket, Appointment appointment) {
        FlatRecord stats = appointment.toStatsRecord();
        bucket.merge(appointment.getType().getDiscriminator(), 1, Integer::sum);
        stats.asMap().forEach((field, value) -> {
            if (FlatRecord.TYPE.equals(field) || FlatRecord.DATE.equals(field)) {
                return;
            }
            if (value != null && !Boolean.FALSE.equals(value)) {
                bucket.merge(field, 1, Integer::sum);
            }
        });
    }
}
