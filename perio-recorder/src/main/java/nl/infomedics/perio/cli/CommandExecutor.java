package nl.infomedics.perio.cli;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;

import lombok.extern.slf4j.Slf4j;
import nl.infomedics.perio.model.FlatRecord;
import nl.infomedics.perio.model.Patient;
import nl.infomedics.perio.service.MutationResult;
import nl.infomedics.perio.service.PatientRecords;
import nl.infomedics.perio.service.PatientService;

/**
 * Runs one {@link Command} against the {@link PatientService} and returns the text to print.
 */
@Slf4j
@Component
public class CommandExecutor {
    private final PatientService patientService;
    private final CommandTranslator translator;
    private final OutputRenderer renderer;

    public CommandExecutor(PatientService patientService, CommandTranslator translator, OutputRenderer renderer) {
        this.patientService = patientService;
        this.translator = translator;
        this.renderer = renderer;
    }

    public String execute(Command command) throws JsonProcessingException {
        List<String> values = command.getValues();
        switch (command.getType()) {
            case FIND: {
                Optional<Patient> patient = patientService.findPatient(command.value(0));
                return patient.isPresent() ? renderer.render(patient.get()) : "Patient " + command.value(0) + " not found.";
            }
            case TODAY:
                return renderer.render(patientService.todayDate());
            case STATS: {
                List<Map<String, Integer>> stats = values.isEmpty()
                        ? patientService.tally()
                        : patientService.tally(command.value(0), command.value(1));
                return renderer.renderStats(stats);
            }
            case DELETE_PATIENT:
                return report(patientService.deletePatient(command.value(0)));
            case DELETE_APPOINTMENT:
                return report(patientService.deleteAppointment(command.value(0), command.value(1)));
            case RETURN_RECORDS: {
                Optional<PatientRecords> records = patientService.returnPatientRecords(command.value(0));
                return records.isPresent() ? renderer.render(records.get())
                        : "Patient " + command.value(0) + " not found. Check MRN.";
            }
            case MODIFY_PATIENT:
                return report(patientService.modifyPatient(translator.patientRecord(values)));
            case ADD_APPOINTMENT: {
                FlatRecord record = translator.appointmentRecord(values, patientService.findPatient(values.get(0)));
                Patient patient = patientService.addAppointment(record);
                return record.get(FlatRecord.TYPE) + " on " + record.get(FlatRecord.DATE) + " added for "
                        + patient.describe();
            }
            case MODIFY_APPOINTMENT: {
                FlatRecord record = translator.appointmentRecord(values, patientService.findPatient(values.get(0)));
                return report(patientService.modifyAppointment(record));
            }
            default:
                throw new IllegalStateException("Unhandled command " + command.getType());
        }
    }

    private static String report(MutationResult result) {
        if (!result.isApplied()) {
            log.warn(result.getMessage());
        } else if (!result.getBefore().isEmpty()) {
            log.info("Changed {} to {}", result.getBefore(), result.getAfter());
        }
        return result.getMessage();
    }
}
