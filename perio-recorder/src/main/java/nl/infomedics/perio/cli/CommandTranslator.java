package nl.infomedics.perio.cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import nl.infomedics.perio.error.ValidationException;
import nl.infomedics.perio.model.AppointmentType;
import nl.infomedics.perio.model.FlatRecord;
import nl.infomedics.perio.model.Patient;

/**
 * Turns command-line flags into {@link Command}s and command values into flat records.
 * <p>
 * Appointment tokens: {@code DATE:yyyymmdd} and a type name are required;
 * {@code NOTE:words-joined-by-dashes} and {@code ASA:n} are optional; for a new
 * patient {@code FIRST:}, {@code LAST:}, {@code BIRTHDAY:} and {@code SEX:} supply the
 * patient attributes. Every other token names a procedure that occurred.
 */
@Slf4j
@Component
public class CommandTranslator {
    private static final String DATE_PREFIX = "DATE:";
    private static final String NOTE_PREFIX = "NOTE:";
    private static final String ASA_PREFIX = "ASA:";
    // --records.path=... and similar are Spring Boot property overrides, not commands
    private static final Pattern SPRING_PROPERTY = Pattern.compile("--[^=\\s]+=.*");
    private static final Map<String, String> PATIENT_PREFIXES = new LinkedHashMap<>();

    static {
        PATIENT_PREFIXES.put("FIRST:", FlatRecord.FIRST);
        PATIENT_PREFIXES.put("LAST:", FlatRecord.LAST);
        PATIENT_PREFIXES.put("BIRTHDAY:", FlatRecord.BIRTHDAY);
        PATIENT_PREFIXES.put("SEX:", FlatRecord.SEX);
    }

    /**
     * Parses the first flag and its values; later flags are ignored, and so are
     * Spring Boot property overrides such as {@code --records.path=other.yaml}.
     *
     * @return empty when no arguments were given
     * @throws ValidationException on an unknown flag or a wrong number of values
     */
    public Optional<Command> translate(String... rawArgs) {
        String[] args = rawArgs == null ? new String[0] : Arrays.stream(rawArgs)
                .filter(arg -> !SPRING_PROPERTY.matcher(arg).matches())
                .toArray(String[]::new);
        if (args.length == 0) {
            return Optional.empty();
        }
        CommandType type = CommandType.fromFlag(args[0])
                .orElseThrow(() -> new ValidationException("command", "Unknown option: " + args[0] + ". " + usage()));
        List<String> values = new ArrayList<>();
        for (int i = 1; i < args.length && values.size() < type.getMaxValues(); i++) {
            if (CommandType.fromFlag(args[i]).isPresent()) {
                log.warn("Ignoring {} and the arguments after it: one option per run", args[i]);
                break;
            }
            values.add(args[i]);
        }
        if (values.size() < type.getMinValues()) {
            throw new ValidationException("command", type.getLongFlag() + " expects at least " + type.getMinValues()
                    + " value(s), got " + values.size());
        }
        if (type == CommandType.STATS && values.size() == 1) {
            throw new ValidationException("command", type.getLongFlag() + " expects no dates or both dates");
        }
        log.debug("translate({}) = {} {}", Arrays.toString(args), type, values);
        return Optional.of(new Command(type, List.copyOf(values)));
    }

    /** Record for --modify_patient: mrn, first, last, birthday, sex. */
    public FlatRecord patientRecord(List<String> values) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(FlatRecord.MRN, requireMrn(values.get(0)));
        record.put(FlatRecord.FIRST, values.get(1));
        record.put(FlatRecord.LAST, values.get(2));
        record.put(FlatRecord.BIRTHDAY, values.get(3));
        record.put(FlatRecord.SEX, values.get(4));
        return FlatRecord.of(record);
    }

    /**
     * Record for --add_appointment and --modify_appointment. The first value is the
     * MRN; patient attributes come from {@code existing} when the patient is known.
     */
    public FlatRecord appointmentRecord(List<String> values, Optional<Patient> existing) {
        String mrn = requireMrn(values.get(0));
        Map<String, Object> patientFields = new LinkedHashMap<>();
        Map<String, Object> appointmentFields = new LinkedHashMap<>();
        List<String> procedures = new ArrayList<>();
        AppointmentType type = null;

        for (String token : values.subList(1, values.size())) {
            String upper = token.toUpperCase(Locale.ROOT);
            if (upper.startsWith(DATE_PREFIX)) {
                appointmentFields.put(FlatRecord.DATE, token.substring(DATE_PREFIX.length()));
            } else if (upper.startsWith(NOTE_PREFIX)) {
                appointmentFields.put(FlatRecord.NOTE, token.substring(NOTE_PREFIX.length()).replace('-', ' '));
            } else if (upper.startsWith(ASA_PREFIX)) {
                appointmentFields.put(FlatRecord.ASA, token.substring(ASA_PREFIX.length()));
            } else if (patientPrefix(upper).isPresent()) {
                String prefix = patientPrefix(upper).get();
                patientFields.put(PATIENT_PREFIXES.get(prefix), token.substring(prefix.length()));
            } else if (isAppointmentType(token)) {
                if (type != null) {
                    throw new ValidationException(FlatRecord.TYPE, "Only one appointment type allowed, got "
                            + type.getDiscriminator() + " and " + token);
                }
                type = AppointmentType.fromDiscriminator(token);
            } else {
                procedures.add(token);
            }
        }

        if (!appointmentFields.containsKey(FlatRecord.DATE)) {
            throw new ValidationException(FlatRecord.DATE, "Appointment date must be included as DATE:yyyymmdd");
        }
        if (type == null) {
            throw new ValidationException(FlatRecord.TYPE, "Appointment type must be included, one of "
                    + Arrays.toString(discriminators()));
        }
        for (String procedure : procedures) {
            if (!type.getProcedures().contains(procedure)) {
                throw new ValidationException(procedure, "Unknown procedure '" + procedure + "' for "
                        + type.getDiscriminator() + ", expected one of " + type.getProcedures());
            }
        }

        FlatRecord record = existing.map(Patient::toRecord)
                .orElseGet(() -> FlatRecord.of(Map.of(FlatRecord.MRN, mrn)))
                .merge(FlatRecord.of(patientFields))
                .with(FlatRecord.TYPE, type.getDiscriminator());
        record = record.merge(FlatRecord.of(appointmentFields));
        for (String procedure : procedures) {
            record = record.with(procedure, Boolean.TRUE);
        }
        log.debug("appointmentRecord() = {}", record);
        return record;
    }

    public String usage() {
        StringBuilder sb = new StringBuilder("Usage: one of");
        for (CommandType type : CommandType.values()) {
            sb.append(' ').append(type.getShortFlag()).append('/').append(type.getLongFlag());
        }
        return sb.toString();
    }

    private static String requireMrn(String mrn) {
        if (mrn == null || mrn.isEmpty() || !mrn.chars().allMatch(Character::isDigit)) {
            throw new ValidationException(FlatRecord.MRN, "MRN must be all numerical digits, got '" + mrn + "'");
        }
        return mrn;
    }

    private static Optional<String> patientPrefix(String upperToken) {
        return PATIENT_PREFIXES.keySet().stream().filter(upperToken::startsWith).findFirst();
    }

    private static boolean isAppointmentType(String token) {
        return Arrays.asList(discriminators()).contains(token);
    }

    private static String[] discriminators() {
        return Arrays.stream(AppointmentType.values()).map(AppointmentType::getDiscriminator).toArray(String[]::new);
    }
}
