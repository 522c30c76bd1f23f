package nl.infomedics.perio.cli;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import nl.infomedics.perio.config.RecordsProperties;
import nl.infomedics.perio.model.Appointment;
import nl.infomedics.perio.model.FlatRecord;
import nl.infomedics.perio.model.Patient;
import nl.infomedics.perio.service.PatientRecords;

/**
 * Renders command results as JSON for the terminal.
 */
@Component
public class OutputRenderer {
	private final ObjectMapper om;
	private final boolean pretty;

	public OutputRenderer(RecordsProperties properties) {
		this.om = new ObjectMapper()
		.setSerializationInclusion(JsonInclude.Include.NON_NULL)
		.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
		.registerModule(new JavaTimeModule());
		this.pretty = properties.isPrettyOutput();
	}

	public PatientSummary summarize(Patient patient) {
		PatientSummary s = new PatientSummary();
		s.setMrn(patient.getMrn());
		s.setFirst(patient.getFirst());
		s.setLast(patient.getLast());
		s.setBirthday(patient.getBirthday());
		s.setSex(patient.getSex().getValue());
		List<String> appointments = new ArrayList<>();
		for (Appointment appointment : patient.getAppointments()) {
			appointments.add(appointment.toString());
		}
		s.setAppointments(appointments);
		return s;
	}

	public String render(Patient patient) throws JsonProcessingException {
		return stringify(summarize(patient));
	}

	public String render(PatientRecords records) throws JsonProcessingException {
		Map<String, Object> out = new LinkedHashMap<>();
		out.put("patient", records.getPatient().asMap());
		List<Map<String, Object>> appointments = new ArrayList<>();
		for (FlatRecord record : records.getAppointments()) {
			appointments.add(record.asMap());
		}
		out.put("appointments", appointments);
		return stringify(out);
	}

	public String render(LocalDate today) throws JsonProcessingException {
		return stringify(Map.of("today", today));
	}

	public String renderStats(List<Map<String, Integer>> stats) throws JsonProcessingException {
		return stringify(stats);
	}

	String stringify(Object value) throws JsonProcessingException {
		return pretty ? om.writerWithDefaultPrettyPrinter().writeValueAsString(value)
		: om.writeValueAsString(value);
	}

	@NoArgsConstructor @AllArgsConstructor @Getter @Setter
	public static class PatientSummary {
		private String mrn;
		private String first;
		private String last;
		private LocalDate birthday;
		private String sex;
		private List<String> appointments; // e.g. "Surgery on 2021-06-01"
	}
}
