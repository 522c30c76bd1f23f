package nl.infomedics.perio.model;

import java.util.List;
import java.util.Map;

import lombok.Getter;

@Getter
public class ComprehensiveExam extends Appointment {
	public static final List<String> PROCEDURES = List.of("periodontitis", "executive_health", "recession", "hygiene",
			"return_", "oncology", "implant", "oral_path");

	private final Occurrence periodontitis;
	private final Occurrence executiveHealth;
	private final Occurrence recession;
	private final Occurrence hygiene;
	private final Occurrence returnVisit;
	private final Occurrence oncology;
	private final Occurrence implant;
	private final Occurrence oralPath;

	public ComprehensiveExam(FlatRecord record) {
		super(record);
		this.periodontitis = procedure(record, "periodontitis");
		this.executiveHealth = procedure(record, "executive_health");
		this.recession = procedure(record, "recession");
		this.hygiene = procedure(record, "hygiene");
		this.returnVisit = procedure(record, "return_");
		this.oncology = procedure(record, "oncology");
		this.implant = procedure(record, "implant");
		this.oralPath = procedure(record, "oral_path");
	}

	@Override
	public AppointmentType getType() {
		return AppointmentType.COMPREHENSIVE_EXAM;
	}

	@Override
	protected void collectProcedures(Map<String, Occurrence> target) {
		target.put("periodontitis", periodontitis);
		target.put("executive_health", executiveHealth);
		target.put("recession", recession);
		target.put("hygiene", hygiene);
		target.put("return_", returnVisit);
		target.put("oncology", oncology);
		target.put("implant", implant);
		target.put("oral_path", oralPath);
	}
}
