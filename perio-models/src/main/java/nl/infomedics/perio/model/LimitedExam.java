package nl.infomedics.perio.model;

import java.util.List;
import java.util.Map;

import lombok.Getter;

/** Problem-focused exam; the procedure fields record what the visit was about. */
@Getter
public class LimitedExam extends Appointment {
	public static final List<String> PROCEDURES = List.of("abscess", "crown_lengthening", "cv_exam", "extraction",
			"frenectomy", "fracture", "implant", "oral_path", "periodontitis", "peri_implantitis", "postop", "return_",
			"recession", "re_evaluation", "miscellaneous");

	private final Occurrence abscess;
	private final Occurrence crownLengthening;
	private final Occurrence cvExam;
	private final Occurrence extraction;
	private final Occurrence frenectomy;
	private final Occurrence fracture;
	private final Occurrence implant;
	private final Occurrence oralPath;
	private final Occurrence periodontitis;
	private final Occurrence periImplantitis;
	private final Occurrence postop;
	private final Occurrence returnVisit;
	private final Occurrence recession;
	private final Occurrence reEvaluation;
	private final Occurrence miscellaneous;

	public LimitedExam(FlatRecord record) {
		super(record);
		this.abscess = procedure(record, "abscess");
		this.crownLengthening = procedure(record, "crown_lengthening");
		this.cvExam = procedure(record, "cv_exam");
		this.extraction = procedure(record, "extraction");
		this.frenectomy = procedure(record, "frenectomy");
		this.fracture = procedure(record, "fracture");
		this.implant = procedure(record, "implant");
		this.oralPath = procedure(record, "oral_path");
		this.periodontitis = procedure(record, "periodontitis");
		this.periImplantitis = procedure(record, "peri_implantitis");
		this.postop = procedure(record, "postop");
		this.returnVisit = procedure(record, "return_");
		this.recession = procedure(record, "recession");
		this.reEvaluation = procedure(record, "re_evaluation");
		this.miscellaneous = procedure(record, "miscellaneous");
	}

	@Override
	public AppointmentType getType() {
		return AppointmentType.LIMITED_EXAM;
	}

	@Override
	protected void collectProcedures(Map<String, Occurrence> target) {
		target.put("abscess", abscess);
		target.put("crown_lengthening", crownLengthening);
		target.put("cv_exam", cvExam);
		target.put("extraction", extraction);
		target.put("frenectomy", frenectomy);
		target.put("fracture", fracture);
		target.put("implant", implant);
		target.put("oral_path", oralPath);
		target.put("periodontitis", periodontitis);
		target.put("peri_implantitis", periImplantitis);
		target.put("postop", postop);
		target.put("return_", returnVisit);
		target.put("recession", recession);
		target.put("re_evaluation", reEvaluation);
		target.put("miscellaneous", miscellaneous);
	}
}
