package nl.infomedics.perio.model;

import java.util.List;
import java.util.Map;

import lombok.Getter;

@Getter
public class Surgery extends Appointment {
	public static final List<String> PROCEDURES = List.of("biopsy", "extractions", "uncovery", "implant",
			"crown_lengthening", "soft_tissue", "perio", "miscellaneous", "sinus", "peri_implantitis");

	private final Occurrence biopsy;
	private final Occurrence extractions;
	private final Occurrence uncovery;
	private final Occurrence implant;
	private final Occurrence crownLengthening;
	private final Occurrence softTissue;
	private final Occurrence perio;
	private final Occurrence miscellaneous;
	private final Occurrence sinus;
	private final Occurrence periImplantitis;

	public Surgery(FlatRecord record) {
		super(record);
		this.biopsy = procedure(record, "biopsy");
		this.extractions = procedure(record, "extractions");
		this.uncovery = procedure(record, "uncovery");
		this.implant = procedure(record, "implant");
		this.crownLengthening = procedure(record, "crown_lengthening");
		this.softTissue = procedure(record, "soft_tissue");
		this.perio = procedure(record, "perio");
		this.miscellaneous = procedure(record, "miscellaneous");
		this.sinus = procedure(record, "sinus");
		this.periImplantitis = procedure(record, "peri_implantitis");
	}

	@Override
	public AppointmentType getType() {
		return AppointmentType.SURGERY;
	}

	@Override
	protected void collectProcedures(Map<String, Occurrence> target) {
		target.put("biopsy", biopsy);
		target.put("extractions", extractions);
		target.put("uncovery", uncovery);
		target.put("implant", implant);
		target.put("crown_lengthening", crownLengthening);
		target.put("soft_tissue", softTissue);
		target.put("perio", perio);
		target.put("miscellaneous", miscellaneous);
		target.put("sinus", sinus);
		target.put("peri_implantitis", periImplantitis);
	}
}
