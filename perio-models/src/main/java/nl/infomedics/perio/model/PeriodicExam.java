package nl.infomedics.perio.model;

import java.util.List;
import java.util.Map;

/** Routine periodontal maintenance exam. Carries no procedures of its own. */
public class PeriodicExam extends Appointment {
	public static final List<String> PROCEDURES = List.of();

	public PeriodicExam(FlatRecord record) {
		super(record);
	}

	@Override
	public AppointmentType getType() {
		return AppointmentType.PERIODIC_EXAM;
	}

	@Override
	protected void collectProcedures(Map<String, Occurrence> target) {
		// none
	}
}
