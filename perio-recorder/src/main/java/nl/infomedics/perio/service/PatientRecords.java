package nl.infomedics.perio.service;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import nl.infomedics.perio.model.FlatRecord;

@AllArgsConstructor @Getter
public class PatientRecords {
    private final FlatRecord patient;
    private final List<FlatRecord> appointments; // most recent first
}
