package nl.infomedics.perio.storage;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import nl.infomedics.perio.model.PatientIndex;

@AllArgsConstructor @Getter
public class LoadResult {
    private final PatientIndex patients;
    private final List<RecordCorruptException> skipped; // records that could not be normalized

    public boolean isClean() {
        return skipped.isEmpty();
    }
}
