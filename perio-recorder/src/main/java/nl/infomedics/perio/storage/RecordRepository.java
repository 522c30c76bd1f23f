package nl.infomedics.perio.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import nl.infomedics.perio.config.RecordsProperties;
import nl.infomedics.perio.metrics.DiagnosticsRecorder;
import nl.infomedics.perio.model.FlatRecord;
import nl.infomedics.perio.model.Patient;

/**
 * Reads and writes the YAML records file. Every save rewrites the whole file;
 * there is no append mode and no locking between processes.
 */
@Slf4j
@Component
public class RecordRepository {
    private static final TypeReference<List<Object>> ENTRIES = new TypeReference<>() { };

    @Getter
    private final Path recordsPath;
    private final boolean bootstrapMissingFile;
    private final RecordMapper mapper;
    private final DiagnosticsRecorder diagnostics;
    private final YAMLMapper yaml;

    public RecordRepository(RecordsProperties properties, RecordMapper mapper, DiagnosticsRecorder diagnostics) {
        this.recordsPath = Paths.get(properties.getPath()).toAbsolutePath().normalize();
        this.bootstrapMissingFile = properties.isBootstrapMissingFile();
        this.mapper = mapper;
        this.diagnostics = diagnostics;
        this.yaml = YAMLMapper.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build();
    }

    /**
     * Loads every record and rebuilds the patient graph.
     *
     * @throws StorageUnavailableException when the file cannot be read, or is missing and
     *         bootstrapping a missing file is switched off
     */
    public LoadResult load() throws StorageUnavailableException {
        try (DiagnosticsRecorder.SampleTimer ignored = diagnostics.start(DiagnosticsRecorder.RECORDS_LOAD)) {
            LoadResult result = mapper.normalize(read());
            diagnostics.count(DiagnosticsRecorder.RECORDS_SKIPPED, result.getSkipped().size());
            log.info("Loaded {} patient(s) from {} ({} record(s) skipped)", result.getPatients().size(), recordsPath,
                    result.getSkipped().size());
            return result;
        }
    }

    /** Raw entries of the records file, in file order. */
    public List<Object> read() throws StorageUnavailableException {
        if (!Files.exists(recordsPath)) {
            if (bootstrapMissingFile) {
                log.warn("Records file {} does not exist yet, starting with an empty collection", recordsPath);
                return new ArrayList<>();
            }
            throw StorageUnavailableException.missingFile(recordsPath);
        }
        try (InputStream in = Files.newInputStream(recordsPath)) {
            if (Files.size(recordsPath) == 0) {
                return new ArrayList<>();
            }
            List<Object> entries = yaml.readValue(in, ENTRIES);
            log.debug("Records pulled from {}", recordsPath);
            return entries == null ? new ArrayList<>() : entries;
        } catch (NoSuchFileException e) {
            throw StorageUnavailableException.missingFile(recordsPath);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException(recordsPath, "Records file is not a YAML sequence of records: "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new StorageUnavailableException(recordsPath, "Unable to read records file " + recordsPath, e);
        }
    }

    /** Denormalizes {@code patients} and overwrites the records file with the result. */
    public void save(Collection<Patient> patients) throws StorageUnavailableException {
        save(patients, List.of());
    }

    /**
     * Denormalizes {@code patients} and overwrites the records file with the result,
     * followed by the raw entries of {@code retained}, unchanged.
     */
    public void save(Collection<Patient> patients, List<RecordCorruptException> retained)
            throws StorageUnavailableException {
        try (DiagnosticsRecorder.SampleTimer ignored = diagnostics.start(DiagnosticsRecorder.RECORDS_SAVE)) {
            List<FlatRecord> records = mapper.denormalize(patients);
            List<Object> document = new ArrayList<>(records.size() + retained.size());
            for (FlatRecord record : records) {
                document.add(record.asMap());
            }
            for (RecordCorruptException skipped : retained) {
                document.add(skipped.getRecord());
            }
            if (!retained.isEmpty()) {
                log.warn("Writing back {} corrupt record(s) unchanged to {}", retained.size(), recordsPath);
            }
            write(document);
            log.info("Saved {} record(s) for {} patient(s) to {}", records.size(), patients.size(), recordsPath);
        }
    }

    void write(List<Object> document) throws StorageUnavailableException {
        Path tempPath = recordsPath.resolveSibling(recordsPath.getFileName().toString() + ".part");
        try {
            byte[] bytes = yaml.writeValueAsBytes(document);
            if (recordsPath.getParent() != null) {
                Files.createDirectories(recordsPath.getParent());
            }
            // Write to a temp file and move it over the target so readers never see a partial file
            try (FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                channel.write(ByteBuffer.wrap(bytes));
                channel.force(true);
            }
            try {
                Files.move(tempPath, recordsPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tempPath, recordsPath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Records pushed to {}", recordsPath);
        } catch (IOException e) {
            StorageUnavailableException failure = new StorageUnavailableException(recordsPath,
                    "Unable to write records file " + recordsPath, e);
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }
}
