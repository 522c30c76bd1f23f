package nl.infomedics.perio.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The records file could not be read or written.
 */
public class StorageUnavailableException extends IOException {
    private static final long serialVersionUID = 4113584060233170961L;

    private final Path path;
    private final boolean missing;

    public StorageUnavailableException(Path path, String message, Throwable cause) {
        this(path, message, cause, false);
    }

    private StorageUnavailableException(Path path, String message, Throwable cause, boolean missing) {
        super(message, cause);
        this.path = path;
        this.missing = missing;
    }

    public static StorageUnavailableException missingFile(Path path) {
        return new StorageUnavailableException(path, "Records file does not exist: " + path, null, true);
    }

    public Path getPath() {
        return path;
    }

    /** True when the file simply does not exist yet, as opposed to an I/O failure. */
    public boolean isMissing() {
        return missing;
    }
}
