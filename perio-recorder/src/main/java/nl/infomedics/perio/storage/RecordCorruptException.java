package nl.infomedics.perio.storage;

/**
 * A stored record that could not be turned back into a patient and appointment.
 * Collected per record during a load; never aborts the load itself.
 */
public class RecordCorruptException extends Exception {
    private static final long serialVersionUID = -2058613904487135872L;

    private final int position;
    private final Object record;

    public RecordCorruptException(int position, Object record, String message, Throwable cause) {
        super("Record #" + position + ": " + message, cause);
        this.position = position;
        this.record = record;
    }

    /** Zero-based position of the record in the file. */
    public int getPosition() {
        return position;
    }

    public Object getRecord() {
        return record;
    }
}
