package nl.infomedics.perio.cli;

import java.util.Optional;

/**
 * Flags understood on the command line, with the number of values each takes and
 * whether the records file is saved afterwards.
 */
public enum CommandType {
    FIND("-f", "--find", 1, 1, false),
    TODAY("-t", "--today", 0, 0, false),
    STATS("-s", "--stats", 0, 2, false),
    DELETE_PATIENT("-dp", "--delete_patient", 1, 1, true),
    DELETE_APPOINTMENT("-da", "--delete_apt", 2, 2, true),
    RETURN_RECORDS("-r", "--return_records", 1, 1, false),
    MODIFY_PATIENT("-mp", "--modify_patient", 5, 5, true),
    ADD_APPOINTMENT("-a", "--add_appointment", 1, Integer.MAX_VALUE, true),
    MODIFY_APPOINTMENT("-m", "--modify_appointment", 1, Integer.MAX_VALUE, true);

    private final String shortFlag;
    private final String longFlag;
    private final int minValues;
    private final int maxValues;
    private final boolean mutating; // false: the records file is not rewritten

    CommandType(String shortFlag, String longFlag, int minValues, int maxValues, boolean mutating) {
        this.shortFlag = shortFlag;
        this.longFlag = longFlag;
        this.minValues = minValues;
        this.maxValues = maxValues;
        this.mutating = mutating;
    }

    public String getShortFlag() {
        return shortFlag;
    }

    public String getLongFlag() {
        return longFlag;
    }

    public int getMinValues() {
        return minValues;
    }

    public int getMaxValues() {
        return maxValues;
    }

    public boolean isMutating() {
        return mutating;
    }

    public static Optional<CommandType> fromFlag(String flag) {
        for (CommandType type : values()) {
            if (type.shortFlag.equals(flag) || type.longFlag.equals(flag)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
