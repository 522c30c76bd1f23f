package nl.infomedics.perio.service;

import java.util.Collections;
import java.util.Map;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a mutation. "Not found" is a normal outcome, not an exception.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MutationResult {

    public enum Outcome {
        APPLIED,
        NOT_FOUND
    }

    private final Outcome outcome;
    private final String message;
    // changed patient attributes, only filled by modifyPatient
    private final Map<String, Object> before;
    private final Map<String, Object> after;

    public static MutationResult applied(String message) {
        return new MutationResult(Outcome.APPLIED, message, Collections.emptyMap(), Collections.emptyMap());
    }

    public static MutationResult notFound(String message) {
        return new MutationResult(Outcome.NOT_FOUND, message, Collections.emptyMap(), Collections.emptyMap());
    }

    public static MutationResult patientModified(String message, Map<String, Object> before, Map<String, Object> after) {
        return new MutationResult(Outcome.APPLIED, message, Collections.unmodifiableMap(before),
                Collections.unmodifiableMap(after));
    }

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }

    @Override
    public String toString() {
        return message;
    }
}
