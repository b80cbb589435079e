package io.clinic;

import java.time.Instant;
import java.util.Objects;

/**
 * The kinds of failure a surface operation can report. Each carries enough detail
 * for a presentation layer to show an actionable message.
 *
 * @see Outcome.Failure
 */
public sealed interface ClinicError permits ClinicError.NotFound, ClinicError.PatientRestricted,
        ClinicError.SchedulingConflict, ClinicError.DuplicateRequest, ClinicError.ValidationError,
        ClinicError.InvalidTransition, ClinicError.PermissionDenied, ClinicError.PersistenceFailure {

    /**
     * Stable lowercase identifier of the error kind, e.g. {@code "scheduling_conflict"}.
     */
    String code();

    /**
     * Human-readable description.
     */
    String message();

    /**
     * A referenced appointment, request, doctor or patient does not exist.
     *
     * @param entity entity kind, e.g. {@code "appointment"}
     * @param id     the identifier that was looked up
     */
    record NotFound(String entity, String id) implements ClinicError {
        public NotFound {
            Objects.requireNonNull(entity, "entity");
        }

        public static NotFound of(String entity, long id) {
            return new NotFound(entity, String.valueOf(id));
        }

        @Override
        public String code() {
            return "not_found";
        }

        @Override
        public String message() {
            return capitalize(entity) + " not found: " + id;
        }
    }

    /**
     * Booking blocked because the patient's account is restricted.
     */
    record PatientRestricted(long patientId, String message) implements ClinicError {
        @Override
        public String code() {
            return "patient_restricted";
        }
    }

    /**
     * Requested time falls within the conflict window of another scheduled appointment.
     *
     * @param conflictingAppointmentId the blocking appointment
     * @param conflictingTime          its visit time
     * @param patientName              its patient's display name, may be {@code null}
     * @param message                  display text naming the counterpart and time
     */
    record SchedulingConflict(long conflictingAppointmentId, Instant conflictingTime, String patientName,
                              String message) implements ClinicError {
        @Override
        public String code() {
            return "scheduling_conflict";
        }
    }

    /**
     * A pending re-access request already exists for the patient.
     */
    record DuplicateRequest(long patientId, long pendingRequestId) implements ClinicError {
        @Override
        public String code() {
            return "duplicate_request";
        }

        @Override
        public String message() {
            return "You already have a pending request";
        }
    }

    /**
     * A required field is missing or malformed. Detected before any mutation.
     */
    record ValidationError(String field, String message) implements ClinicError {
        @Override
        public String code() {
            return "validation_error";
        }
    }

    /**
     * The change would move an appointment or request out of a terminal state.
     *
     * @param entity       entity kind
     * @param id           entity identifier
     * @param currentState the state that blocks the change
     * @param message      display text
     */
    record InvalidTransition(String entity, long id, String currentState, String message) implements ClinicError {
        @Override
        public String code() {
            return "invalid_transition";
        }
    }

    /**
     * The acting identity lacks the role the operation requires.
     */
    record PermissionDenied(String action, String message) implements ClinicError {
        @Override
        public String code() {
            return "permission_denied";
        }
    }

    /**
     * The unit of work could not commit; every write in it was rolled back.
     *
     * @param message generic description safe to show to users
     * @param cause   the underlying failure, for logging only
     */
    record PersistenceFailure(String message, Throwable cause) implements ClinicError {
        @Override
        public String code() {
            return "persistence_failure";
        }
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) {
            return s;
        }
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
