package io.clinic.spi;

import io.clinic.model.AccountStatus;
import io.clinic.model.PatientAccountState;

import java.sql.Connection;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Access to the attendance-policy facet of patient records. Patient registration is
 * owned elsewhere; this interface never creates or deletes patients.
 */
public interface PatientDirectory {

    Optional<PatientAccountState> getAccountState(Connection conn, long patientId);

    /**
     * Reads the account state and locks the patient row until the transaction ends.
     */
    Optional<PatientAccountState> lockAccountState(Connection conn, long patientId);

    /**
     * Adds one to the consecutive-missed counter in a single statement.
     *
     * @return {@code true} if the patient exists
     */
    boolean incrementMissedCount(Connection conn, long patientId);

    /**
     * Overwrites account status and counter.
     *
     * @return {@code true} if the patient exists
     */
    boolean setAccountState(Connection conn, long patientId, AccountStatus status, int missedCount);

    /**
     * Sets only the counter, leaving the status untouched.
     *
     * @return {@code true} if the patient exists
     */
    boolean setMissedCount(Connection conn, long patientId, int missedCount);

    /**
     * Resolves a patient login account to its patient record id.
     */
    OptionalLong resolvePatient(Connection conn, long userAccountId);
}
