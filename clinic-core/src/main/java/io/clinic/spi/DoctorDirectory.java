package io.clinic.spi;

import java.sql.Connection;
import java.util.OptionalLong;

/**
 * Resolves staff login accounts to doctor scheduling identities.
 */
@FunctionalInterface
public interface DoctorDirectory {

    /**
     * @param staffAccountId the doctor's login account id
     * @return the doctor id, or empty if the account is not a doctor
     */
    OptionalLong resolveDoctor(Connection conn, long staffAccountId);
}
