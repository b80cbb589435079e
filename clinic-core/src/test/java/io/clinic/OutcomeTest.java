package io.clinic;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutcomeTest {

  @Test
  void successCarriesValueAndHasNoError() {
    Outcome<Long> outcome = Outcome.success(42L);

    assertTrue(outcome.isSuccess());
    assertEquals(42L, outcome.value());
    assertThrows(NoSuchElementException.class, outcome::error);
  }

  @Test
  void failureCarriesErrorAndHasNoValue() {
    ClinicError error = ClinicError.NotFound.of("appointment", 7);
    Outcome<Long> outcome = Outcome.failure(error);

    assertFalse(outcome.isSuccess());
    assertSame(error, outcome.error());
    NoSuchElementException ex = assertThrows(NoSuchElementException.class, outcome::value);
    assertTrue(ex.getMessage().contains("Appointment not found: 7"));
  }

  @Test
  void failureRequiresError() {
    assertThrows(NullPointerException.class, () -> Outcome.failure(null));
  }

  @Test
  void errorCodesAreStable() {
    assertEquals("not_found", ClinicError.NotFound.of("patient", 1).code());
    assertEquals("patient_restricted", new ClinicError.PatientRestricted(1, "m").code());
    assertEquals("scheduling_conflict",
        new ClinicError.SchedulingConflict(1, Instant.EPOCH, "Alice", "m").code());
    assertEquals("duplicate_request", new ClinicError.DuplicateRequest(1, 2).code());
    assertEquals("validation_error", new ClinicError.ValidationError("f", "m").code());
    assertEquals("invalid_transition", new ClinicError.InvalidTransition("appointment", 1, "missed", "m").code());
    assertEquals("permission_denied", new ClinicError.PermissionDenied("delete", "m").code());
    assertEquals("persistence_failure", new ClinicError.PersistenceFailure("m", null).code());
  }

  @Test
  void duplicateRequestMessage() {
    assertEquals("You already have a pending request", new ClinicError.DuplicateRequest(3, 9).message());
  }
}
