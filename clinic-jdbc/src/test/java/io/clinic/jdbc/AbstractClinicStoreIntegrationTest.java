package io.clinic.jdbc;

import io.clinic.jdbc.store.JdbcAppointmentStore;
import io.clinic.jdbc.store.JdbcDoctorDirectory;
import io.clinic.jdbc.store.JdbcPatientDirectory;
import io.clinic.jdbc.store.JdbcReaccessStore;
import io.clinic.model.AccountStatus;
import io.clinic.model.Appointment;
import io.clinic.model.AppointmentStatus;
import io.clinic.model.AppointmentView;
import io.clinic.model.ConflictingAppointment;
import io.clinic.model.PatientAccountState;
import io.clinic.model.ReaccessRequest;
import io.clinic.model.ReaccessRequestView;
import io.clinic.model.ReaccessStatus;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Store behaviour shared by every supported database. Subclasses provide a
 * DataSource with the schema applied and empty tables.
 */
abstract class AbstractClinicStoreIntegrationTest {

  private static final Instant AT = Instant.parse("2026-03-02T09:00:00Z");
  private static final Instant CREATED = Instant.parse("2026-03-01T12:00:00Z");

  private final JdbcAppointmentStore appointments = new JdbcAppointmentStore();
  private final JdbcPatientDirectory patients = new JdbcPatientDirectory();
  private final JdbcDoctorDirectory doctors = new JdbcDoctorDirectory();
  private final JdbcReaccessStore requests = new JdbcReaccessStore();

  abstract DataSource dataSource();

  @Test
  void insertAndFindAppointment() throws Exception {
    long doctorId = ClinicSchema.insertDoctor(dataSource(), 10, "Dr. Adams");
    long patientId = ClinicSchema.insertPatient(dataSource(), 20, "Alice Smith", "active", 0);

    try (Connection conn = dataSource().getConnection()) {
      long id = appointments.insert(conn, patientId, doctorId, AT, "checkup", CREATED);

      Appointment found = appointments.findById(conn, id).orElseThrow();
      assertEquals(patientId, found.patientId());
      assertEquals(doctorId, found.doctorId());
      assertEquals(AT, found.scheduledAt());
      assertEquals("checkup", found.reason());
      assertEquals(AppointmentStatus.SCHEDULED, found.status());
      assertEquals(CREATED, found.createdAt());
      assertEquals(found, appointments.findByIdForUpdate(conn, id).orElseThrow());
      assertTrue(appointments.findById(conn, id + 1000).isEmpty());
    }
  }

  @Test
  void conflictWindowIsOpenAtBothEnds() throws Exception {
    long doctorId = ClinicSchema.insertDoctor(dataSource(), 10, "Dr. Adams");
    long patientId = ClinicSchema.insertPatient(dataSource(), 20, "Alice Smith", "active", 0);
    Duration window = Duration.ofMinutes(15);

    try (Connection conn = dataSource().getConnection()) {
      long id = appointments.insert(conn, patientId, doctorId, AT, "", CREATED);

      Instant near = AT.plus(Duration.ofMinutes(10));
      Optional<ConflictingAppointment> conflict =
          appointments.findConflict(conn, doctorId, near.minus(window), near.plus(window));
      assertEquals(id, conflict.orElseThrow().appointmentId());
      assertEquals(AT, conflict.get().scheduledAt());
      assertEquals("Alice Smith", conflict.get().patientName());

      Instant edge = AT.plus(window);
      assertTrue(appointments.findConflict(conn, doctorId, edge.minus(window), edge.plus(window)).isEmpty());
      assertTrue(appointments.findConflictExcluding(conn, doctorId, near.minus(window), near.plus(window), id)
          .isEmpty());
    }
  }

  @Test
  void onlyScheduledAppointmentsConflict() throws Exception {
    long doctorId = ClinicSchema.insertDoctor(dataSource(), 10, "Dr. Adams");
    long patientId = ClinicSchema.insertPatient(dataSource(), 20, "Alice Smith", "active", 0);

    try (Connection conn = dataSource().getConnection()) {
      long id = appointments.insert(conn, patientId, doctorId, AT, "", CREATED);
      assertTrue(appointments.updateStatus(conn, id, AppointmentStatus.CANCELLED));

      assertTrue(appointments.findConflict(conn, doctorId, AT.minusSeconds(60), AT.plusSeconds(60)).isEmpty());
    }
  }

  @Test
  void updateScheduleAndDelete() throws Exception {
    long doctorId = ClinicSchema.insertDoctor(dataSource(), 10, "Dr. Adams");
    long patientId = ClinicSchema.insertPatient(dataSource(), 20, "Alice Smith", "active", 0);

    try (Connection conn = dataSource().getConnection()) {
      long id = appointments.insert(conn, patientId, doctorId, AT, "checkup", CREATED);
      Instant moved = AT.plus(Duration.ofHours(2));

      assertTrue(appointments.updateSchedule(conn, id, moved, "follow-up"));
      Appointment updated = appointments.findById(conn, id).orElseThrow();
      assertEquals(moved, updated.scheduledAt());
      assertEquals("follow-up", updated.reason());

      assertTrue(appointments.delete(conn, id));
      assertFalse(appointments.delete(conn, id));
      assertFalse(appointments.updateStatus(conn, id, AppointmentStatus.COMPLETED));
    }
  }

  @Test
  void lockDoctorCalendarReportsMissingDoctor() throws Exception {
    long doctorId = ClinicSchema.insertDoctor(dataSource(), 10, "Dr. Adams");

    try (Connection conn = dataSource().getConnection()) {
      conn.setAutoCommit(false);
      assertTrue(appointments.lockDoctorCalendar(conn, doctorId));
      assertFalse(appointments.lockDoctorCalendar(conn, doctorId + 1000));
      conn.rollback();
    }
  }

  @Test
  void findFiltersAndOrdersNewestFirst() throws Exception {
    long adams = ClinicSchema.insertDoctor(dataSource(), 10, "Dr. Adams");
    long brown = ClinicSchema.insertDoctor(dataSource(), 11, "Dr. Brown");
    long alice = ClinicSchema.insertPatient(dataSource(), 20, "Alice Smith", "active", 0);
    long bob = ClinicSchema.insertPatient(dataSource(), 21, "Bob Jones", "restricted", 3);

    try (Connection conn = dataSource().getConnection()) {
      long first = appointments.insert(conn, alice, adams, AT, "", CREATED);
      long second = appointments.insert(conn, bob, adams, AT.plus(Duration.ofDays(1)), "", CREATED);
      long third = appointments.insert(conn, alice, brown, AT.plus(Duration.ofDays(2)), "", CREATED);
      appointments.updateStatus(conn, first, AppointmentStatus.MISSED);

      List<AppointmentView> all = appointments.find(conn, null, null, null);
      assertEquals(List.of(third, second, first), ids(all));

      assertEquals(List.of(second, first), ids(appointments.find(conn, adams, null, null)));
      assertEquals(List.of(third, first), ids(appointments.find(conn, null, alice, null)));
      assertEquals(List.of(first), ids(appointments.find(conn, adams, alice, AppointmentStatus.MISSED)));
      assertTrue(appointments.find(conn, brown, bob, null).isEmpty());

      AppointmentView view = all.get(1);
      assertEquals("Bob Jones", view.patientName());
      assertEquals("555-21", view.patientPhone());
      assertEquals(AccountStatus.RESTRICTED, view.patientAccountStatus());
      assertEquals("Dr. Adams", view.doctorName());
    }
  }

  @Test
  void patientDirectoryTracksMissedCountAndStatus() throws Exception {
    long patientId = ClinicSchema.insertPatient(dataSource(), 20, "Alice Smith", "active", 2);

    try (Connection conn = dataSource().getConnection()) {
      PatientAccountState state = patients.getAccountState(conn, patientId).orElseThrow();
      assertEquals("Alice Smith", state.displayName());
      assertEquals(AccountStatus.ACTIVE, state.status());
      assertEquals(2, state.missedCount());

      assertTrue(patients.incrementMissedCount(conn, patientId));
      assertEquals(3, patients.lockAccountState(conn, patientId).orElseThrow().missedCount());

      assertTrue(patients.setAccountState(conn, patientId, AccountStatus.RESTRICTED, 3));
      assertTrue(patients.getAccountState(conn, patientId).orElseThrow().isRestricted());

      assertTrue(patients.setMissedCount(conn, patientId, 0));
      PatientAccountState reset = patients.getAccountState(conn, patientId).orElseThrow();
      assertEquals(0, reset.missedCount());
      assertEquals(AccountStatus.RESTRICTED, reset.status());

      assertFalse(patients.incrementMissedCount(conn, patientId + 1000));
      assertTrue(patients.getAccountState(conn, patientId + 1000).isEmpty());
    }
  }

  @Test
  void directoriesResolveAccounts() throws Exception {
    long doctorId = ClinicSchema.insertDoctor(dataSource(), 10, "Dr. Adams");
    long patientId = ClinicSchema.insertPatient(dataSource(), 20, "Alice Smith", "active", 0);

    try (Connection conn = dataSource().getConnection()) {
      assertEquals(OptionalLong.of(doctorId), doctors.resolveDoctor(conn, 10));
      assertEquals(OptionalLong.empty(), doctors.resolveDoctor(conn, 20));
      assertEquals(OptionalLong.of(patientId), patients.resolvePatient(conn, 20));
      assertEquals(OptionalLong.empty(), patients.resolvePatient(conn, 10));
    }
  }

  @Test
  void reaccessRequestLifecycle() throws Exception {
    long patientId = ClinicSchema.insertPatient(dataSource(), 20, "Alice Smith", "restricted", 3);

    try (Connection conn = dataSource().getConnection()) {
      long id = requests.insert(conn, patientId, "I was in hospital", "555-0100", CREATED);

      ReaccessRequest pending = requests.findPending(conn, patientId).orElseThrow();
      assertEquals(id, pending.requestId());
      assertEquals(ReaccessStatus.PENDING, pending.status());
      assertEquals("555-0100", pending.contactPhone());
      assertEquals(CREATED, pending.submittedAt());
      assertNull(pending.processedAt());
      assertNull(pending.processedBy());

      List<ReaccessRequestView> queue = requests.findPendingQueue(conn);
      assertEquals(1, queue.size());
      assertEquals("Alice Smith", queue.get(0).patientName());
      assertEquals("NID-20", queue.get(0).nationalId());
      assertEquals(3, queue.get(0).missedCount());

      Instant processed = CREATED.plus(Duration.ofHours(1));
      assertTrue(requests.markProcessed(conn, id, ReaccessStatus.APPROVED, "ok", 900, processed));
      assertFalse(requests.markProcessed(conn, id, ReaccessStatus.REJECTED, "no", 901, processed));

      ReaccessRequest approved = requests.findByIdForUpdate(conn, id).orElseThrow();
      assertEquals(ReaccessStatus.APPROVED, approved.status());
      assertEquals("ok", approved.adminResponse());
      assertEquals(processed, approved.processedAt());
      assertEquals(900L, approved.processedBy());

      assertTrue(requests.findPending(conn, patientId).isEmpty());
      assertTrue(requests.findPendingQueue(conn).isEmpty());
      assertEquals(1, requests.findAll(conn).size());
      assertTrue(requests.findById(conn, id + 1000).isEmpty());
    }
  }

  private static List<Long> ids(List<AppointmentView> views) {
    return views.stream().map(v -> v.appointment().appointmentId()).toList();
  }
}
