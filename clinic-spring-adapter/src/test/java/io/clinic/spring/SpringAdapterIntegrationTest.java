package io.clinic.spring;

import io.clinic.Clinic;
import io.clinic.ClinicError;
import io.clinic.Outcome;
import io.clinic.audit.AuditEvent;
import io.clinic.audit.AuditEventType;
import io.clinic.jdbc.store.JdbcAppointmentStore;
import io.clinic.jdbc.store.JdbcDoctorDirectory;
import io.clinic.jdbc.store.JdbcPatientDirectory;
import io.clinic.jdbc.store.JdbcReaccessStore;
import io.clinic.model.AppointmentStatus;
import io.clinic.model.PatientAccountState;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpringAdapterIntegrationTest {
  private static final Instant TEN = Instant.parse("2026-02-04T10:00:00Z");

  private JdbcDataSource dataSource;
  private SpringTxContext txContext;
  private DataSourceTransactionManager txManager;
  private List<AuditEvent> events;
  private Clinic clinic;
  private long patientId;

  @BeforeEach
  void setup() throws Exception {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:clinic_spring_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    txContext = new SpringTxContext(dataSource);
    txManager = new DataSourceTransactionManager(dataSource);
    events = new ArrayList<>();
    clinic = Clinic.builder()
        .transactionRunner(new SpringTransactionRunner(txManager, txContext))
        .txContext(txContext)
        .appointmentStore(new JdbcAppointmentStore())
        .patientDirectory(new JdbcPatientDirectory())
        .doctorDirectory(new JdbcDoctorDirectory())
        .reaccessStore(new JdbcReaccessStore())
        .auditSink(events::add)
        .build();

    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      for (String stmt : loadResource("/schema/h2.sql").split(";")) {
        if (!stmt.isBlank()) {
          st.execute(stmt.trim());
        }
      }
      st.executeUpdate("INSERT INTO doctors (doctor_id, user_id, full_name) VALUES (1, 10, 'Dr. Adams')");
      st.executeUpdate("INSERT INTO patients (patient_id, user_id, full_name, account_status, " +
          "consecutive_missed_appointments) VALUES (5, 20, 'Alice Smith', 'active', 2)");
    }
    patientId = 5;
  }

  @Test
  void commitPersistsAndPublishesAuditAfterCommit() throws Exception {
    long appointment = clinic.scheduleCreate(10, patientId, TEN, "checkup").value();

    clinic.attendanceSetStatus(appointment, AppointmentStatus.MISSED).value();

    PatientAccountState state = clinic.accountState(patientId).value();
    assertTrue(state.isRestricted());
    assertEquals(3, state.missedCount());
    assertEquals(List.of(AuditEventType.APPOINTMENT_CREATED, AuditEventType.PATIENT_RESTRICTED,
        AuditEventType.APPOINTMENT_MISSED), events.stream().map(AuditEvent::type).toList());
  }

  @Test
  void failureOutcomeRollsBackWithoutAudit() throws Exception {
    long appointment = clinic.scheduleCreate(10, patientId, TEN, "").value();
    events.clear();

    Outcome<Long> clash = clinic.scheduleCreate(10, patientId, TEN.plusSeconds(60), "");

    assertInstanceOf(ClinicError.SchedulingConflict.class, clash.error());
    assertEquals(1, count("SELECT COUNT(*) FROM appointments"));
    assertTrue(events.isEmpty());
    assertTrue(clinic.scheduleCancel(appointment).isSuccess());
  }

  @Test
  void joinsOuterTransactionAndRollsBackWithIt() throws Exception {
    TransactionStatus outer = txManager.getTransaction(new DefaultTransactionDefinition());
    try {
      assertTrue(clinic.scheduleCreate(10, patientId, TEN, "").isSuccess());
    } finally {
      txManager.rollback(outer);
    }

    assertEquals(0, count("SELECT COUNT(*) FROM appointments"));
    assertTrue(events.isEmpty());
  }

  @Test
  void txContextRequiresActiveTransaction() {
    assertFalse(txContext.isTransactionActive());
    assertThrows(IllegalStateException.class, () -> txContext.currentConnection());
    assertThrows(IllegalStateException.class, () -> txContext.afterCommit(() -> { }));
  }

  @Test
  void rollbackDiscardsAfterCommitCallbacks() {
    List<String> calls = new ArrayList<>();

    TransactionStatus status = txManager.getTransaction(new DefaultTransactionDefinition());
    txContext.afterCommit(() -> calls.add("commit"));
    txManager.rollback(status);

    assertTrue(calls.isEmpty());
  }

  @Test
  void failingAfterCommitCallbackDoesNotFailCommit() throws Exception {
    List<String> calls = new ArrayList<>();

    TransactionStatus status = txManager.getTransaction(new DefaultTransactionDefinition());
    try (PreparedStatement ps = txContext.currentConnection().prepareStatement(
        "UPDATE patients SET full_name = 'Alice Jones' WHERE patient_id = 5")) {
      ps.executeUpdate();
    }
    txContext.afterCommit(() -> {
      throw new IllegalStateException("sink down");
    });
    txContext.afterCommit(() -> calls.add("second"));
    txManager.commit(status);

    assertEquals(List.of("second"), calls);
    assertEquals(1, count("SELECT COUNT(*) FROM patients WHERE full_name = 'Alice Jones'"));
  }

  private long count(String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(sql);
         ResultSet rs = ps.executeQuery()) {
      rs.next();
      return rs.getLong(1);
    }
  }

  private static String loadResource(String path) throws IOException {
    try (InputStream is = SpringAdapterIntegrationTest.class.getResourceAsStream(path)) {
      if (is == null) {
        throw new IOException("Resource not found: " + path);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
