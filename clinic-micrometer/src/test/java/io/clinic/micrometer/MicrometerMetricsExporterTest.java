package io.clinic.micrometer;

import io.clinic.model.AppointmentStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void schedulingCounters() {
    exporter.incrementAppointmentsCreated();
    exporter.incrementAppointmentsCreated();
    exporter.incrementSchedulingConflicts();

    assertEquals(2.0, counter("clinic.appointments.created").count());
    assertEquals(1.0, counter("clinic.appointments.conflicts").count());
  }

  @Test
  void attendanceIsTaggedByStatus() {
    exporter.incrementAttendanceMarked(AppointmentStatus.MISSED);
    exporter.incrementAttendanceMarked(AppointmentStatus.MISSED);
    exporter.incrementAttendanceMarked(AppointmentStatus.COMPLETED);
    exporter.incrementAttendanceMarked(AppointmentStatus.CANCELLED);
    exporter.incrementPatientsRestricted();

    assertEquals(2.0, registry.find("clinic.attendance.marked").tag("status", "missed").counter().count());
    assertEquals(1.0, registry.find("clinic.attendance.marked").tag("status", "completed").counter().count());
    assertEquals(1.0, counter("clinic.patients.restricted").count());
  }

  @Test
  void reaccessCounters() {
    exporter.incrementReaccessSubmitted();
    exporter.incrementReaccessSubmitted();
    exporter.incrementReaccessApproved();
    exporter.incrementReaccessRejected();

    assertEquals(2.0, counter("clinic.reaccess.submitted").count());
    assertEquals(1.0, counter("clinic.reaccess.approved").count());
    assertEquals(1.0, counter("clinic.reaccess.rejected").count());
  }

  @Test
  void failureCounters() {
    exporter.incrementAuditFailures();
    exporter.incrementPersistenceFailures();
    exporter.incrementPersistenceFailures();

    assertEquals(1.0, counter("clinic.audit.failures").count());
    assertEquals(2.0, counter("clinic.persistence.failures").count());
  }

  @Test
  void customNamePrefix() {
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "north.clinic");
    custom.incrementAppointmentsCreated();

    assertEquals(1.0, counter("north.clinic.appointments.created").count());
    assertEquals(0.0, counter("clinic.appointments.created").count());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterIncrements() {
    exporter.incrementAppointmentsCreated();
    exporter.close();

    assertNull(registry.find("clinic.appointments.created").counter());
    assertTrue(registry.getMeters().isEmpty());
    exporter.incrementAppointmentsCreated();
    assertNull(registry.find("clinic.appointments.created").counter());
  }

  @Test
  void invalidArgumentsThrow() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "clinic."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }
}
