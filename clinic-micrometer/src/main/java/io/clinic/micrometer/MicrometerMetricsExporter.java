package io.clinic.micrometer;

import io.clinic.model.AppointmentStatus;
import io.clinic.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code clinic.appointments.created}: appointments booked</li>
 *   <li>{@code clinic.appointments.conflicts}: bookings or moves rejected by the conflict window</li>
 *   <li>{@code clinic.attendance.marked} (tag {@code status=completed|missed}): attendance outcomes</li>
 *   <li>{@code clinic.patients.restricted}: misses that left a patient restricted</li>
 *   <li>{@code clinic.reaccess.submitted}, {@code clinic.reaccess.approved},
 *       {@code clinic.reaccess.rejected}: re-access workflow transitions</li>
 *   <li>{@code clinic.audit.failures}: audit events the sink failed to record</li>
 *   <li>{@code clinic.persistence.failures}: units of work that failed unexpectedly</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter appointmentsCreated;
  private final Counter schedulingConflicts;
  private final Counter attendanceCompleted;
  private final Counter attendanceMissed;
  private final Counter patientsRestricted;
  private final Counter reaccessSubmitted;
  private final Counter reaccessApproved;
  private final Counter reaccessRejected;
  private final Counter auditFailures;
  private final Counter persistenceFailures;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "clinic"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "clinic");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "north.clinic"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.appointmentsCreated = Counter.builder(namePrefix + ".appointments.created")
        .description("Appointments booked")
        .register(registry);
    this.schedulingConflicts = Counter.builder(namePrefix + ".appointments.conflicts")
        .description("Bookings rejected by the conflict window")
        .register(registry);
    this.attendanceCompleted = Counter.builder(namePrefix + ".attendance.marked")
        .description("Attendance outcomes recorded")
        .tag("status", AppointmentStatus.COMPLETED.code())
        .register(registry);
    this.attendanceMissed = Counter.builder(namePrefix + ".attendance.marked")
        .description("Attendance outcomes recorded")
        .tag("status", AppointmentStatus.MISSED.code())
        .register(registry);
    this.patientsRestricted = Counter.builder(namePrefix + ".patients.restricted")
        .description("Missed appointments that left a patient restricted")
        .register(registry);
    this.reaccessSubmitted = Counter.builder(namePrefix + ".reaccess.submitted")
        .description("Re-access requests submitted")
        .register(registry);
    this.reaccessApproved = Counter.builder(namePrefix + ".reaccess.approved")
        .description("Re-access requests approved")
        .register(registry);
    this.reaccessRejected = Counter.builder(namePrefix + ".reaccess.rejected")
        .description("Re-access requests rejected")
        .register(registry);
    this.auditFailures = Counter.builder(namePrefix + ".audit.failures")
        .description("Audit events the sink failed to record")
        .register(registry);
    this.persistenceFailures = Counter.builder(namePrefix + ".persistence.failures")
        .description("Units of work rolled back by an unexpected error")
        .register(registry);
  }

  @Override
  public void incrementAppointmentsCreated() {
    if (closed) return;
    appointmentsCreated.increment();
  }

  @Override
  public void incrementSchedulingConflicts() {
    if (closed) return;
    schedulingConflicts.increment();
  }

  @Override
  public void incrementAttendanceMarked(AppointmentStatus status) {
    if (closed) return;
    if (status == AppointmentStatus.COMPLETED) {
      attendanceCompleted.increment();
    } else if (status == AppointmentStatus.MISSED) {
      attendanceMissed.increment();
    }
  }

  @Override
  public void incrementPatientsRestricted() {
    if (closed) return;
    patientsRestricted.increment();
  }

  @Override
  public void incrementReaccessSubmitted() {
    if (closed) return;
    reaccessSubmitted.increment();
  }

  @Override
  public void incrementReaccessApproved() {
    if (closed) return;
    reaccessApproved.increment();
  }

  @Override
  public void incrementReaccessRejected() {
    if (closed) return;
    reaccessRejected.increment();
  }

  @Override
  public void incrementAuditFailures() {
    if (closed) return;
    auditFailures.increment();
  }

  @Override
  public void incrementPersistenceFailures() {
    if (closed) return;
    persistenceFailures.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(appointmentsCreated, schedulingConflicts, attendanceCompleted, attendanceMissed,
        patientsRestricted, reaccessSubmitted, reaccessApproved, reaccessRejected, auditFailures,
        persistenceFailures)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
