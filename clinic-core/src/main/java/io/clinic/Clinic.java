package io.clinic;

import io.clinic.attendance.AttendanceResult;
import io.clinic.attendance.AttendanceTracker;
import io.clinic.audit.AuditPublisher;
import io.clinic.audit.LoggingAuditSink;
import io.clinic.model.Actor;
import io.clinic.model.Appointment;
import io.clinic.model.AppointmentQuery;
import io.clinic.model.AppointmentStatus;
import io.clinic.model.AppointmentView;
import io.clinic.model.PatientAccountState;
import io.clinic.model.ReaccessRequest;
import io.clinic.model.ReaccessRequestView;
import io.clinic.reaccess.ReaccessWorkflow;
import io.clinic.schedule.Scheduler;
import io.clinic.spi.AppointmentStore;
import io.clinic.spi.AuditSink;
import io.clinic.spi.DoctorDirectory;
import io.clinic.spi.MetricsExporter;
import io.clinic.spi.PatientDirectory;
import io.clinic.spi.ReaccessStore;
import io.clinic.spi.TransactionRunner;
import io.clinic.spi.TxContext;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite entry point that wires {@link Scheduler}, {@link AttendanceTracker} and
 * {@link ReaccessWorkflow} over one set of stores and one unit of work.
 *
 * <p>Every operation returns an {@link Outcome}; none throws for business failures
 * or storage errors.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Clinic clinic = Clinic.builder()
 *     .transactionRunner(runner)
 *     .txContext(txContext)
 *     .appointmentStore(new JdbcAppointmentStore())
 *     .patientDirectory(new JdbcPatientDirectory())
 *     .doctorDirectory(new JdbcDoctorDirectory())
 *     .reaccessStore(new JdbcReaccessStore())
 *     .build();
 *
 * Outcome<Long> booked = clinic.scheduleCreate(doctorAccountId, patientId, when, "Checkup");
 * }</pre>
 */
public final class Clinic {

  private final Scheduler scheduler;
  private final AttendanceTracker attendanceTracker;
  private final ReaccessWorkflow reaccessWorkflow;

  private Clinic(Scheduler scheduler, AttendanceTracker attendanceTracker, ReaccessWorkflow reaccessWorkflow) {
    this.scheduler = scheduler;
    this.attendanceTracker = attendanceTracker;
    this.reaccessWorkflow = reaccessWorkflow;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Scheduler scheduler() {
    return scheduler;
  }

  public AttendanceTracker attendanceTracker() {
    return attendanceTracker;
  }

  public ReaccessWorkflow reaccessWorkflow() {
    return reaccessWorkflow;
  }

  // ── Scheduling ────────────────────────────────────────────────────

  /**
   * @see Scheduler#create
   */
  public Outcome<Long> scheduleCreate(long doctorAccountId, long patientId, Instant scheduledAt, String reason) {
    return scheduler.create(doctorAccountId, patientId, scheduledAt, reason);
  }

  /**
   * @see Scheduler#reschedule
   */
  public Outcome<Appointment> scheduleReschedule(long appointmentId, Instant newScheduledAt, String reason) {
    return scheduler.reschedule(appointmentId, newScheduledAt, reason);
  }

  public Outcome<Void> scheduleCancel(long appointmentId) {
    return scheduler.cancel(appointmentId);
  }

  public Outcome<Void> scheduleDelete(long appointmentId, Actor actor) {
    return scheduler.delete(appointmentId, actor);
  }

  public Outcome<List<AppointmentView>> appointments(AppointmentQuery query) {
    return scheduler.appointments(query);
  }

  public Outcome<List<AppointmentView>> appointmentsForPatientAccount(long userAccountId) {
    return scheduler.appointmentsForPatientAccount(userAccountId);
  }

  // ── Attendance ────────────────────────────────────────────────────

  /**
   * @see AttendanceTracker#setStatus(long, AppointmentStatus, Actor)
   */
  public Outcome<AttendanceResult> attendanceSetStatus(long appointmentId, AppointmentStatus status) {
    return attendanceTracker.setStatus(appointmentId, status);
  }

  public Outcome<AttendanceResult> attendanceSetStatus(long appointmentId, AppointmentStatus status, Actor actor) {
    return attendanceTracker.setStatus(appointmentId, status, actor);
  }

  public Outcome<PatientAccountState> accountState(long patientId) {
    return attendanceTracker.accountState(patientId);
  }

  // ── Re-access ─────────────────────────────────────────────────────

  public Outcome<Long> reaccessSubmit(long patientId, String reason, String contactPhone) {
    return reaccessWorkflow.submit(patientId, reason, contactPhone);
  }

  public Outcome<ReaccessRequest> reaccessApprove(long requestId, long adminId, String responseText) {
    return reaccessWorkflow.approve(requestId, adminId, responseText);
  }

  public Outcome<ReaccessRequest> reaccessReject(long requestId, long adminId, String responseText) {
    return reaccessWorkflow.reject(requestId, adminId, responseText);
  }

  public Outcome<Optional<ReaccessRequest>> reaccessCheckExisting(long patientId) {
    return reaccessWorkflow.checkExisting(patientId);
  }

  public Outcome<List<ReaccessRequestView>> pendingReaccessRequests() {
    return reaccessWorkflow.pendingRequests();
  }

  public Outcome<List<ReaccessRequestView>> allReaccessRequests() {
    return reaccessWorkflow.allRequests();
  }

  /**
   * Builder for {@link Clinic}. A builder can be used once.
   */
  public static final class Builder {
    private TransactionRunner transactionRunner;
    private TxContext txContext;
    private AppointmentStore appointmentStore;
    private PatientDirectory patientDirectory;
    private DoctorDirectory doctorDirectory;
    private ReaccessStore reaccessStore;
    private AuditSink auditSink;
    private MetricsExporter metrics;
    private Clock clock;
    private ZoneId displayZone;
    private String approvedResponse;
    private String rejectedResponse;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * <b>Required.</b> Runs each operation as one transaction.
     */
    public Builder transactionRunner(TransactionRunner transactionRunner) {
      this.transactionRunner = transactionRunner;
      return this;
    }

    /**
     * <b>Required.</b> Must be the context the transaction runner binds, so audit
     * events fire after the right commit.
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder appointmentStore(AppointmentStore appointmentStore) {
      this.appointmentStore = appointmentStore;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder patientDirectory(PatientDirectory patientDirectory) {
      this.patientDirectory = patientDirectory;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder doctorDirectory(DoctorDirectory doctorDirectory) {
      this.doctorDirectory = doctorDirectory;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder reaccessStore(ReaccessStore reaccessStore) {
      this.reaccessStore = reaccessStore;
      return this;
    }

    /**
     * Optional. Defaults to a {@link LoggingAuditSink}.
     */
    public Builder auditSink(AuditSink auditSink) {
      this.auditSink = auditSink;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to the UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Zone used to format times in conflict messages and audit
     * descriptions. Defaults to UTC.
     */
    public Builder displayZone(ZoneId displayZone) {
      this.displayZone = displayZone;
      return this;
    }

    /**
     * Optional. Response stored on approval when the admin gives none.
     */
    public Builder approvedResponse(String approvedResponse) {
      this.approvedResponse = approvedResponse;
      return this;
    }

    /**
     * Optional. Response stored on rejection when the admin gives none.
     */
    public Builder rejectedResponse(String rejectedResponse) {
      this.rejectedResponse = rejectedResponse;
      return this;
    }

    /**
     * @throws NullPointerException  if a required collaborator is missing
     * @throws IllegalStateException if this builder was already used
     */
    public Clinic build() {
      Objects.requireNonNull(transactionRunner, "transactionRunner");
      Objects.requireNonNull(txContext, "txContext");
      Objects.requireNonNull(appointmentStore, "appointmentStore");
      Objects.requireNonNull(patientDirectory, "patientDirectory");
      Objects.requireNonNull(doctorDirectory, "doctorDirectory");
      Objects.requireNonNull(reaccessStore, "reaccessStore");
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }

      MetricsExporter m = metrics == null ? MetricsExporter.NOOP : metrics;
      Clock c = clock == null ? Clock.systemUTC() : clock;
      ZoneId zone = displayZone == null ? ZoneOffset.UTC : displayZone;
      AuditSink sink = auditSink == null ? new LoggingAuditSink() : auditSink;

      UnitOfWork unitOfWork = new UnitOfWork(transactionRunner, m);
      AuditPublisher audit = new AuditPublisher(txContext, sink, m);
      return new Clinic(
          new Scheduler(unitOfWork, appointmentStore, patientDirectory, doctorDirectory, audit, m, c, zone),
          new AttendanceTracker(unitOfWork, appointmentStore, patientDirectory, audit, m, c),
          new ReaccessWorkflow(unitOfWork, reaccessStore, patientDirectory, audit, m, c,
              approvedResponse, rejectedResponse));
    }
  }
}
