package io.clinic.reaccess;

import io.clinic.ClinicError;
import io.clinic.Outcome;
import io.clinic.UnitOfWork;
import io.clinic.audit.AuditEvent;
import io.clinic.audit.AuditEventType;
import io.clinic.audit.AuditPublisher;
import io.clinic.model.AccountStatus;
import io.clinic.model.Actor;
import io.clinic.model.ActorRole;
import io.clinic.model.PatientAccountState;
import io.clinic.model.ReaccessRequest;
import io.clinic.model.ReaccessRequestView;
import io.clinic.model.ReaccessStatus;
import io.clinic.spi.MetricsExporter;
import io.clinic.spi.PatientDirectory;
import io.clinic.spi.ReaccessStore;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Appeal path for restricted patients.
 *
 * <p>A patient holds at most one {@code pending} request. Submission locks the
 * patient row before checking, so two concurrent submissions cannot both pass.
 * Approval marks the request and restores the account (status {@code active},
 * counter 0) in one unit of work; rejection leaves the account untouched.
 */
public final class ReaccessWorkflow {

    public static final String DEFAULT_APPROVED_RESPONSE =
        "Your request has been approved. You can now login and book appointments.";
    public static final String DEFAULT_REJECTED_RESPONSE =
        "Your request has been rejected. Please contact the clinic for more information.";

    private static final String ENTITY = "reaccess request";

    private final UnitOfWork unitOfWork;
    private final ReaccessStore reaccessStore;
    private final PatientDirectory patientDirectory;
    private final AuditPublisher audit;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final String approvedResponse;
    private final String rejectedResponse;

    public ReaccessWorkflow(
            UnitOfWork unitOfWork,
            ReaccessStore reaccessStore,
            PatientDirectory patientDirectory,
            AuditPublisher audit,
            MetricsExporter metrics,
            Clock clock,
            String approvedResponse,
            String rejectedResponse
    ) {
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
        this.reaccessStore = Objects.requireNonNull(reaccessStore, "reaccessStore");
        this.patientDirectory = Objects.requireNonNull(patientDirectory, "patientDirectory");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.approvedResponse = isBlank(approvedResponse) ? DEFAULT_APPROVED_RESPONSE : approvedResponse;
        this.rejectedResponse = isBlank(rejectedResponse) ? DEFAULT_REJECTED_RESPONSE : rejectedResponse;
    }

    /**
     * Files a re-access request for the patient.
     *
     * @param contactPhone optional phone number
     * @return the new request id, or {@code validation_error}, {@code not_found} or
     * {@code duplicate_request} if one is already pending
     */
    public Outcome<Long> submit(long patientId, String reason, String contactPhone) {
        if (isBlank(reason)) {
            return Outcome.failure(new ClinicError.ValidationError("reason",
                "Please explain why you need access restored"));
        }
        String phone = isBlank(contactPhone) ? null : contactPhone.trim();

        Outcome<Long> outcome = unitOfWork.run("reaccess submit", conn -> {
            Optional<PatientAccountState> patient = patientDirectory.lockAccountState(conn, patientId);
            if (patient.isEmpty()) {
                return Outcome.failure(ClinicError.NotFound.of("patient", patientId));
            }
            Optional<ReaccessRequest> pending = reaccessStore.findPending(conn, patientId);
            if (pending.isPresent()) {
                return Outcome.failure(new ClinicError.DuplicateRequest(patientId, pending.get().requestId()));
            }
            long requestId = reaccessStore.insert(conn, patientId, reason.trim(), phone, clock.instant());
            String name = patient.get().displayName();
            audit.publishAfterCommit(new AuditEvent(AuditEventType.REACCESS_SUBMITTED,
                "Re-access request submitted by patient: " + name, null, name, ActorRole.PATIENT.code(),
                AuditEvent.TARGET_PATIENT, patientId, clock.instant()));
            return Outcome.success(requestId);
        });

        if (outcome.isSuccess()) {
            metrics.incrementReaccessSubmitted();
        }
        return outcome;
    }

    /**
     * Approves a pending request and restores the patient's account.
     *
     * @param responseText message for the patient, or {@code null} for the configured default
     * @return the processed request, or {@code not_found} or {@code invalid_transition}
     */
    public Outcome<ReaccessRequest> approve(long requestId, long adminId, String responseText) {
        String response = isBlank(responseText) ? approvedResponse : responseText.trim();
        Outcome<ReaccessRequest> outcome = unitOfWork.run("reaccess approve", conn -> {
            Outcome<ReaccessRequest> pending = loadPending(conn, requestId);
            if (!pending.isSuccess()) {
                return pending;
            }
            ReaccessRequest request = pending.value();
            Instant now = clock.instant();
            reaccessStore.markProcessed(conn, requestId, ReaccessStatus.APPROVED, response, adminId, now);
            Optional<PatientAccountState> patient = patientDirectory.getAccountState(conn, request.patientId());
            if (patient.isEmpty()
                    || !patientDirectory.setAccountState(conn, request.patientId(), AccountStatus.ACTIVE, 0)) {
                return Outcome.failure(ClinicError.NotFound.of("patient", request.patientId()));
            }
            audit.publishAfterCommit(AuditEvent.of(AuditEventType.REACCESS_APPROVED,
                    "Re-access request approved for patient: " + patient.get().displayName(),
                    AuditEvent.TARGET_PATIENT, request.patientId(), now)
                .withActor(Actor.admin(adminId)));
            return Outcome.success(processed(request, ReaccessStatus.APPROVED, response, adminId, now));
        });

        if (outcome.isSuccess()) {
            metrics.incrementReaccessApproved();
        }
        return outcome;
    }

    /**
     * Rejects a pending request. The patient stays restricted and may submit again.
     *
     * @param responseText message for the patient, or {@code null} for the configured default
     * @return the processed request, or {@code not_found} or {@code invalid_transition}
     */
    public Outcome<ReaccessRequest> reject(long requestId, long adminId, String responseText) {
        String response = isBlank(responseText) ? rejectedResponse : responseText.trim();
        Outcome<ReaccessRequest> outcome = unitOfWork.run("reaccess reject", conn -> {
            Outcome<ReaccessRequest> pending = loadPending(conn, requestId);
            if (!pending.isSuccess()) {
                return pending;
            }
            ReaccessRequest request = pending.value();
            Instant now = clock.instant();
            reaccessStore.markProcessed(conn, requestId, ReaccessStatus.REJECTED, response, adminId, now);
            String name = patientDirectory.getAccountState(conn, request.patientId())
                .map(PatientAccountState::displayName)
                .orElse("#" + request.patientId());
            audit.publishAfterCommit(AuditEvent.of(AuditEventType.REACCESS_REJECTED,
                    "Re-access request rejected for patient: " + name,
                    AuditEvent.TARGET_PATIENT, request.patientId(), now)
                .withActor(Actor.admin(adminId)));
            return Outcome.success(processed(request, ReaccessStatus.REJECTED, response, adminId, now));
        });

        if (outcome.isSuccess()) {
            metrics.incrementReaccessRejected();
        }
        return outcome;
    }

    /**
     * Returns the patient's pending request, if any. Lets a client hide the submit
     * action; {@link #submit} enforces the rule regardless.
     */
    public Outcome<Optional<ReaccessRequest>> checkExisting(long patientId) {
        return unitOfWork.run("reaccess check", conn -> Outcome.success(reaccessStore.findPending(conn, patientId)));
    }

    /**
     * Pending requests for the admin review queue, newest first.
     */
    public Outcome<List<ReaccessRequestView>> pendingRequests() {
        return unitOfWork.run("reaccess pending list", conn -> Outcome.success(reaccessStore.findPendingQueue(conn)));
    }

    /**
     * Every request, newest first.
     */
    public Outcome<List<ReaccessRequestView>> allRequests() {
        return unitOfWork.run("reaccess list", conn -> Outcome.success(reaccessStore.findAll(conn)));
    }

    private Outcome<ReaccessRequest> loadPending(Connection conn, long requestId) {
        Optional<ReaccessRequest> found = reaccessStore.findByIdForUpdate(conn, requestId);
        if (found.isEmpty()) {
            return Outcome.failure(ClinicError.NotFound.of(ENTITY, requestId));
        }
        ReaccessRequest request = found.get();
        if (!request.isPending()) {
            return Outcome.failure(new ClinicError.InvalidTransition(ENTITY, requestId,
                request.status().code(), "This request has already been " + request.status().code()));
        }
        return Outcome.success(request);
    }

    private static ReaccessRequest processed(ReaccessRequest request, ReaccessStatus status, String response,
                                             long adminId, Instant processedAt) {
        return new ReaccessRequest(request.requestId(), request.patientId(), request.reason(),
            request.contactPhone(), status, response, request.submittedAt(), processedAt, adminId);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
