package io.clinic.model;

/**
 * Re-access request joined with the patient details an administrator reviews.
 */
public record ReaccessRequestView(
    ReaccessRequest request,
    String patientName,
    String nationalId,
    String patientPhone,
    int missedCount
) {}
