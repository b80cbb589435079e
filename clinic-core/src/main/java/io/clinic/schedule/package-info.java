/**
 * Appointment booking with per-doctor conflict detection.
 */
package io.clinic.schedule;
