/**
 * Attendance outcomes and the consecutive-miss restriction rule.
 */
package io.clinic.attendance;
