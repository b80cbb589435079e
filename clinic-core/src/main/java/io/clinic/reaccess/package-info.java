/**
 * Re-access requests: submission by restricted patients and adjudication by administrators.
 */
package io.clinic.reaccess;
