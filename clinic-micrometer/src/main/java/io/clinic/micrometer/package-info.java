/**
 * Micrometer binding for {@link io.clinic.spi.MetricsExporter}.
 */
package io.clinic.micrometer;
