package io.clinic.spring.boot;

import io.clinic.micrometer.MicrometerMetricsExporter;
import io.clinic.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code clinic.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link ClinicAutoConfiguration} so the {@link MetricsExporter} bean
 * is available to the {@link io.clinic.Clinic} bean.
 */
@AutoConfiguration(before = ClinicAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "clinic.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(ClinicProperties.class)
public class ClinicMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry, ClinicProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
