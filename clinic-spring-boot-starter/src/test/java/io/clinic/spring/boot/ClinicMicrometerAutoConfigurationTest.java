package io.clinic.spring.boot;

import io.clinic.micrometer.MicrometerMetricsExporter;
import io.clinic.model.AppointmentStatus;
import io.clinic.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClinicMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ClinicMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("clinic.metrics.name-prefix=north.clinic").run(ctx -> {
            ctx.getBean(MetricsExporter.class).incrementAttendanceMarked(AppointmentStatus.MISSED);
            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("north.clinic.attendance.marked").tag("status", "missed").counter());
            assertNull(registry.find("clinic.attendance.marked").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("clinic.metrics.enabled=false").run(ctx ->
                assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx ->
                assertSame(MetricsExporter.NOOP, ctx.getBean(MetricsExporter.class)));
    }

    @Test
    void closingContextRemovesMeters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(ClinicMicrometerAutoConfiguration.class))
                .withBean(MeterRegistry.class, () -> registry)
                .run(ctx -> assertNotNull(registry.find("clinic.appointments.created").counter()));

        assertTrue(registry.getMeters().isEmpty());
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
