package io.clinic.spring.boot;

import io.clinic.Clinic;
import io.clinic.audit.LoggingAuditSink;
import io.clinic.jdbc.store.JdbcAppointmentStore;
import io.clinic.jdbc.store.JdbcDoctorDirectory;
import io.clinic.jdbc.store.JdbcPatientDirectory;
import io.clinic.jdbc.store.JdbcReaccessStore;
import io.clinic.spi.AppointmentStore;
import io.clinic.spi.AuditSink;
import io.clinic.spi.DoctorDirectory;
import io.clinic.spi.MetricsExporter;
import io.clinic.spi.PatientDirectory;
import io.clinic.spi.ReaccessStore;
import io.clinic.spi.TransactionRunner;
import io.clinic.spi.TxContext;
import io.clinic.spring.SpringTransactionRunner;
import io.clinic.spring.SpringTxContext;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for the clinic core.
 *
 * <p>Wires a {@link Clinic} from a {@link DataSource}, the JDBC stores and Spring-managed
 * transactions. Every bean backs off when the application defines its own.
 *
 * @see ClinicProperties
 * @see ClinicMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnClass(Clinic.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(ClinicProperties.class)
public class ClinicAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(AppointmentStore.class)
  public JdbcAppointmentStore appointmentStore() {
    return new JdbcAppointmentStore();
  }

  @Bean
  @ConditionalOnMissingBean(PatientDirectory.class)
  public JdbcPatientDirectory patientDirectory() {
    return new JdbcPatientDirectory();
  }

  @Bean
  @ConditionalOnMissingBean(DoctorDirectory.class)
  public JdbcDoctorDirectory doctorDirectory() {
    return new JdbcDoctorDirectory();
  }

  @Bean
  @ConditionalOnMissingBean(ReaccessStore.class)
  public JdbcReaccessStore reaccessStore() {
    return new JdbcReaccessStore();
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext txContext(DataSource dataSource) {
    return new SpringTxContext(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TransactionRunner.class)
  public SpringTransactionRunner transactionRunner(DataSource dataSource, TxContext txContext,
      ObjectProvider<PlatformTransactionManager> transactionManager) {
    PlatformTransactionManager tm = transactionManager.getIfAvailable(() -> new DataSourceTransactionManager(dataSource));
    return new SpringTransactionRunner(tm, txContext);
  }

  @Bean
  @ConditionalOnMissingBean
  public AuditSink auditSink(ClinicProperties props) {
    return props.getAudit().isEnabled() ? new LoggingAuditSink() : AuditSink.NOOP;
  }

  @Bean
  @ConditionalOnMissingBean
  public Clinic clinic(ClinicProperties props,
      TransactionRunner transactionRunner,
      TxContext txContext,
      AppointmentStore appointmentStore,
      PatientDirectory patientDirectory,
      DoctorDirectory doctorDirectory,
      ReaccessStore reaccessStore,
      AuditSink auditSink,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Clock> clockProvider) {

    Clinic.Builder builder = Clinic.builder()
        .transactionRunner(transactionRunner)
        .txContext(txContext)
        .appointmentStore(appointmentStore)
        .patientDirectory(patientDirectory)
        .doctorDirectory(doctorDirectory)
        .reaccessStore(reaccessStore)
        .auditSink(auditSink)
        .displayZone(props.getDisplayZone())
        .approvedResponse(props.getReaccess().getApprovedResponse())
        .rejectedResponse(props.getReaccess().getRejectedResponse());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    Clock clock = clockProvider.getIfAvailable();
    if (clock != null) {
      builder.clock(clock);
    }
    return builder.build();
  }
}
