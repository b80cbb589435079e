package io.clinic.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Configuration properties for the clinic core.
 *
 * @see ClinicAutoConfiguration
 */
@ConfigurationProperties(prefix = "clinic")
public class ClinicProperties {

    /**
     * Zone used to format times in conflict messages and audit descriptions.
     */
    private ZoneId displayZone = ZoneId.of("UTC");

    private final Reaccess reaccess = new Reaccess();
    private final Audit audit = new Audit();
    private final Metrics metrics = new Metrics();

    public ZoneId getDisplayZone() {
        return displayZone;
    }

    public void setDisplayZone(ZoneId displayZone) {
        this.displayZone = displayZone;
    }

    public Reaccess getReaccess() {
        return reaccess;
    }

    public Audit getAudit() {
        return audit;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Reaccess {
        /**
         * Response stored on approval when the admin gives none. Blank uses the built-in text.
         */
        private String approvedResponse;

        /**
         * Response stored on rejection when the admin gives none. Blank uses the built-in text.
         */
        private String rejectedResponse;

        public String getApprovedResponse() {
            return approvedResponse;
        }

        public void setApprovedResponse(String approvedResponse) {
            this.approvedResponse = approvedResponse;
        }

        public String getRejectedResponse() {
            return rejectedResponse;
        }

        public void setRejectedResponse(String rejectedResponse) {
            this.rejectedResponse = rejectedResponse;
        }
    }

    public static class Audit {
        /**
         * Write audit events to the {@code io.clinic.audit} logger. When false, events are discarded.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "clinic";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
