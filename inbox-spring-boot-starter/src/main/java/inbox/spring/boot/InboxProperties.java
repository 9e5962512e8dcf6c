package inbox.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the inbox.
 *
 * @see InboxAutoConfiguration
 */
@ConfigurationProperties(prefix = "inbox")
public class InboxProperties {

    /**
     * Maximum updates requested from the source per page.
     */
    private int batchSize = 100;

    /**
     * Pause after each settled update; rate-limits handlers during a backlog drain.
     */
    private Duration interMessageDelay = Duration.ofMillis(100);

    /**
     * Upper bound on one handler call. Overruns count as transient failures.
     */
    private Duration handlerTimeout = Duration.ofSeconds(30);

    /**
     * How often the source's reachability is probed. Only used when a
     * {@code ConnectivityProbe} bean exists.
     */
    private Duration connectivityCheckInterval = Duration.ofMinutes(5);

    /**
     * Drain the backlog once when the application context starts.
     */
    private boolean drainOnStart = true;

    private String cursorTable = "inbox_cursor";

    private String ledgerTable = "inbox_ledger";

    /**
     * Create the cursor and ledger tables at startup if they do not exist.
     */
    private boolean initializeSchema = false;

    private final Retention retention = new Retention();
    private final Metrics metrics = new Metrics();

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getInterMessageDelay() {
        return interMessageDelay;
    }

    public void setInterMessageDelay(Duration interMessageDelay) {
        this.interMessageDelay = interMessageDelay;
    }

    public Duration getHandlerTimeout() {
        return handlerTimeout;
    }

    public void setHandlerTimeout(Duration handlerTimeout) {
        this.handlerTimeout = handlerTimeout;
    }

    public Duration getConnectivityCheckInterval() {
        return connectivityCheckInterval;
    }

    public void setConnectivityCheckInterval(Duration connectivityCheckInterval) {
        this.connectivityCheckInterval = connectivityCheckInterval;
    }

    public boolean isDrainOnStart() {
        return drainOnStart;
    }

    public void setDrainOnStart(boolean drainOnStart) {
        this.drainOnStart = drainOnStart;
    }

    public String getCursorTable() {
        return cursorTable;
    }

    public void setCursorTable(String cursorTable) {
        this.cursorTable = cursorTable;
    }

    public String getLedgerTable() {
        return ledgerTable;
    }

    public void setLedgerTable(String ledgerTable) {
        this.ledgerTable = ledgerTable;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Retention getRetention() {
        return retention;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Retention {
        /**
         * Ledger entries older than this are deleted.
         */
        private Duration window = Duration.ofDays(7);
        private Duration interval = Duration.ofDays(1);
        private int batchSize = 500;

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "inbox";

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
