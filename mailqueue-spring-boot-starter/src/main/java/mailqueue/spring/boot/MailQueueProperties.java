package mailqueue.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the mail queue.
 *
 * @see MailQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "mailqueue")
public class MailQueueProperties {

    /**
     * Collection whose documents are messages.
     */
    private String collection = "mail";

    /**
     * Collection of user documents, used to resolve {@code toUids}/{@code ccUids}/{@code bccUids}.
     */
    private String usersCollection;

    /**
     * Collection of template documents. Enables template rendering when set.
     */
    private String templatesCollection;

    private String defaultFrom;
    private String defaultReplyTo;

    /**
     * {@code smtp[s]://[user[:password]@]host[:port][?options]}.
     */
    private String smtpConnectionUri;

    /**
     * Deliver to an in-memory transport instead of SMTP.
     */
    private boolean testing;

    /**
     * How long a PROCESSING claim is honored before it is treated as abandoned.
     */
    private Duration leaseDuration = Duration.ofSeconds(60);

    /**
     * Database table holding documents when a DataSource is present.
     */
    private String tableName = "mail_document";

    /**
     * Create the document table on startup if it does not exist.
     */
    private boolean initializeSchema = true;

    private final Trigger trigger = new Trigger();
    private final Metrics metrics = new Metrics();

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public String getUsersCollection() {
        return usersCollection;
    }

    public void setUsersCollection(String usersCollection) {
        this.usersCollection = usersCollection;
    }

    public String getTemplatesCollection() {
        return templatesCollection;
    }

    public void setTemplatesCollection(String templatesCollection) {
        this.templatesCollection = templatesCollection;
    }

    public String getDefaultFrom() {
        return defaultFrom;
    }

    public void setDefaultFrom(String defaultFrom) {
        this.defaultFrom = defaultFrom;
    }

    public String getDefaultReplyTo() {
        return defaultReplyTo;
    }

    public void setDefaultReplyTo(String defaultReplyTo) {
        this.defaultReplyTo = defaultReplyTo;
    }

    public String getSmtpConnectionUri() {
        return smtpConnectionUri;
    }

    public void setSmtpConnectionUri(String smtpConnectionUri) {
        this.smtpConnectionUri = smtpConnectionUri;
    }

    public boolean isTesting() {
        return testing;
    }

    public void setTesting(boolean testing) {
        this.testing = testing;
    }

    public Duration getLeaseDuration() {
        return leaseDuration;
    }

    public void setLeaseDuration(Duration leaseDuration) {
        this.leaseDuration = leaseDuration;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Trigger {
        private int workerCount = 4;
        private int queueCapacity = 1000;
        private long drainTimeoutMs = 5000;

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "mailqueue";
        private Map<String, String> tags = new LinkedHashMap<>();

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

        /** Tags added to every queue meter, e.g. {@code mailqueue.metrics.tags.tenant=acme}. */
        public Map<String, String> getTags() {
            return tags;
        }

        public void setTags(Map<String, String> tags) {
            this.tags = tags;
        }
    }
}
