package io.cronkit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot binding for {@code cronkit.*}: the scheduler settings plus store selection.
 */
@ConfigurationProperties(prefix = "cronkit")
public class CronKitProperties extends SchedulerProperties {
    private boolean enabled = true;
    private boolean autoStart = true; // start the scheduler with the application context
    private final Store store = new Store();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Store getStore() {
        return store;
    }

    public enum StoreType {
        FILE,
        MEMORY,
        MONGO
    }

    public static class Store {
        private StoreType type = StoreType.FILE;
        private String path = "./.cronkit/cron-store.json";
        private final Mongo mongo = new Mongo();

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Mongo getMongo() {
            return mongo;
        }
    }

    public static class Mongo {
        private boolean ensureIndexes = false;

        public boolean isEnsureIndexes() {
            return ensureIndexes;
        }

        public void setEnsureIndexes(boolean ensureIndexes) {
            this.ensureIndexes = ensureIndexes;
        }
    }
}
