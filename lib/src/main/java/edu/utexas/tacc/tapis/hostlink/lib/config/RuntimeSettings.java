package edu.utexas.tacc.tapis.hostlink.lib.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RuntimeSettings {

    private static final Logger log = LoggerFactory.getLogger(RuntimeSettings.class);

    static class BaseConfig implements IRuntimeConfig {

        private final Settings settings;

        protected final String userHome;
        protected final Path controlDir;
        protected final String sshBinary;
        protected final String fuserBinary;
        protected final Path sshConfigFile;
        // Login name used for configured hosts that have no User entry
        protected final String localUser;
        protected final int sshTimeoutSeconds;
        protected final int sshConnectTimeoutSeconds;
        protected final int sshControlPersistSeconds;
        protected final int maxConnections;
        // Sockets younger than this are trusted by the quick health check without a round trip
        protected final int quickCheckFreshnessSeconds;
        protected final int establishMaxAttempts;
        protected final int establishPollMillis;
        protected final Path cacheDir;
        protected final long cacheExpirySeconds;
        protected final int cacheMaxSize;
        protected final int warmMaxFiles;

        BaseConfig(Settings settings) {
            this.settings = settings;
            userHome = settings.get("user.home", System.getProperty("user.home"));
            controlDir = getPathSetting("SSH_CONTROL_DIR", Paths.get(userHome, ".ssh", "sh-ai-sockets"));
            sshBinary = settings.get("SSH_BINARY", "ssh");
            fuserBinary = settings.get("FUSER_BINARY", "fuser");
            sshConfigFile = getPathSetting("SSH_CONFIG_FILE", Paths.get(userHome, ".ssh", "config"));
            localUser = settings.get("user.name", System.getProperty("user.name"));
            sshTimeoutSeconds = getIntSetting("SSH_TIMEOUT", 10);
            sshConnectTimeoutSeconds = getIntSetting("SSH_CONNECT_TIMEOUT", 30);
            sshControlPersistSeconds = getIntSetting("SSH_CONTROL_PERSIST", 600);
            maxConnections = getIntSetting("SSH_MAX_CONNECTIONS", 10);
            quickCheckFreshnessSeconds = getIntSetting("SSH_QUICK_CHECK_FRESHNESS_SECONDS", 3600);
            establishMaxAttempts = getIntSetting("SSH_ESTABLISH_MAX_ATTEMPTS", 30);
            establishPollMillis = getIntSetting("SSH_ESTABLISH_POLL_MILLIS", 1000);
            cacheDir = getPathSetting("HOSTLINK_CACHE_DIR", Paths.get(userHome, ".cache", "sh-ai", "devices"));
            cacheExpirySeconds = getIntSetting("HOSTLINK_CACHE_EXPIRY", 86400);
            cacheMaxSize = getIntSetting("HOSTLINK_CACHE_MAX_SIZE", 1000);
            warmMaxFiles = getIntSetting("HOSTLINK_WARM_MAX_FILES", 20);
        }

        public Path getControlDir() {
            return controlDir;
        }

        public String getSshBinary() {
            return sshBinary;
        }

        public String getFuserBinary() {
            return fuserBinary;
        }

        public Path getSshConfigFile() {
            return sshConfigFile;
        }

        public String getLocalUser() {
            return localUser;
        }

        public int getSshTimeoutSeconds() {
            return sshTimeoutSeconds;
        }

        public int getSshConnectTimeoutSeconds() {
            return sshConnectTimeoutSeconds;
        }

        public int getSshControlPersistSeconds() {
            return sshControlPersistSeconds;
        }

        public int getMaxConnections() {
            return maxConnections;
        }

        public int getQuickCheckFreshnessSeconds() {
            return quickCheckFreshnessSeconds;
        }

        public int getEstablishMaxAttempts() {
            return establishMaxAttempts;
        }

        public int getEstablishPollMillis() {
            return establishPollMillis;
        }

        public Path getCacheDir() {
            return cacheDir;
        }

        public long getCacheExpirySeconds() {
            return cacheExpirySeconds;
        }

        public int getCacheMaxSize() {
            return cacheMaxSize;
        }

        public int getWarmMaxFiles() {
            return warmMaxFiles;
        }

        protected int getIntSetting(String settingName, int defaultValue) {
            String settingValue = settings.get(settingName);
            if (StringUtils.isBlank(settingValue)) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(settingValue.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric value {} for setting {}. Using default {}", settingValue, settingName, defaultValue);
                return defaultValue;
            }
        }

        protected Path getPathSetting(String settingName, Path defaultValue) {
            String settingValue = settings.get(settingName);
            if (StringUtils.isBlank(settingValue)) {
                return defaultValue;
            }
            return Paths.get(settingValue.trim());
        }
    }

    public static IRuntimeConfig get() {
        return new BaseConfig(new Settings());
    }

    /**
     * Build a config where the given values override the environment. Used by tests and embedding callers
     * that need private socket and cache directories.
     */
    public static IRuntimeConfig get(Map<String, String> overrides) {
        return new BaseConfig(new Settings(overrides));
    }
}
