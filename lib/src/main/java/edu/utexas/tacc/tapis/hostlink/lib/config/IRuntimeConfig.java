package edu.utexas.tacc.tapis.hostlink.lib.config;

import java.nio.file.Path;

public interface IRuntimeConfig {
    Path getControlDir();
    String getSshBinary();
    String getFuserBinary();
    Path getSshConfigFile();
    String getLocalUser();
    int getSshTimeoutSeconds();
    int getSshConnectTimeoutSeconds();
    int getSshControlPersistSeconds();
    int getMaxConnections();
    int getQuickCheckFreshnessSeconds();
    int getEstablishMaxAttempts();
    int getEstablishPollMillis();
    Path getCacheDir();
    long getCacheExpirySeconds();
    int getCacheMaxSize();
    int getWarmMaxFiles();
}
