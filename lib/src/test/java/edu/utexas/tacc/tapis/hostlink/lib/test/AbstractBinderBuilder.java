package edu.utexas.tacc.tapis.hostlink.lib.test;

import edu.utexas.tacc.tapis.hostlink.lib.caches.CacheMetrics;
import edu.utexas.tacc.tapis.hostlink.lib.caches.DeviceTypeCache;
import edu.utexas.tacc.tapis.hostlink.lib.caches.LastTargetTracker;
import edu.utexas.tacc.tapis.hostlink.lib.config.IRuntimeConfig;
import edu.utexas.tacc.tapis.hostlink.lib.dao.registry.ConnectionRegistry;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ControlSocketStore;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.HealthChecker;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ISshControlClient;
import edu.utexas.tacc.tapis.hostlink.lib.services.ConnectionLifecycleManager;
import edu.utexas.tacc.tapis.hostlink.lib.services.ConnectionPoolManager;
import edu.utexas.tacc.tapis.hostlink.lib.services.ConnectionStatusService;
import edu.utexas.tacc.tapis.hostlink.lib.services.DeviceTypeDetector;
import edu.utexas.tacc.tapis.hostlink.lib.services.DeviceTypeService;
import edu.utexas.tacc.tapis.hostlink.lib.services.RemoteHostService;
import edu.utexas.tacc.tapis.hostlink.lib.workers.BackgroundTaskRunner;
import edu.utexas.tacc.tapis.hostlink.lib.workers.StaleConnectionSweeper;
import org.glassfish.hk2.api.ServiceLocator;
import org.glassfish.hk2.utilities.ServiceLocatorUtilities;
import org.glassfish.hk2.utilities.binding.AbstractBinder;

import javax.inject.Singleton;
import java.time.Clock;

/*
 * Builds a service locator for tests with the ssh client, config and clock supplied by the test.
 */
public class AbstractBinderBuilder {
    private IRuntimeConfig config;
    private ISshControlClient sshClientMock;
    private Clock clock = Clock.systemDefaultZone();

    public AbstractBinderBuilder config(IRuntimeConfig config) {
        this.config = config;
        return this;
    }

    public AbstractBinderBuilder mockSshClient(ISshControlClient sshClientMock) {
        this.sshClientMock = sshClientMock;
        return this;
    }

    public AbstractBinderBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public AbstractBinder build() {
        return new AbstractBinder() {
            @Override
            protected void configure() {
                bind(config).to(IRuntimeConfig.class);
                bind(clock).to(Clock.class);
                bind(sshClientMock).to(ISshControlClient.class);
                bindAsContract(ControlSocketStore.class).in(Singleton.class);
                bindAsContract(HealthChecker.class).in(Singleton.class);
                bindAsContract(ConnectionRegistry.class).in(Singleton.class);
                bindAsContract(BackgroundTaskRunner.class).in(Singleton.class);
                bindAsContract(StaleConnectionSweeper.class).in(Singleton.class);
                bindAsContract(CacheMetrics.class).in(Singleton.class);
                bindAsContract(DeviceTypeCache.class).in(Singleton.class);
                bindAsContract(LastTargetTracker.class).in(Singleton.class);
                bindAsContract(ConnectionPoolManager.class).in(Singleton.class);
                bindAsContract(ConnectionLifecycleManager.class).in(Singleton.class);
                bindAsContract(ConnectionStatusService.class).in(Singleton.class);
                bindAsContract(DeviceTypeDetector.class).in(Singleton.class);
                bindAsContract(DeviceTypeService.class).in(Singleton.class);
                bindAsContract(RemoteHostService.class).in(Singleton.class);
            }
        };
    }

    public ServiceLocator buildLocator() {
        ServiceLocator locator = ServiceLocatorUtilities.createAndPopulateServiceLocator();
        ServiceLocatorUtilities.bind(locator, build());
        return locator;
    }
}
