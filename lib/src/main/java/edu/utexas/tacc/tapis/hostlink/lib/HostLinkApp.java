package edu.utexas.tacc.tapis.hostlink.lib;

import java.time.Clock;
import javax.inject.Singleton;

import org.glassfish.hk2.api.ServiceLocator;
import org.glassfish.hk2.utilities.ServiceLocatorUtilities;
import org.glassfish.hk2.utilities.binding.AbstractBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.utexas.tacc.tapis.hostlink.lib.caches.CacheMetrics;
import edu.utexas.tacc.tapis.hostlink.lib.caches.DeviceTypeCache;
import edu.utexas.tacc.tapis.hostlink.lib.caches.LastTargetTracker;
import edu.utexas.tacc.tapis.hostlink.lib.config.IRuntimeConfig;
import edu.utexas.tacc.tapis.hostlink.lib.config.RuntimeSettings;
import edu.utexas.tacc.tapis.hostlink.lib.dao.registry.ConnectionRegistry;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ControlSocketStore;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.HealthChecker;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.ISshControlClient;
import edu.utexas.tacc.tapis.hostlink.lib.kernel.OpenSshControlClient;
import edu.utexas.tacc.tapis.hostlink.lib.services.ConnectionLifecycleManager;
import edu.utexas.tacc.tapis.hostlink.lib.services.ConnectionPoolManager;
import edu.utexas.tacc.tapis.hostlink.lib.services.ConnectionStatusService;
import edu.utexas.tacc.tapis.hostlink.lib.services.DeviceTypeDetector;
import edu.utexas.tacc.tapis.hostlink.lib.services.DeviceTypeService;
import edu.utexas.tacc.tapis.hostlink.lib.services.RemoteHostService;
import edu.utexas.tacc.tapis.hostlink.lib.utils.LibUtils;
import edu.utexas.tacc.tapis.hostlink.lib.workers.BackgroundTaskRunner;
import edu.utexas.tacc.tapis.hostlink.lib.workers.StaleConnectionSweeper;

/*
 * Wiring for the host link library.
 *
 * Callers either take the RemoteHostService from a locator built here, or supply their own binder when they need
 *   to replace a component, typically the ISshControlClient in tests.
 */
public class HostLinkApp
{
  private static final Logger log = LoggerFactory.getLogger(HostLinkApp.class);

  private HostLinkApp() { throw new AssertionError(); }

  public static ServiceLocator createLocator()
  {
    return createLocator(RuntimeSettings.get());
  }

  public static ServiceLocator createLocator(IRuntimeConfig runtimeConfig)
  {
    return createLocator(runtimeConfig, Clock.systemDefaultZone());
  }

  public static ServiceLocator createLocator(IRuntimeConfig runtimeConfig, Clock clock)
  {
    ServiceLocator locator = ServiceLocatorUtilities.createAndPopulateServiceLocator();
    ServiceLocatorUtilities.bind(locator, new AbstractBinder() {
      @Override
      protected void configure()
      {
        bind(runtimeConfig).to(IRuntimeConfig.class);
        bind(clock).to(Clock.class);
        bind(OpenSshControlClient.class).to(ISshControlClient.class).in(Singleton.class);
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
    });
    log.debug(LibUtils.getMsg("HOSTLINK_LOCATOR_READY", runtimeConfig.getControlDir(), runtimeConfig.getCacheDir()));
    return locator;
  }
}
