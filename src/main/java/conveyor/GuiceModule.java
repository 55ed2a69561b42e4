package conveyor;

import com.google.common.eventbus.EventBus;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import conveyor.dal.ConfigurationService;
import conveyor.dal.ServerConfig;
import conveyor.dal.SlicingSettings;
import conveyor.domain.SSEManager;
import conveyor.domain.device.DeviceManager;
import conveyor.domain.device.DeviceMonitorService;
import conveyor.domain.device.IPortScanner;
import conveyor.domain.device.SerialPortScanner;
import conveyor.domain.driver.DriverFactory;
import conveyor.domain.gateway.JobController;
import conveyor.domain.job.JobOrchestrator;
import conveyor.domain.job.JobQueue;
import conveyor.domain.profile.ProfileRegistry;
import conveyor.domain.slicer.SlicerFactory;

import javax.inject.Named;
import javax.inject.Singleton;

/**
 * Wiring of the daemon components
 * @since 07/10/2025
 */
public class GuiceModule extends AbstractModule {
    private final ConfigurationService configService;

    public GuiceModule(ConfigurationService configService) {
        this.configService = configService;
    }

    @Override
    protected void configure() {
        bind(ConfigurationService.class).toInstance(configService);
        bind(ServerConfig.class).toInstance(configService.getServerConfiguration());
        bind(SlicingSettings.class).toInstance(configService.getSlicingSettings());

        bind(IPortScanner.class).to(SerialPortScanner.class);
        bind(EventBus.class).toInstance(new EventBus("conveyor"));
        bind(JobQueue.class).in(Singleton.class);
        bind(SlicerFactory.class).in(Singleton.class);
        bind(DriverFactory.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    ProfileRegistry provideProfileRegistry() {
        return new ProfileRegistry(configService.getSlicerProfiles(), configService.getDriverProfiles(),
                configService.getDefaultSlicerProfile(), configService.getDefaultDriverProfile());
    }

    @Provides
    @Singleton
    DeviceManager provideDeviceManager(EventBus eventBus) {
        return new DeviceManager(configService.getDevices(), eventBus);
    }

    @Provides
    @Singleton
    DeviceMonitorService provideDeviceMonitor(DeviceManager deviceManager, IPortScanner portScanner, ServerConfig serverConfig) {
        return new DeviceMonitorService(deviceManager, portScanner, serverConfig.deviceScanInterval());
    }

    @Provides
    @Singleton
    JobOrchestrator provideJobOrchestrator(JobQueue queue, ProfileRegistry profiles, DeviceManager devices,
                                           SlicerFactory slicerFactory, DriverFactory driverFactory,
                                           SlicingSettings settings, ServerConfig serverConfig) {
        return new JobOrchestrator(queue, profiles, devices, slicerFactory, driverFactory, settings,
                serverConfig.workDir().resolve("jobs"), serverConfig.eventThreads());
    }

    /**
     * Pretty-printing Gson for REST responses
     */
    @Provides
    @Singleton
    @Named("pretty")
    Gson providePrettyGson() {
        return new GsonBuilder().setPrettyPrinting().create();
    }

    /**
     * Compact Gson for SSE messages (no newlines)
     */
    @Provides
    @Singleton
    @Named("compact")
    Gson provideCompactGson() {
        return new Gson();
    }

    @Provides
    @Singleton
    SSEManager provideSSEManager(@Named("compact") Gson compactGson) {
        return new SSEManager(compactGson);
    }

    @Provides
    @Singleton
    JobController provideJobController(JobOrchestrator orchestrator, SSEManager sseManager,
                                       SlicingSettings settings, ServerConfig serverConfig) {
        return new JobController(orchestrator, sseManager, settings, serverConfig.workDir());
    }
}
