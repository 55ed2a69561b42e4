package conveyor.domain.orchestration;

import com.google.common.eventbus.EventBus;
import conveyor.common.EDriverBackend;
import conveyor.common.ESlicerBackend;
import conveyor.dal.DeviceConfig;
import conveyor.dal.DriverProfile;
import conveyor.dal.SlicerProfile;
import conveyor.dal.StartupMode;
import conveyor.domain.ServiceInitializationResult;
import conveyor.domain.StartupException;
import conveyor.domain.device.DeviceManager;
import conveyor.domain.device.DeviceMonitorService;
import conveyor.domain.profile.ProfileRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests for ServiceOrchestrator backend checks and startup modes
 * @since 19/10/2025
 */
@ExtendWith(MockitoExtension.class)
class ServiceOrchestratorTest {

    @TempDir
    Path tempDir;

    @Mock
    private DeviceMonitorService deviceMonitor;

    private ServiceOrchestrator orchestrator(List<SlicerProfile> slicers, List<DriverProfile> drivers, List<DeviceConfig> devices) {
        Map<String, SlicerProfile> slicerMap = new LinkedHashMap<>();
        slicers.forEach(p -> slicerMap.put(p.name(), p));
        Map<String, DriverProfile> driverMap = new LinkedHashMap<>();
        drivers.forEach(p -> driverMap.put(p.name(), p));
        ProfileRegistry registry = new ProfileRegistry(slicerMap, driverMap,
                slicers.get(0).name(), drivers.get(0).name());
        return new ServiceOrchestrator(registry, new DeviceManager(devices, new EventBus("test")), deviceMonitor);
    }

    private static SlicerProfile miracleGrue(String name, Path executable) {
        return new SlicerProfile(name, ESlicerBackend.MIRACLE_GRUE, executable, null, null, null, null, 60_000);
    }

    private static DriverProfile makerBot(String name, Path executable) {
        return new DriverProfile(name, EDriverBackend.MAKERBOT, executable, null, "Replicator2", 0, 1_000);
    }

    @Test
    @DisplayName("Should check every profile and device in order")
    void shouldCheckAllBackends() throws IOException {
        // Given
        Path exe = Files.writeString(tempDir.resolve("miracle_grue"), "#!/bin/sh\n");
        exe.toFile().setExecutable(true);
        ServiceOrchestrator orchestrator = orchestrator(
                List.of(SlicerProfile.dummy("dummy"), miracleGrue("mg", exe), miracleGrue("broken", tempDir.resolve("absent"))),
                List.of(DriverProfile.dummy("sim", 0)),
                List.of(DeviceConfig.virtual("dev1")));

        // When
        List<ServiceInitializationResult> results = orchestrator.initializeAllServices();

        // Then
        assertThat(results).extracting(ServiceInitializationResult::getServiceName)
                .containsExactly("dummy", "mg", "broken", "sim", "dev1");
        assertThat(results).extracting(ServiceInitializationResult::isSuccess)
                .containsExactly(true, true, false, true, true);
        assertThat(orchestrator.getInitializationResults().get("slicer:broken").getErrorMessage())
                .contains("Executable not found");
        verify(deviceMonitor, never()).scan();
    }

    @Test
    @DisplayName("Should scan ports before checking port-backed devices")
    void shouldScanPortDevices() {
        // Given
        ServiceOrchestrator orchestrator = orchestrator(List.of(SlicerProfile.dummy("dummy")),
                List.of(DriverProfile.dummy("sim", 0)),
                List.of(new DeviceConfig("rep", "Replicator", "/dev/ttyACM0")));

        // When
        List<ServiceInitializationResult> results = orchestrator.initializeAllServices();

        // Then
        verify(deviceMonitor).scan();
        assertThat(results).hasSize(3);
    }

    @Test
    @DisplayName("Should reject a driver whose machine profile directory is missing")
    void shouldRejectMissingProfileDir() throws IOException {
        // Given
        Path exe = Files.writeString(tempDir.resolve("makerbot_driver"), "#!/bin/sh\n");
        exe.toFile().setExecutable(true);
        DriverProfile profile = new DriverProfile("mb", EDriverBackend.MAKERBOT, exe, tempDir.resolve("machines"),
                "Replicator2", 0, 1_000);
        ServiceOrchestrator orchestrator = orchestrator(List.of(SlicerProfile.dummy("dummy")), List.of(profile),
                List.of(DeviceConfig.virtual("dev1")));

        // When
        ServiceInitializationResult result = orchestrator.initializeDriver(profile);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getCategory()).isEqualTo(ServiceOrchestrator.DRIVER);
        assertThat(result.getErrorMessage()).contains("Machine profile directory not found");
    }

    @Test
    @DisplayName("STRICT mode should fail when any backend is unusable")
    void strictModeShouldRequireAllBackends() {
        // Given
        List<ServiceInitializationResult> results = List.of(
                ServiceInitializationResult.success("dummy", ServiceOrchestrator.SLICER, 1),
                ServiceInitializationResult.failure("mg", ServiceOrchestrator.SLICER, "Executable not found", 1),
                ServiceInitializationResult.success("sim", ServiceOrchestrator.DRIVER, 1));
        ServiceOrchestrator orchestrator = orchestrator(List.of(SlicerProfile.dummy("dummy")),
                List.of(DriverProfile.dummy("sim", 0)), List.of(DeviceConfig.virtual("dev1")));

        // When & Then
        assertThatThrownBy(() -> orchestrator.evaluateStartupRequirements(StartupMode.STRICT, results))
                .isInstanceOfSatisfying(StartupException.class, e -> {
                    assertThat(e.getMode()).isEqualTo(StartupMode.STRICT);
                    assertThat(e.getFailedServices()).extracting(ServiceInitializationResult::getServiceName)
                            .containsExactly("mg");
                });
        assertThatCode(() -> orchestrator.evaluateStartupRequirements(StartupMode.LENIENT, results))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("LENIENT mode should need one slicer and one driver")
    void lenientModeShouldNeedOneOfEach() {
        // Given
        List<ServiceInitializationResult> results = List.of(
                ServiceInitializationResult.success("dummy", ServiceOrchestrator.SLICER, 1),
                ServiceInitializationResult.failure("mb", ServiceOrchestrator.DRIVER, "Executable not found", 1));
        ServiceOrchestrator orchestrator = orchestrator(List.of(SlicerProfile.dummy("dummy")),
                List.of(DriverProfile.dummy("sim", 0)), List.of(DeviceConfig.virtual("dev1")));

        // When & Then
        assertThatThrownBy(() -> orchestrator.evaluateStartupRequirements(StartupMode.LENIENT, results))
                .isInstanceOf(StartupException.class)
                .hasMessageContaining("LENIENT");
        assertThatCode(() -> orchestrator.evaluateStartupRequirements(StartupMode.PERMISSIVE, results))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Detached devices should not block startup")
    void detachedDevicesShouldNotBlockStartup() {
        // Given
        List<ServiceInitializationResult> results = List.of(
                ServiceInitializationResult.success("dummy", ServiceOrchestrator.SLICER, 1),
                ServiceInitializationResult.success("sim", ServiceOrchestrator.DRIVER, 1),
                ServiceInitializationResult.failure("rep", ServiceOrchestrator.DEVICE, "Port /dev/ttyACM0 not present", 0));
        ServiceOrchestrator orchestrator = orchestrator(List.of(SlicerProfile.dummy("dummy")),
                List.of(DriverProfile.dummy("sim", 0)), List.of(DeviceConfig.virtual("dev1")));

        // When & Then
        assertThatCode(() -> orchestrator.evaluateStartupRequirements(StartupMode.STRICT, results))
                .doesNotThrowAnyException();
    }
}
