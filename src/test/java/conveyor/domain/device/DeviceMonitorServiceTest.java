package conveyor.domain.device;

import com.google.common.eventbus.EventBus;
import conveyor.dal.DeviceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for DeviceMonitorService
 * @since 15/10/2025
 */
@ExtendWith(MockitoExtension.class)
class DeviceMonitorServiceTest {

    @Mock
    private IPortScanner portScanner;

    @Mock
    private ScheduledExecutorService executor;

    private DeviceManager manager;
    private DeviceMonitorService monitor;

    @BeforeEach
    void setUp() {
        manager = new DeviceManager(List.of(new DeviceConfig("rep", "Replicator", "/dev/ttyACM0"),
                DeviceConfig.virtual("dev1")), new EventBus("test"));
        monitor = new DeviceMonitorService(manager, portScanner, 5000);
    }

    @Test
    @DisplayName("Should detach device whose port is missing and attach it when it appears")
    void shouldFollowPortPresence() throws DeviceNotFoundException {
        // Given
        when(portScanner.scan()).thenReturn(Set.of(), Set.of("/dev/ttyACM0"));

        // When
        monitor.scan();

        // Then
        assertThat(manager.get("rep").isAttached()).isFalse();
        assertThat(manager.get("dev1").isAttached()).isTrue();

        // When
        monitor.scan();

        // Then
        assertThat(manager.get("rep").isAttached()).isTrue();
    }

    @Test
    @DisplayName("Should keep a device detached after disconnection while its port stays present")
    void shouldNotReattachWithoutPortChange() throws DeviceNotFoundException {
        // Given
        when(portScanner.scan()).thenReturn(Set.of("/dev/ttyACM0"));
        monitor.scan();

        // When
        manager.markDetached("rep", "disconnected mid-print");
        monitor.scan();

        // Then
        assertThat(manager.get("rep").isAttached()).isFalse();
    }

    @Test
    @DisplayName("Should survive scanner errors")
    void shouldSurviveScannerErrors() throws DeviceNotFoundException {
        // Given
        when(portScanner.scan()).thenThrow(new IllegalStateException("native library missing"));

        // When
        monitor.scan();

        // Then
        assertThat(manager.get("rep").isAttached()).isTrue();
    }

    @Test
    @DisplayName("Should schedule scans at fixed delay once")
    void shouldScheduleOnce() {
        // When
        monitor.startMonitoring(executor);
        monitor.startMonitoring(executor);

        // Then
        assertThat(monitor.isMonitoring()).isTrue();
        verify(executor).scheduleWithFixedDelay(any(Runnable.class), eq(0L), eq(5000L), eq(TimeUnit.MILLISECONDS));

        monitor.stopMonitoring();
        assertThat(monitor.isMonitoring()).isFalse();
    }

    @Test
    @DisplayName("Should not schedule scans when all devices are virtual")
    void shouldSkipVirtualOnly() {
        // Given
        DeviceMonitorService virtualOnly = new DeviceMonitorService(
                new DeviceManager(List.of(DeviceConfig.virtual("dev1")), new EventBus("test")), portScanner, 5000);

        // When
        virtualOnly.startMonitoring(executor);

        // Then
        assertThat(virtualOnly.isMonitoring()).isFalse();
        verify(executor, never()).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
    }
}
