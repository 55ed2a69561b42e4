package conveyor.domain.slicer;

import com.google.gson.JsonObject;
import conveyor.common.ESlicerBackend;
import conveyor.dal.SlicerProfile;
import conveyor.dal.SlicingSettings;
import conveyor.domain.job.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the external process slicers, using shell scripts in place of the real tools
 * @since 17/10/2025
 */
class ProcessSlicerTest {

    @TempDir
    Path tempDir;

    private Path model;

    @BeforeEach
    void setUp() throws IOException {
        model = Files.writeString(tempDir.resolve("cube.stl"), "solid cube\nendsolid cube\n");
    }

    private Path script(String name, String body) throws IOException {
        Path script = Files.writeString(tempDir.resolve(name), "#!/bin/sh\n" + body + "\n");
        script.toFile().setExecutable(true);
        return script;
    }

    private SlicerProfile miracleGrue(Path executable, Path baseConfig) {
        return new SlicerProfile("mg", ESlicerBackend.MIRACLE_GRUE, executable, baseConfig, null, null, null, 10_000);
    }

    private SliceRequest request(SlicerProfile profile) {
        return new SliceRequest(model, tempDir.resolve("jobs/j1/cube.gcode"), profile, SlicingSettings.defaults());
    }

    @Test
    @DisplayName("Should overlay job settings on the base Miracle Grue configuration")
    void shouldMergeMiracleGrueConfig() throws IOException {
        // Given
        Path base = Files.writeString(tempDir.resolve("base.config"),
                "{\"layerHeight\": 0.1, \"nozzleDiameter\": 0.4, \"doRaft\": true}");
        SlicingSettings settings = new SlicingSettings(false, true, 0.25, 0.3, 3, 220, 100, 90, 150);

        // When
        JsonObject config = new MiracleGrueSlicer().buildConfig(base, settings);

        // Then
        assertThat(config.get("nozzleDiameter").getAsDouble()).isEqualTo(0.4);
        assertThat(config.get("layerHeight").getAsDouble()).isEqualTo(0.3);
        assertThat(config.get("doRaft").getAsBoolean()).isFalse();
        assertThat(config.get("doSupport").getAsBoolean()).isTrue();
        assertThat(config.get("numberOfShells").getAsInt()).isEqualTo(3);
        assertThat(config.get("rapidMoveFeedRateXY").getAsInt()).isEqualTo(150);
    }

    @Test
    @DisplayName("Should pass slicing settings to Skeinforge as profile options")
    void shouldBuildSkeinforgeOptions() {
        // Given
        SlicingSettings settings = new SlicingSettings(true, false, 0.15, 0.2, 2, 230, 110, 40, 55);

        // When & Then
        assertThat(SkeinforgeSlicer.options(settings))
                .contains("raft.csv:Add Raft, Elevate Nozzle, Orbit:true",
                        "raft.csv:None:true",
                        "fill.csv:Infill Solidity (ratio):0.15",
                        "carve.csv:Layer Height (mm):0.2",
                        "speed.csv:Travel Feed Rate (mm/s):55");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("Should run Miracle Grue and return the written toolpath")
    void shouldRunMiracleGrue() throws Exception {
        // Given
        Path exe = script("miracle_grue", "while [ $# -gt 0 ]; do\n"
                + "  if [ \"$1\" = \"-o\" ]; then out=\"$2\"; fi\n"
                + "  shift\n"
                + "done\n"
                + "echo 'G1 X1 Y1' > \"$out\"");

        // When
        Path toolpath = new MiracleGrueSlicer().slice(request(miracleGrue(exe, null)), new CancellationToken());

        // Then
        assertThat(toolpath).isEqualTo(tempDir.resolve("jobs/j1/cube.gcode"));
        assertThat(Files.readString(toolpath)).contains("G1 X1 Y1");
        assertThat(tempDir.resolve("jobs/j1/" + MiracleGrueSlicer.CONFIG_FILE)).exists();
        assertThat(tempDir.resolve("jobs/j1/" + MiracleGrueSlicer.START_FILE)).exists();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("Should report non-zero exit as SliceFailed with diagnostics")
    void shouldReportNonZeroExit() throws Exception {
        // Given
        Path exe = script("miracle_grue", "echo 'loading model'\necho 'mesh is not manifold' >&2\nexit 2");

        // When & Then
        assertThatThrownBy(() -> new MiracleGrueSlicer().slice(request(miracleGrue(exe, null)), new CancellationToken()))
                .isInstanceOfSatisfying(SliceFailedException.class, e -> {
                    assertThat(e.getExitCode()).isEqualTo(2);
                    assertThat(e.getDiagnostics()).contains("loading model", "mesh is not manifold");
                });
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("Should report missing output as SliceFailed")
    void shouldReportMissingOutput() throws Exception {
        // Given
        Path exe = script("miracle_grue", "echo done");

        // When & Then
        assertThatThrownBy(() -> new MiracleGrueSlicer().slice(request(miracleGrue(exe, null)), new CancellationToken()))
                .isInstanceOf(SliceFailedException.class)
                .hasMessageContaining("no toolpath");
    }

    @Test
    @DisplayName("Should report a missing executable as SliceFailed")
    void shouldReportMissingExecutable() {
        SlicerProfile profile = miracleGrue(tempDir.resolve("not-installed"), null);

        assertThatThrownBy(() -> new MiracleGrueSlicer().slice(request(profile), new CancellationToken()))
                .isInstanceOf(SliceFailedException.class)
                .hasMessageContaining("could not be started");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("Should terminate the slicer process on cancel")
    void shouldTerminateOnCancel() throws Exception {
        // Given
        Path exe = script("miracle_grue", "sleep 30");
        CancellationToken token = new CancellationToken();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.schedule(token::cancel, 300, TimeUnit.MILLISECONDS);

        try {
            // When
            long start = System.currentTimeMillis();
            assertThatThrownBy(() -> new MiracleGrueSlicer().slice(request(miracleGrue(exe, null)), token))
                    .isInstanceOf(CancellationException.class);

            // Then
            assertThat(System.currentTimeMillis() - start).isLessThan(10_000);
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("Should run Skeinforge through its interpreter and collect the export file")
    void shouldRunSkeinforge() throws Exception {
        // Given
        Path craft = script("skeinforge_craft.py", "for a; do last=\"$a\"; done\n"
                + "echo 'G1 Z0.2' > \"${last%.*}_export.gcode\"");
        SlicerProfile profile = new SlicerProfile("skein", ESlicerBackend.SKEINFORGE, craft, null, "sh", null, null, 10_000);

        // When
        Path toolpath = new SkeinforgeSlicer().slice(request(profile), new CancellationToken());

        // Then
        assertThat(toolpath).isEqualTo(tempDir.resolve("jobs/j1/cube.gcode"));
        assertThat(Files.readString(toolpath)).contains("G1 Z0.2");
        assertThat(SkeinforgeSlicer.exportPath(request(profile))).doesNotExist();
    }
}
