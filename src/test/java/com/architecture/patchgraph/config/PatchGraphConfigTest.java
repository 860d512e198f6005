package com.architecture.patchgraph.config;

import com.architecture.patchgraph.exception.PatchIOException;
import com.architecture.patchgraph.model.graph.PortCounts;
import com.architecture.patchgraph.service.bridge.BridgeMode;
import com.architecture.patchgraph.service.registry.ObjectRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatchGraphConfigTest {

    private final PatchGraphConfig config = new PatchGraphConfig();

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(config, "layoutMargin", 30);
        ReflectionTestUtils.setField(config, "layoutRowSpacing", 45);
        ReflectionTestUtils.setField(config, "layoutColSpacing", 90);
        ReflectionTestUtils.setField(config, "layoutAlignColumns", false);
        ReflectionTestUtils.setField(config, "collapsibleObjects", " spigot , , pass ");
        ReflectionTestUtils.setField(config, "strictConnections", true);
        ReflectionTestUtils.setField(config, "registryLocation", "classpath:" + ObjectRegistry.BUNDLED_RESOURCE);
    }

    @Test
    void layoutSettings_comesFromProperties() {
        LayoutSettings settings = config.layoutSettings();

        assertThat(settings.getMargin()).isEqualTo(30);
        assertThat(settings.getRowSpacing()).isEqualTo(45);
        assertThat(settings.getColSpacing()).isEqualTo(90);
        assertThat(settings.isAlignColumns()).isFalse();
    }

    @Test
    void optimizerSettings_splitsCommaSeparatedClasses() {
        assertThat(config.optimizerSettings().getCollapsibleObjects()).containsExactlyInAnyOrder("spigot", "pass");
    }

    @Test
    void optimizerSettings_withBlankProperty_isEmpty() {
        ReflectionTestUtils.setField(config, "collapsibleObjects", "");

        assertThat(config.optimizerSettings().getCollapsibleObjects()).isEmpty();
    }

    @Test
    void bridgeMode_followsStrictFlag() {
        assertThat(config.bridgeMode()).isEqualTo(BridgeMode.STRICT);

        ReflectionTestUtils.setField(config, "strictConnections", false);
        assertThat(config.bridgeMode()).isEqualTo(BridgeMode.TOLERANT);
    }

    @Test
    void objectRegistry_loadsBundledTable() {
        ObjectRegistry registry = config.objectRegistry(new DefaultResourceLoader());

        assertThat(registry.lookup("osc~")).contains(PortCounts.of(2, 1));
    }

    @Test
    void objectRegistry_loadsCustomFile(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("objects.yml"), "objects:\n  mixer~: [4, 1]\n");
        ReflectionTestUtils.setField(config, "registryLocation", file.toUri().toString());

        ObjectRegistry registry = config.objectRegistry(new DefaultResourceLoader());

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.contains("osc~")).isFalse();
    }

    @Test
    void objectRegistry_whenMissing_throwsPatchIOException(@TempDir Path dir) {
        ReflectionTestUtils.setField(config, "registryLocation", dir.resolve("missing.yml").toUri().toString());

        assertThatThrownBy(() -> config.objectRegistry(new DefaultResourceLoader()))
                .isInstanceOf(PatchIOException.class)
                .hasMessageContaining("missing.yml");
    }
}
