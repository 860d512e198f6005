package com.architecture.patchgraph.service.registry;

import com.architecture.patchgraph.model.graph.PortCounts;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObjectRegistryTest {

    @Test
    void standard_knowsCommonClasses() {
        ObjectRegistry registry = ObjectRegistry.standard();

        assertThat(registry.lookup("osc~")).contains(PortCounts.of(2, 1));
        assertThat(registry.lookup("dac~")).contains(PortCounts.of(2, 0));
        assertThat(registry.lookup("loadbang")).contains(PortCounts.of(0, 1));
        assertThat(registry.lookup("no-such-object")).isEmpty();
        assertThat(ObjectRegistry.standard()).isSameAs(registry);
    }

    @Test
    void standard_marksArgumentDependentCountsUnknown() {
        ObjectRegistry registry = ObjectRegistry.standard();

        assertThat(registry.lookup("trigger")).contains(new PortCounts(1, null));
        assertThat(registry.lookup("t")).isEqualTo(registry.lookup("trigger"));
        assertThat(registry.lookup("pack")).contains(new PortCounts(null, 1));
    }

    @Test
    void fromYaml_readsPairsAndTildeAsUnknown() {
        ObjectRegistry registry = ObjectRegistry.fromYaml(yaml("""
                objects:
                  mixer~: [4, 1]
                  route: [2, ~]
                """));

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.lookup("mixer~")).contains(PortCounts.of(4, 1));
        assertThat(registry.lookup("route")).contains(new PortCounts(2, null));
        assertThat(registry.contains("route")).isTrue();
    }

    @Test
    void fromYaml_withEmptyDocument_isEmpty() {
        assertThat(ObjectRegistry.fromYaml(yaml("")).size()).isZero();
    }

    @Test
    void fromYaml_whenEntryIsNotAPair_throws() {
        assertThatThrownBy(() -> ObjectRegistry.fromYaml(yaml("objects:\n  broken: [1]\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("broken");
        assertThatThrownBy(() -> ObjectRegistry.fromYaml(yaml("objects:\n  odd: [one, 1]\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-integer");
    }

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
