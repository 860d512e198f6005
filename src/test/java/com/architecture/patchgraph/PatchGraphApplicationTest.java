package com.architecture.patchgraph;

import com.architecture.patchgraph.controller.PatchController;
import com.architecture.patchgraph.dto.PatchRequest;
import com.architecture.patchgraph.dto.ValidationReport;
import com.architecture.patchgraph.service.bridge.BridgeMode;
import com.architecture.patchgraph.service.graph.AutoLayoutService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "patchgraph.bridge.strict-connections=true")
class PatchGraphApplicationTest {

    @Autowired
    private PatchController controller;

    @Autowired
    private BridgeMode bridgeMode;

    @Autowired
    private AutoLayoutService layoutService;

    @Test
    void contextLoads_withConfiguredBeans() {
        assertThat(bridgeMode).isEqualTo(BridgeMode.STRICT);
        assertThat(layoutService).isNotNull();
    }

    @Test
    void validate_throughWiredController() {
        ValidationReport report = controller.validate(PatchRequest.builder()
                .content(PatchFixtures.load(PatchFixtures.SYNTH))
                .build()).getBody();

        assertThat(report).isNotNull();
        assertThat(report.isValid()).isTrue();
        assertThat(report.getCycles()).isEmpty();
        assertThat(report.getStats().getTotalConnections()).isEqualTo(5);
    }
}
