package com.architecture.patchgraph.config;

import com.architecture.patchgraph.exception.PatchIOException;
import com.architecture.patchgraph.service.bridge.BridgeMode;
import com.architecture.patchgraph.service.registry.ObjectRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings beans for the patch services, read from application.yml.
 */
@Configuration
@Slf4j
public class PatchGraphConfig {

    @Value("${patchgraph.layout.margin:50}")
    private int layoutMargin;

    @Value("${patchgraph.layout.row-spacing:40}")
    private int layoutRowSpacing;

    @Value("${patchgraph.layout.col-spacing:120}")
    private int layoutColSpacing;

    @Value("${patchgraph.layout.align-columns:true}")
    private boolean layoutAlignColumns;

    @Value("${patchgraph.optimizer.collapsible-objects:}")
    private String collapsibleObjects;

    @Value("${patchgraph.bridge.strict-connections:false}")
    private boolean strictConnections;

    @Value("${patchgraph.registry.location:classpath:" + ObjectRegistry.BUNDLED_RESOURCE + "}")
    private String registryLocation;

    @Bean
    public LayoutSettings layoutSettings() {
        LayoutSettings settings = LayoutSettings.builder()
                .margin(layoutMargin)
                .rowSpacing(layoutRowSpacing)
                .colSpacing(layoutColSpacing)
                .alignColumns(layoutAlignColumns)
                .build();
        log.info("[PatchGraph Config] Layout: {}", settings);
        return settings;
    }

    @Bean
    public OptimizerSettings optimizerSettings() {
        Set<String> classes = Arrays.stream(collapsibleObjects.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
        log.info("[PatchGraph Config] Default collapsible objects: {}", classes);
        return new OptimizerSettings(classes);
    }

    @Bean
    public BridgeMode bridgeMode() {
        BridgeMode mode = strictConnections ? BridgeMode.STRICT : BridgeMode.TOLERANT;
        log.info("[PatchGraph Config] Bridge mode: {}", mode);
        return mode;
    }

    @Bean
    public ObjectRegistry objectRegistry(ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(registryLocation);
        try (InputStream in = resource.getInputStream()) {
            ObjectRegistry registry = ObjectRegistry.fromYaml(in);
            log.info("[PatchGraph Config] Object registry loaded from {}: {} classes", registryLocation, registry.size());
            return registry;
        } catch (IOException e) {
            throw new PatchIOException("Failed to load object registry from " + registryLocation, e);
        }
    }
}
