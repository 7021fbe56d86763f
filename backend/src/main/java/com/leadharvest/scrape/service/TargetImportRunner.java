package com.leadharvest.scrape.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadharvest.config.PipelineProperties;
import com.leadharvest.scrape.model.TargetSyncOptions;
import com.leadharvest.scrape.model.TargetSyncSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class TargetImportRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(TargetImportRunner.class);

    private final TargetDefinitionSyncService syncService;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;

    public TargetImportRunner(
        TargetDefinitionSyncService syncService,
        PipelineProperties properties,
        ObjectMapper objectMapper
    ) {
        this.syncService = syncService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) {
        String importFile = properties.getTargets().getImportFile();
        if (importFile == null) {
            return;
        }
        Path path = Path.of(importFile);
        if (!Files.isReadable(path)) {
            log.warn("Target import file {} is not readable, skipping import", path);
            return;
        }
        JsonNode definitions;
        try {
            definitions = objectMapper.readTree(Files.readString(path));
        } catch (IOException e) {
            log.warn("Failed to read target import file {}", path, e);
            return;
        }
        TargetSyncSummary summary;
        try {
            summary = syncService.sync(
                definitions,
                new TargetSyncOptions(properties.getTargets().isUpdateExisting(), false, false)
            );
        } catch (IllegalArgumentException e) {
            log.warn("Target import file {} rejected: {}", path, e.getMessage());
            return;
        }
        log.info("Imported targets from {}: {}", path, summary.messages());
    }
}
