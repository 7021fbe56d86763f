package com.leadharvest.scrape.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadharvest.scrape.config.TargetConfigException;
import com.leadharvest.scrape.config.TargetConfigParser;
import com.leadharvest.scrape.model.RenderMode;
import com.leadharvest.scrape.model.Target;
import com.leadharvest.scrape.model.TargetSyncOptions;
import com.leadharvest.scrape.model.TargetSyncSummary;
import com.leadharvest.scrape.persistence.ScrapeJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Service
public class TargetDefinitionSyncService {
    private static final Logger log = LoggerFactory.getLogger(TargetDefinitionSyncService.class);
    private static final int DEFAULT_RUN_EVERY_MINUTES = 60;

    private final ScrapeJdbcRepository repository;
    private final TargetConfigParser configParser;
    private final ObjectMapper objectMapper;

    public TargetDefinitionSyncService(
        ScrapeJdbcRepository repository,
        TargetConfigParser configParser,
        ObjectMapper objectMapper
    ) {
        this.repository = repository;
        this.configParser = configParser;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public TargetSyncSummary sync(JsonNode definitions, TargetSyncOptions options) {
        if (definitions == null || !definitions.isArray()) {
            throw new IllegalArgumentException("Target definitions must be a JSON list");
        }
        int created = 0;
        int updated = 0;
        int skipped = 0;
        int invalid = 0;
        List<String> messages = new ArrayList<>();
        Set<String> seenNames = new LinkedHashSet<>();

        for (JsonNode definition : definitions) {
            String name = text(definition, "name");
            if (name.isEmpty()) {
                invalid++;
                messages.add("skipped definition without name");
                continue;
            }
            seenNames.add(name);
            String startUrl = text(definition, "start_url");
            if (startUrl.isEmpty()) {
                invalid++;
                messages.add("skipped '" + name + "': missing start_url");
                continue;
            }
            JsonNode configNode = definition.path("config");
            String configJson;
            try {
                configParser.parse(configNode);
                configJson = objectMapper.writeValueAsString(configNode);
            } catch (TargetConfigException | JsonProcessingException e) {
                invalid++;
                messages.add("skipped '" + name + "': " + e.getMessage());
                continue;
            }
            RenderMode renderMode = renderMode(definition, name, messages);
            boolean enabled = !definition.hasNonNull("enabled") || definition.get("enabled").asBoolean(true);
            int runEveryMinutes = Math.max(1, definition.path("run_every_minutes").asInt(DEFAULT_RUN_EVERY_MINUTES));

            Optional<Target> existing = repository.findTargetByName(name);
            if (existing.isEmpty()) {
                if (!options.dryRun()) {
                    repository.insertTarget(name, enabled, renderMode, startUrl, runEveryMinutes, configJson);
                }
                created++;
                messages.add((options.dryRun() ? "would create " : "created ") + name);
            } else if (options.update()) {
                if (!options.dryRun()) {
                    repository.updateTarget(existing.get().id(), enabled, renderMode, startUrl, runEveryMinutes, configJson);
                }
                updated++;
                messages.add((options.dryRun() ? "would update " : "updated ") + name);
            } else {
                skipped++;
                messages.add("kept existing " + name);
            }
        }

        int disabled = 0;
        if (options.disableMissing()) {
            disabled = options.dryRun()
                ? repository.countTargetsToDisable(seenNames)
                : repository.disableTargetsExcept(seenNames);
            if (disabled > 0) {
                messages.add((options.dryRun() ? "would disable " : "disabled ") + disabled + " targets missing from definitions");
            }
        }

        log.info(
            "Target definitions synced dryRun={} created={} updated={} skipped={} invalid={} disabled={}",
            options.dryRun(),
            created,
            updated,
            skipped,
            invalid,
            disabled
        );
        return new TargetSyncSummary(options.dryRun(), created, updated, skipped, invalid, disabled, messages);
    }

    private RenderMode renderMode(JsonNode definition, String name, List<String> messages) {
        String raw = text(definition, "render_mode");
        if (raw.isEmpty()) {
            raw = text(definition, "target_type");
        }
        if (raw.isEmpty()) {
            return RenderMode.STATIC;
        }
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "static", "html" -> RenderMode.STATIC;
            case "browser", "playwright" -> RenderMode.BROWSER;
            default -> {
                messages.add("unknown render mode '" + raw + "' for " + name + ", using STATIC");
                yield RenderMode.STATIC;
            }
        };
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node == null ? null : node.get(key);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return "";
        }
        return value.asText().trim();
    }
}
