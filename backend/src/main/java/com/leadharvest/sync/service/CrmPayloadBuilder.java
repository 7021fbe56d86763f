package com.leadharvest.sync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadharvest.config.CrmSettings;
import com.leadharvest.scrape.model.ProspectRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class CrmPayloadBuilder {
    private static final Logger log = LoggerFactory.getLogger(CrmPayloadBuilder.class);
    static final String EXTRAS_KEY = "crm";

    private final CrmSettings settings;
    private final ObjectMapper objectMapper;

    public CrmPayloadBuilder(CrmSettings settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> build(ProspectRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", isBlank(record.fullName()) ? "Unknown" : record.fullName());
        payload.put("email", nullToEmpty(record.email()));
        payload.put("phonenumber", isBlank(record.phoneE164()) ? nullToEmpty(record.phoneRaw()) : record.phoneE164());
        payload.put("company", nullToEmpty(record.company()));
        payload.put("description", description(record));
        if (!isBlank(record.website())) {
            payload.put("website", record.website());
        }
        if (!isBlank(record.position())) {
            payload.put("title", record.position());
        }
        if (!isBlank(record.phoneRegion())) {
            payload.put("country", record.phoneRegion());
        }

        for (Map.Entry<String, String> entry : settings.defaults().entrySet()) {
            if (isBlank(entry.getValue())) {
                continue;
            }
            Object current = payload.get(entry.getKey());
            if (current == null || (current instanceof String text && text.isEmpty())) {
                payload.put(entry.getKey(), entry.getValue());
            }
        }

        payload.putAll(extras(record));
        return payload;
    }

    private String description(ProspectRecord record) {
        List<String> lines = new ArrayList<>();
        if (!isBlank(record.eventName())) {
            lines.add("Event: " + record.eventName());
        }
        if (record.eventDate() != null) {
            lines.add("Event Date: " + record.eventDate());
        }
        if (record.eventDatetime() != null) {
            lines.add("Event DateTime: " + record.eventDatetime());
        }
        if (!isBlank(record.sourceName())) {
            lines.add("Source: " + record.sourceName());
        }
        if (!isBlank(record.sourceUrl())) {
            lines.add("Source URL: " + record.sourceUrl());
        }
        if (!isBlank(record.position())) {
            lines.add("Position: " + record.position());
        }
        if (!isBlank(record.notes())) {
            lines.add(record.notes());
        }
        return String.join("\n", lines);
    }

    private Map<String, Object> extras(ProspectRecord record) {
        if (isBlank(record.rawPayload())) {
            return Map.of();
        }
        try {
            JsonNode extras = objectMapper.readTree(record.rawPayload()).get(EXTRAS_KEY);
            if (extras == null || !extras.isObject()) {
                return Map.of();
            }
            return objectMapper.convertValue(extras, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Record {} has an unreadable raw payload, ignoring CRM extras", record.id());
            return Map.of();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
