package com.leadharvest.config;

import com.leadharvest.scrape.model.HashMatchPolicy;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelinePropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        PipelineProperties properties = new PipelineProperties();
        properties.getHttp().setUserAgent("   ");
        assertTrue(properties.getHttp().getUserAgent().startsWith("lead-harvest/"));
    }

    @Test
    void countsAndIntervalsAreClamped() {
        PipelineProperties properties = new PipelineProperties();
        properties.getJobs().setWorkerCount(0);
        properties.getScheduler().setTickSeconds(1);
        properties.getRuns().setStaleRunMinutes(-5);
        properties.getHttp().setDefaultTimeoutSeconds(0);
        assertEquals(1, properties.getJobs().getWorkerCount());
        assertEquals(5, properties.getScheduler().getTickSeconds());
        assertEquals(1, properties.getRuns().getStaleRunMinutes());
        assertEquals(1, properties.getHttp().getDefaultTimeoutSeconds());
    }

    @Test
    void upsertDefaults() {
        PipelineProperties properties = new PipelineProperties();
        properties.getUpsert().setDefaultPhoneRegion(" ");
        assertNull(properties.getUpsert().getDefaultPhoneRegion());
        assertEquals(HashMatchPolicy.GLOBAL, properties.getUpsert().getHashMatchPolicy());
        assertNull(properties.getTargets().getImportFile());
    }

    @Test
    void enrichmentBoundsAreClamped() {
        PipelineProperties properties = new PipelineProperties();
        assertEquals(50, properties.getEnrichment().getMaxRecords());
        assertEquals(2000L, properties.getEnrichment().getDelayMillis());
        properties.getEnrichment().setMaxRecords(0);
        properties.getEnrichment().setDelayMillis(-1);
        assertEquals(1, properties.getEnrichment().getMaxRecords());
        assertEquals(0L, properties.getEnrichment().getDelayMillis());
    }

    @Test
    void crmSettingsNeedBaseUrlAndToken() {
        PipelineProperties.Crm crm = new PipelineProperties().getCrm();
        crm.setEnabled(true);
        crm.setBaseUrl("https://crm.example.com/");
        crm.setMaxAttempts(0);
        crm.setDefaults(Map.of("source", "web"));

        CrmSettings withoutToken = CrmSettings.from(crm);
        assertFalse(withoutToken.isConfigured());
        assertEquals(1, withoutToken.maxAttempts());
        assertEquals("/api/leads/{id}", withoutToken.updatePath());

        crm.setToken(" secret ");
        CrmSettings configured = CrmSettings.from(crm);
        assertTrue(configured.isConfigured());
        assertEquals("secret", configured.token());
        assertEquals("web", configured.defaults().get("source"));
    }
}
