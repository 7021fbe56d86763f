package com.leadharvest.scrape.model;

import java.util.Locale;

public enum EnrichmentFilter {
    UNENRICHED, // neither email nor company
    NO_CONTACT, // no email
    ALL;

    public static EnrichmentFilter parse(String value) {
        if (value == null || value.isBlank()) {
            return UNENRICHED;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return EnrichmentFilter.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown enrichment filter: " + value);
        }
    }
}
