package com.leadharvest.scrape.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;

public record ProspectRecord(
    Long id,
    String sourceName,
    String sourceUrl,
    String sourceRef,
    String fullName,
    String email,
    String phoneRaw,
    String phoneE164,
    String phoneRegion,
    String company,
    String website,
    String position,
    String eventName,
    LocalDate eventDate,
    OffsetDateTime eventDatetime,
    String rawPayload,
    String rawPayloadHash,
    RecordStatus status,
    String notes,
    Instant createdAt,
    Instant updatedAt
) {
    public boolean hasMeaningfulField() {
        return notBlank(fullName)
            || notBlank(email)
            || notBlank(phoneRaw)
            || notBlank(phoneE164)
            || notBlank(company)
            || notBlank(website);
    }

    public ProspectRecord withId(long newId) {
        return new ProspectRecord(
            newId, sourceName, sourceUrl, sourceRef, fullName, email, phoneRaw, phoneE164, phoneRegion,
            company, website, position, eventName, eventDate, eventDatetime, rawPayload, rawPayloadHash,
            status, notes, createdAt, updatedAt
        );
    }

    public ProspectRecord withStatus(RecordStatus newStatus) {
        return new ProspectRecord(
            id, sourceName, sourceUrl, sourceRef, fullName, email, phoneRaw, phoneE164, phoneRegion,
            company, website, position, eventName, eventDate, eventDatetime, rawPayload, rawPayloadHash,
            newStatus, notes, createdAt, updatedAt
        );
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
