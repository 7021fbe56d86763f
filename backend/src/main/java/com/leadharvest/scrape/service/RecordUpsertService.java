package com.leadharvest.scrape.service;

import com.leadharvest.config.PipelineProperties;
import com.leadharvest.scrape.model.HashMatchPolicy;
import com.leadharvest.scrape.model.NormalizedPhone;
import com.leadharvest.scrape.model.ProspectRecord;
import com.leadharvest.scrape.model.RecordStatus;
import com.leadharvest.scrape.model.Target;
import com.leadharvest.scrape.model.UpsertResult;
import com.leadharvest.scrape.normalize.DateTimeParsing;
import com.leadharvest.scrape.normalize.PhoneNormalizer;
import com.leadharvest.scrape.persistence.ProspectJdbcRepository;
import com.leadharvest.scrape.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Service
public class RecordUpsertService {
    private static final Logger log = LoggerFactory.getLogger(RecordUpsertService.class);

    static final List<String> EMAIL_KEYS = List.of("email", "email_address");
    static final List<String> PHONE_KEYS = List.of("phone", "phone_number", "phonenumber");
    static final List<String> COMPANY_KEYS = List.of("company", "organization");
    static final List<String> WEBSITE_KEYS = List.of("website", "url", "website_url", "site");
    static final List<String> EVENT_NAME_KEYS = List.of("event_name", "event_text", "date_text", "event_description", "description");
    static final List<String> FULL_NAME_KEYS = List.of("full_name", "name");
    static final List<String> POSITION_KEYS = List.of("position", "job_title");
    static final List<String> SOURCE_REF_KEYS = List.of("source_ref", "id", "ref", "listing_id");
    static final List<String> EVENT_DATE_KEYS = List.of("event_date", "date");
    static final List<String> EVENT_DATETIME_KEYS = List.of("event_datetime", "datetime", "start_time");

    private final ProspectJdbcRepository repository;
    private final PipelineProperties properties;

    public RecordUpsertService(ProspectJdbcRepository repository, PipelineProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    /**
     * Must run inside the caller's transaction so the lookup and the write are atomic.
     */
    public UpsertResult upsert(Target target, Map<String, Object> row) {
        ProspectRecord incoming = map(target, row);
        Optional<ProspectRecord> match = findMatch(incoming);
        if (match.isEmpty()) {
            long id = repository.insert(incoming);
            return UpsertResult.created(incoming.withId(id));
        }

        ProspectRecord existing = match.get();
        if (existing.status() != null && existing.status().isTerminal()) {
            log.debug("Record {} is {}, leaving it untouched", existing.id(), existing.status());
            return UpsertResult.untouched(existing);
        }
        ProspectRecord merged = merge(existing, incoming);
        if (!repository.update(merged)) {
            log.debug("Record {} became terminal before the write, leaving it untouched", existing.id());
            return UpsertResult.untouched(existing);
        }
        return UpsertResult.updated(merged);
    }

    ProspectRecord map(Target target, Map<String, Object> row) {
        String canonical = HashUtils.canonicalJson(row);
        String hash = HashUtils.sha256Hex(canonical);

        String email = firstNonEmpty(row, EMAIL_KEYS);
        String phone = firstNonEmpty(row, PHONE_KEYS);
        Optional<NormalizedPhone> normalized = phone.isEmpty()
            ? Optional.empty()
            : PhoneNormalizer.normalize(phone, properties.getUpsert().getDefaultPhoneRegion());
        String pageUrl = stringValue(row.get(PaginatingFetcher.PAGE_URL_KEY));
        String eventDateText = firstNonEmpty(row, EVENT_DATE_KEYS);
        String eventDatetimeText = firstNonEmpty(row, EVENT_DATETIME_KEYS);
        LocalDate eventDate = eventDateText.isEmpty() ? null : DateTimeParsing.parseDate(eventDateText).orElse(null);
        OffsetDateTime eventDatetime = eventDatetimeText.isEmpty()
            ? null
            : DateTimeParsing.parseDateTime(eventDatetimeText).orElse(null);

        return new ProspectRecord(
            null,
            target.name(),
            pageUrl.isEmpty() ? nullToEmpty(target.startUrl()) : pageUrl,
            firstNonEmpty(row, SOURCE_REF_KEYS),
            firstNonEmpty(row, FULL_NAME_KEYS),
            email.isEmpty() ? null : email,
            phone,
            normalized.map(NormalizedPhone::e164).orElse(""),
            normalized.map(NormalizedPhone::region).orElse(""),
            firstNonEmpty(row, COMPANY_KEYS),
            firstNonEmpty(row, WEBSITE_KEYS),
            firstNonEmpty(row, POSITION_KEYS),
            firstNonEmpty(row, EVENT_NAME_KEYS),
            eventDate,
            eventDatetime,
            canonical,
            hash,
            RecordStatus.NEW,
            null,
            null,
            null
        );
    }

    private Optional<ProspectRecord> findMatch(ProspectRecord incoming) {
        Optional<ProspectRecord> match = repository.findLatestByEmail(incoming.email());
        if (match.isPresent()) {
            return match;
        }
        match = repository.findLatestByPhoneE164(incoming.phoneE164());
        if (match.isPresent()) {
            return match;
        }
        HashMatchPolicy policy = properties.getUpsert().getHashMatchPolicy();
        return switch (policy == null ? HashMatchPolicy.GLOBAL : policy) {
            case GLOBAL -> repository.findLatestByRawPayloadHash(incoming.rawPayloadHash());
            case SAME_SOURCE -> repository.findLatestByRawPayloadHashAndSource(
                incoming.rawPayloadHash(),
                incoming.sourceName()
            );
            case DISABLED -> Optional.empty();
        };
    }

    /**
     * New values win only when present and different; nothing is erased by a blank.
     * Raw payload and its hash always follow the latest row.
     */
    static ProspectRecord merge(ProspectRecord existing, ProspectRecord incoming) {
        return new ProspectRecord(
            existing.id(),
            mergeText(existing.sourceName(), incoming.sourceName()),
            mergeText(existing.sourceUrl(), incoming.sourceUrl()),
            mergeText(existing.sourceRef(), incoming.sourceRef()),
            mergeText(existing.fullName(), incoming.fullName()),
            mergeText(existing.email(), incoming.email()),
            mergeText(existing.phoneRaw(), incoming.phoneRaw()),
            mergeText(existing.phoneE164(), incoming.phoneE164()),
            mergeText(existing.phoneRegion(), incoming.phoneRegion()),
            mergeText(existing.company(), incoming.company()),
            mergeText(existing.website(), incoming.website()),
            mergeText(existing.position(), incoming.position()),
            mergeText(existing.eventName(), incoming.eventName()),
            mergeValue(existing.eventDate(), incoming.eventDate()),
            mergeValue(existing.eventDatetime(), incoming.eventDatetime()),
            incoming.rawPayload(),
            incoming.rawPayloadHash(),
            existing.status(),
            existing.notes(),
            existing.createdAt(),
            existing.updatedAt()
        );
    }

    private static String mergeText(String current, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return current;
        }
        String trimmed = candidate.trim();
        if (trimmed.equals(nullToEmpty(current).trim())) {
            return current;
        }
        return trimmed;
    }

    private static <T> T mergeValue(T current, T candidate) {
        if (candidate == null || Objects.equals(current, candidate)) {
            return current;
        }
        return candidate;
    }

    static String firstNonEmpty(Map<String, Object> row, List<String> keys) {
        for (String key : keys) {
            String value = stringValue(row.get(key));
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static String stringValue(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
