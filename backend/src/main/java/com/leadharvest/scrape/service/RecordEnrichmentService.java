package com.leadharvest.scrape.service;

import com.leadharvest.config.PipelineProperties;
import com.leadharvest.scrape.config.TargetConfigParser;
import com.leadharvest.scrape.extract.SelectorExtractor;
import com.leadharvest.scrape.http.PageFetchException;
import com.leadharvest.scrape.http.PageFetcher;
import com.leadharvest.scrape.model.EnrichmentProfile;
import com.leadharvest.scrape.model.EnrichmentRequest;
import com.leadharvest.scrape.model.EnrichmentSummary;
import com.leadharvest.scrape.model.FetchedPage;
import com.leadharvest.scrape.model.NormalizedPhone;
import com.leadharvest.scrape.model.ProspectRecord;
import com.leadharvest.scrape.model.RecordEnrichmentResult;
import com.leadharvest.scrape.model.RecordUpsertedEvent;
import com.leadharvest.scrape.model.RenderMode;
import com.leadharvest.scrape.model.TargetConfig;
import com.leadharvest.scrape.normalize.DateTimeParsing;
import com.leadharvest.scrape.normalize.PhoneNormalizer;
import com.leadharvest.scrape.persistence.ProspectJdbcRepository;
import com.leadharvest.scrape.util.FailureClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Visits the source page of stored records and copies contact details found there into
 * fields that are still blank. Populated fields and terminal records are never changed.
 */
@Service
public class RecordEnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(RecordEnrichmentService.class);

    static final int DESCRIPTION_LIMIT = 1000;
    private static final int ORGANIZER_WINDOW = 100;
    private static final String TEXT_PHONE_REGION = "US";

    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final List<String> IGNORED_EMAIL_MARKERS = List.of("noreply", "no-reply", "example", "spam");
    private static final Pattern US_PHONE = Pattern.compile(
        "(?<!\\d)(?:\\+?1[-. ]?)?\\(?(\\d{3})\\)?[-. ]?(\\d{3})[-. ]?(\\d{4})(?!\\d)"
    );
    private static final List<String> ORGANIZER_MARKERS = List.of("organized by", "hosted by", "presented by", "contact:");
    private static final Pattern ORGANIZER_NAME = Pattern.compile("(?:by|:)\\s*([A-Z][A-Za-z &]+?)\\s*(?:[.,\\n]|$)");

    private final ProspectJdbcRepository repository;
    private final SelectorExtractor extractor;
    private final PipelineProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final Map<RenderMode, PageFetcher> fetchers = new EnumMap<>(RenderMode.class);
    private final Map<EnrichmentProfile, TargetConfig> profileConfigs = new EnumMap<>(EnrichmentProfile.class);

    public RecordEnrichmentService(
        ProspectJdbcRepository repository,
        List<PageFetcher> fetchers,
        SelectorExtractor extractor,
        TargetConfigParser configParser,
        PipelineProperties properties,
        TransactionTemplate transactionTemplate,
        ApplicationEventPublisher eventPublisher
    ) {
        this.repository = repository;
        this.extractor = extractor;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.eventPublisher = eventPublisher;
        for (PageFetcher fetcher : fetchers) {
            this.fetchers.put(fetcher.renderMode(), fetcher);
        }
        for (EnrichmentProfile profile : EnrichmentProfile.values()) {
            profileConfigs.put(profile, configParser.parse(profile.configJson()));
        }
    }

    public EnrichmentSummary enrich(EnrichmentRequest request) {
        int limit = request.maxRecords() > 0 ? request.maxRecords() : properties.getEnrichment().getMaxRecords();
        List<Long> candidates = selectCandidates(request, limit);
        if (request.dryRun()) {
            log.info("Enrichment dry run selected {} records", candidates.size());
            return EnrichmentSummary.dryRun(candidates);
        }

        PageFetcher fetcher = fetchers.get(request.renderMode());
        if (fetcher == null) {
            throw new IllegalStateException("No page fetcher registered for render mode " + request.renderMode());
        }
        TargetConfig config = profileConfigs.get(request.profile());
        long delayMillis = properties.getEnrichment().getDelayMillis();

        List<RecordEnrichmentResult> results = new ArrayList<>(candidates.size());
        int fetched = 0;
        for (Long recordId : candidates) {
            Optional<ProspectRecord> found = repository.findById(recordId);
            if (found.isEmpty()) {
                results.add(RecordEnrichmentResult.failed(recordId, "record not found"));
                continue;
            }
            ProspectRecord record = found.get();
            Optional<RecordEnrichmentResult> precheck = precheck(record);
            if (precheck.isPresent()) {
                results.add(precheck.get());
                continue;
            }
            if (fetched > 0 && !pause(delayMillis)) {
                log.warn("Enrichment interrupted after {} of {} records", results.size(), candidates.size());
                break;
            }
            fetched++;
            results.add(enrichRecord(record, request.profile(), config, fetcher));
        }

        EnrichmentSummary summary = EnrichmentSummary.of(results);
        log.info(
            "Enrichment finished total={} enriched={} skipped={} failed={} profile={}",
            summary.total(),
            summary.enriched(),
            summary.skipped(),
            summary.failed(),
            request.profile()
        );
        return summary;
    }

    private List<Long> selectCandidates(EnrichmentRequest request, int limit) {
        if (!request.recordIds().isEmpty()) {
            return request.recordIds().stream().distinct().limit(limit).toList();
        }
        return repository.findEnrichmentCandidates(request.filter(), request.sourceName(), limit).stream()
            .map(ProspectRecord::id)
            .toList();
    }

    private Optional<RecordEnrichmentResult> precheck(ProspectRecord record) {
        if (record.status() != null && record.status().isTerminal()) {
            return Optional.of(RecordEnrichmentResult.skipped(record.id(), "record is " + record.status()));
        }
        if (isBlank(record.sourceUrl())) {
            return Optional.of(RecordEnrichmentResult.failed(record.id(), "no source URL to enrich from"));
        }
        if (blankFieldNames(record).isEmpty()) {
            return Optional.of(RecordEnrichmentResult.skipped(record.id(), "no blank fields"));
        }
        return Optional.empty();
    }

    private RecordEnrichmentResult enrichRecord(
        ProspectRecord record,
        EnrichmentProfile profile,
        TargetConfig config,
        PageFetcher fetcher
    ) {
        long recordId = record.id();
        Map<String, String> details;
        try {
            FetchedPage page = fetcher.fetch(record.sourceUrl(), config);
            details = extractDetails(page.html(), page.finalUrlOrRequested(), profile);
        } catch (PageFetchException e) {
            log.warn("Enrichment fetch for record {} failed: {}", recordId, e.getMessage());
            return RecordEnrichmentResult.failed(recordId, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Enrichment of record {} failed", recordId, e);
            return RecordEnrichmentResult.failed(recordId, FailureClassifier.describe(e));
        }
        if (details.isEmpty()) {
            return RecordEnrichmentResult.failed(recordId, "no data extracted from detail page");
        }

        ProspectRecord values = toValues(record, details);
        List<String> gained = new ArrayList<>(blankFieldNames(record));
        gained.retainAll(filledFieldNames(values));
        if (gained.isEmpty()) {
            return RecordEnrichmentResult.skipped(recordId, "detail page added nothing new");
        }

        boolean written = Boolean.TRUE.equals(transactionTemplate.execute(tx -> {
            if (!repository.fillBlankFields(recordId, values)) {
                return false;
            }
            eventPublisher.publishEvent(new RecordUpsertedEvent(recordId, false, record.sourceName()));
            return true;
        }));
        if (!written) {
            return RecordEnrichmentResult.skipped(recordId, "record became terminal before the write");
        }
        log.info("Record {} enriched with {}", recordId, gained);
        return RecordEnrichmentResult.enriched(recordId, gained);
    }

    // profile selectors first, text heuristics for whatever they left empty
    Map<String, String> extractDetails(String html, String pageUrl, EnrichmentProfile profile) {
        Map<String, String> details = new LinkedHashMap<>();
        if (html == null || html.isBlank()) {
            return details;
        }
        List<Map<String, String>> items = extractor.extractItems(html, pageUrl, profileConfigs.get(profile));
        if (!items.isEmpty()) {
            for (Map.Entry<String, String> field : items.get(0).entrySet()) {
                String cleaned = clean(field.getKey(), field.getValue(), profile);
                if (!cleaned.isEmpty()) {
                    details.put(field.getKey(), cleaned);
                }
            }
        }

        Document document = Jsoup.parse(html);
        String text = document.body() == null ? "" : document.body().wholeText();
        if (!details.containsKey("email")) {
            findEmail(text).ifPresent(email -> details.put("email", email));
        }
        if (!details.containsKey("phone")) {
            findPhone(text).ifPresent(phone -> details.put("phone", phone));
        }
        if (!details.containsKey("company")) {
            findOrganizer(text).ifPresent(company -> details.put("company", company));
        }
        return details;
    }

    private String clean(String key, String value, EnrichmentProfile profile) {
        String normalized = SelectorExtractor.normalizeWhitespace(value);
        if (normalized.isEmpty()) {
            return "";
        }
        return switch (key) {
            case "email" -> cleanEmail(normalized);
            case "phone" -> stripScheme(normalized, "tel:");
            case "website" -> acceptWebsite(normalized, profile) ? normalized : "";
            case "event_description" -> normalized.length() <= DESCRIPTION_LIMIT
                ? normalized
                : normalized.substring(0, DESCRIPTION_LIMIT);
            default -> normalized;
        };
    }

    private static String cleanEmail(String value) {
        String address = stripScheme(value, "mailto:");
        int query = address.indexOf('?');
        if (query >= 0) {
            address = address.substring(0, query);
        }
        address = address.trim();
        return EMAIL.matcher(address).matches() && !isIgnoredEmail(address) ? address : "";
    }

    private static String stripScheme(String value, String scheme) {
        if (value.regionMatches(true, 0, scheme, 0, scheme.length())) {
            return value.substring(scheme.length()).trim();
        }
        return value;
    }

    private static boolean acceptWebsite(String value, EnrichmentProfile profile) {
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            log.debug("Ignoring malformed website link {}", value);
            return false;
        }
        String scheme = uri.getScheme();
        String host = uri.getHost();
        if (host == null || scheme == null || !scheme.toLowerCase(Locale.ROOT).startsWith("http")) {
            return false;
        }
        String lowerHost = host.toLowerCase(Locale.ROOT);
        return profile.excludedWebsiteHosts().stream().noneMatch(lowerHost::contains);
    }

    static Optional<String> findEmail(String text) {
        Matcher matcher = EMAIL.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group();
            if (!isIgnoredEmail(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    static Optional<String> findPhone(String text) {
        Matcher matcher = US_PHONE.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of("(" + matcher.group(1) + ") " + matcher.group(2) + "-" + matcher.group(3));
    }

    static Optional<String> findOrganizer(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : ORGANIZER_MARKERS) {
            int index = lower.indexOf(marker);
            if (index < 0) {
                continue;
            }
            String window = text.substring(index, Math.min(text.length(), index + ORGANIZER_WINDOW));
            Matcher matcher = ORGANIZER_NAME.matcher(window);
            if (matcher.find()) {
                String name = SelectorExtractor.normalizeWhitespace(matcher.group(1));
                if (!name.isEmpty()) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isIgnoredEmail(String email) {
        String lower = email.toLowerCase(Locale.ROOT);
        return IGNORED_EMAIL_MARKERS.stream().anyMatch(lower::contains);
    }

    private ProspectRecord toValues(ProspectRecord record, Map<String, String> details) {
        String phone = details.getOrDefault("phone", "");
        String region = properties.getUpsert().getDefaultPhoneRegion();
        Optional<NormalizedPhone> normalized = phone.isEmpty()
            ? Optional.empty()
            : PhoneNormalizer.normalize(phone, region == null ? TEXT_PHONE_REGION : region);
        String datetimeText = details.getOrDefault("event_datetime", "");
        OffsetDateTime eventDatetime = datetimeText.isEmpty()
            ? null
            : DateTimeParsing.parseDateTime(datetimeText).orElse(null);
        String email = details.getOrDefault("email", "");
        return new ProspectRecord(
            record.id(),
            record.sourceName(),
            record.sourceUrl(),
            record.sourceRef(),
            details.getOrDefault("full_name", ""),
            email.isEmpty() ? null : email,
            phone,
            normalized.map(NormalizedPhone::e164).orElse(""),
            normalized.map(NormalizedPhone::region).orElse(""),
            details.getOrDefault("company", ""),
            details.getOrDefault("website", ""),
            "",
            details.getOrDefault("event_description", ""),
            null,
            eventDatetime,
            null,
            "",
            record.status(),
            null,
            null,
            null
        );
    }

    private static List<String> blankFieldNames(ProspectRecord record) {
        return fieldNames(record, false);
    }

    private static List<String> filledFieldNames(ProspectRecord record) {
        return fieldNames(record, true);
    }

    private static List<String> fieldNames(ProspectRecord record, boolean filled) {
        Map<String, Boolean> present = new LinkedHashMap<>();
        present.put("full_name", !isBlank(record.fullName()));
        present.put("email", !isBlank(record.email()));
        present.put("phone", !isBlank(record.phoneRaw()));
        present.put("company", !isBlank(record.company()));
        present.put("website", !isBlank(record.website()));
        present.put("event_name", !isBlank(record.eventName()));
        present.put("event_datetime", record.eventDatetime() != null);
        List<String> names = new ArrayList<>();
        present.forEach((name, isPresent) -> {
            if (isPresent == filled) {
                names.add(name);
            }
        });
        return names;
    }

    private static boolean pause(long delayMillis) {
        if (delayMillis <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
