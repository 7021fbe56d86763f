package com.leadharvest.config;

import com.leadharvest.scrape.model.HashMatchPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT = "lead-harvest/0.1 (+contact)";

    private Http http = new Http();
    private Browser browser = new Browser();
    private Upsert upsert = new Upsert();
    private Crm crm = new Crm();
    private Jobs jobs = new Jobs();
    private Scheduler scheduler = new Scheduler();
    private Runs runs = new Runs();
    private Ops ops = new Ops();
    private Targets targets = new Targets();
    private Enrichment enrichment = new Enrichment();

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Upsert getUpsert() {
        return upsert;
    }

    public void setUpsert(Upsert upsert) {
        this.upsert = upsert;
    }

    public Crm getCrm() {
        return crm;
    }

    public void setCrm(Crm crm) {
        this.crm = crm;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Runs getRuns() {
        return runs;
    }

    public void setRuns(Runs runs) {
        this.runs = runs;
    }

    public Ops getOps() {
        return ops;
    }

    public void setOps(Ops ops) {
        this.ops = ops;
    }

    public Targets getTargets() {
        return targets;
    }

    public void setTargets(Targets targets) {
        this.targets = targets;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Http {
        private String userAgent;
        private int defaultTimeoutSeconds = 30;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getDefaultTimeoutSeconds() {
            return Math.max(1, defaultTimeoutSeconds);
        }

        public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
            this.defaultTimeoutSeconds = Math.max(1, defaultTimeoutSeconds);
        }
    }

    public static class Browser {
        private boolean headless = true;

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }
    }

    public static class Upsert {
        private String defaultPhoneRegion;
        private HashMatchPolicy hashMatchPolicy = HashMatchPolicy.GLOBAL;

        public String getDefaultPhoneRegion() {
            if (defaultPhoneRegion == null || defaultPhoneRegion.isBlank()) {
                return null;
            }
            return defaultPhoneRegion.trim();
        }

        public void setDefaultPhoneRegion(String defaultPhoneRegion) {
            this.defaultPhoneRegion = defaultPhoneRegion;
        }

        public HashMatchPolicy getHashMatchPolicy() {
            return hashMatchPolicy == null ? HashMatchPolicy.GLOBAL : hashMatchPolicy;
        }

        public void setHashMatchPolicy(HashMatchPolicy hashMatchPolicy) {
            this.hashMatchPolicy = hashMatchPolicy;
        }
    }

    public static class Crm {
        private boolean enabled = false;
        private String baseUrl;
        private String token;
        private int timeoutSeconds = 20;
        private String createPath = "/api/leads";
        private String updatePath = "/api/leads/{id}";
        private int maxAttempts = 8;
        private int sweepBatchSize = 100;
        private Map<String, String> defaults = new LinkedHashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public String getCreatePath() {
            return createPath;
        }

        public void setCreatePath(String createPath) {
            this.createPath = createPath;
        }

        public String getUpdatePath() {
            return updatePath;
        }

        public void setUpdatePath(String updatePath) {
            this.updatePath = updatePath;
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getSweepBatchSize() {
            return Math.max(1, sweepBatchSize);
        }

        public void setSweepBatchSize(int sweepBatchSize) {
            this.sweepBatchSize = Math.max(1, sweepBatchSize);
        }

        public Map<String, String> getDefaults() {
            return defaults;
        }

        public void setDefaults(Map<String, String> defaults) {
            this.defaults = defaults == null ? new LinkedHashMap<>() : defaults;
        }
    }

    public static class Jobs {
        private int workerCount = 4;

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }
    }

    public static class Scheduler {
        private boolean enabled = false;
        private int tickSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTickSeconds() {
            return Math.max(5, tickSeconds);
        }

        public void setTickSeconds(int tickSeconds) {
            this.tickSeconds = Math.max(5, tickSeconds);
        }
    }

    public static class Runs {
        private int staleRunMinutes = 120;

        public int getStaleRunMinutes() {
            return Math.max(1, staleRunMinutes);
        }

        public void setStaleRunMinutes(int staleRunMinutes) {
            this.staleRunMinutes = Math.max(1, staleRunMinutes);
        }
    }

    public static class Ops {
        private String token;

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }
    }

    public static class Targets {
        private String importFile;
        private boolean updateExisting = false;

        public String getImportFile() {
            if (importFile == null || importFile.isBlank()) {
                return null;
            }
            return importFile.trim();
        }

        public void setImportFile(String importFile) {
            this.importFile = importFile;
        }

        public boolean isUpdateExisting() {
            return updateExisting;
        }

        public void setUpdateExisting(boolean updateExisting) {
            this.updateExisting = updateExisting;
        }
    }

    public static class Enrichment {
        private int maxRecords = 50;
        private long delayMillis = 2000;

        public int getMaxRecords() {
            return Math.max(1, maxRecords);
        }

        public void setMaxRecords(int maxRecords) {
            this.maxRecords = Math.max(1, maxRecords);
        }

        public long getDelayMillis() {
            return Math.max(0L, delayMillis);
        }

        public void setDelayMillis(long delayMillis) {
            this.delayMillis = Math.max(0L, delayMillis);
        }
    }
}
