package com.hubzone.designations.config;

import com.hubzone.designations.importer.model.DatasetFormat;
import com.hubzone.designations.importer.model.DesignationType;
import com.hubzone.designations.importer.reconcile.TieBreakRuleKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "importer")
public class ImportProperties {
    private static final String DEFAULT_USER_AGENT = "hubzone-designations/0.1 (+ops)";

    private String userAgent;
    private Cache cache = new Cache();
    private Fetch fetch = new Fetch();
    private Sources sources = new Sources();
    private Reconciliation reconciliation = new Reconciliation();
    private Job job = new Job();
    private Scheduler scheduler = new Scheduler();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Sources getSources() {
        return sources;
    }

    public void setSources(Sources sources) {
        this.sources = sources;
    }

    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    public void setReconciliation(Reconciliation reconciliation) {
        this.reconciliation = reconciliation;
    }

    public Job getJob() {
        return job;
    }

    public void setJob(Job job) {
        this.job = job;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Cache {
        private String directory = "./cache/hubzone-maps";
        private int ttlDays = 90;

        public String getDirectory() {
            return directory == null || directory.isBlank() ? "./cache/hubzone-maps" : directory.trim();
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public int getTtlDays() {
            return Math.max(1, ttlDays);
        }

        public void setTtlDays(int ttlDays) {
            this.ttlDays = Math.max(1, ttlDays);
        }
    }

    public static class Fetch {
        private int concurrency = 4;
        private int requestTimeoutSeconds = 60;
        private int maxAttempts = 3;
        private int retryBaseDelayMs = 1000;
        private int retryMaxDelayMs = 30000;
        private long maxBodyBytes = 256L * 1024 * 1024;
        private int perHostDelayMs = 250;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        public long getMaxBodyBytes() {
            return Math.max(1024L, maxBodyBytes);
        }

        public void setMaxBodyBytes(long maxBodyBytes) {
            this.maxBodyBytes = Math.max(1024L, maxBodyBytes);
        }

        public int getPerHostDelayMs() {
            return Math.max(1, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(1, perHostDelayMs);
        }
    }

    public static class Sources {
        private int vintageYear = 0;
        private String censusApiKey;
        private Source boundaries = new Source(DatasetFormat.GEOJSON);
        private Source designations = new Source(DatasetFormat.CSV);
        private Source economicProfiles = new Source(DatasetFormat.JSON_TABLE);

        public int getVintageYear() {
            return Math.max(0, vintageYear);
        }

        public void setVintageYear(int vintageYear) {
            this.vintageYear = Math.max(0, vintageYear);
        }

        public String getCensusApiKey() {
            return censusApiKey == null ? "" : censusApiKey.trim();
        }

        public void setCensusApiKey(String censusApiKey) {
            this.censusApiKey = censusApiKey;
        }

        public Source getBoundaries() {
            return boundaries;
        }

        public void setBoundaries(Source boundaries) {
            this.boundaries = boundaries;
        }

        public Source getDesignations() {
            return designations;
        }

        public void setDesignations(Source designations) {
            this.designations = designations;
        }

        public Source getEconomicProfiles() {
            return economicProfiles;
        }

        public void setEconomicProfiles(Source economicProfiles) {
            this.economicProfiles = economicProfiles;
        }
    }

    public static class Source {
        private String urlTemplate;
        private String checksumUrlTemplate;
        private DatasetFormat format;
        private List<String> fallbackUrlTemplates = new ArrayList<>();

        public Source() {
        }

        public Source(DatasetFormat format) {
            this.format = format;
        }

        public String getUrlTemplate() {
            return urlTemplate;
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }

        public String getChecksumUrlTemplate() {
            return checksumUrlTemplate;
        }

        public void setChecksumUrlTemplate(String checksumUrlTemplate) {
            this.checksumUrlTemplate = checksumUrlTemplate;
        }

        public DatasetFormat getFormat() {
            return format;
        }

        public void setFormat(DatasetFormat format) {
            this.format = format;
        }

        public List<String> getFallbackUrlTemplates() {
            return nonBlank(fallbackUrlTemplates);
        }

        public void setFallbackUrlTemplates(List<String> fallbackUrlTemplates) {
            this.fallbackUrlTemplates = fallbackUrlTemplates;
        }
    }

    public static class Reconciliation {
        private Integer gracePeriodMonths;
        private List<DesignationType> gracePeriodTypes = new ArrayList<>(List.of(
            DesignationType.QUALIFIED_CENSUS_TRACT,
            DesignationType.QUALIFIED_NON_METRO_COUNTY
        ));
        private List<TieBreakRuleKind> tieBreakRules = new ArrayList<>(List.of(
            TieBreakRuleKind.NO_EXPIRATION_FIRST,
            TieBreakRuleKind.INCUMBENT_TYPE_FIRST,
            TieBreakRuleKind.TYPE_PRECEDENCE
        ));
        private List<DesignationType> typePrecedence = new ArrayList<>();

        // No default; the deployment supplies the figure of the SBA rule in force.
        public int getGracePeriodMonths() {
            if (gracePeriodMonths == null || gracePeriodMonths <= 0) {
                throw new IllegalStateException(
                    "importer.reconciliation.grace-period-months must be configured with a positive value"
                );
            }
            return gracePeriodMonths;
        }

        public boolean isGracePeriodConfigured() {
            return gracePeriodMonths != null && gracePeriodMonths > 0;
        }

        public void setGracePeriodMonths(Integer gracePeriodMonths) {
            this.gracePeriodMonths = gracePeriodMonths;
        }

        public List<DesignationType> getGracePeriodTypes() {
            return gracePeriodTypes == null ? List.of() : gracePeriodTypes;
        }

        public void setGracePeriodTypes(List<DesignationType> gracePeriodTypes) {
            this.gracePeriodTypes = gracePeriodTypes;
        }

        public List<TieBreakRuleKind> getTieBreakRules() {
            return tieBreakRules == null ? List.of() : tieBreakRules;
        }

        public void setTieBreakRules(List<TieBreakRuleKind> tieBreakRules) {
            this.tieBreakRules = tieBreakRules;
        }

        public List<DesignationType> getTypePrecedence() {
            return typePrecedence == null ? List.of() : typePrecedence;
        }

        public void setTypePrecedence(List<DesignationType> typePrecedence) {
            this.typePrecedence = typePrecedence;
        }
    }

    public static class Job {
        private int timeoutMinutes = 120;
        private int maxRetries = 3;
        private long retryDelayMs = 60000;
        private int heartbeatSeconds = 30;
        private int leaseMinutes = 10;
        private int staleMinutes = 30;
        private int historyLimit = 20;
        private List<String> adminRecipients = new ArrayList<>();

        public int getTimeoutMinutes() {
            return Math.max(1, timeoutMinutes);
        }

        public void setTimeoutMinutes(int timeoutMinutes) {
            this.timeoutMinutes = Math.max(1, timeoutMinutes);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public long getRetryDelayMs() {
            return Math.max(0L, retryDelayMs);
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = Math.max(0L, retryDelayMs);
        }

        public int getHeartbeatSeconds() {
            return Math.max(1, heartbeatSeconds);
        }

        public void setHeartbeatSeconds(int heartbeatSeconds) {
            this.heartbeatSeconds = Math.max(1, heartbeatSeconds);
        }

        public int getLeaseMinutes() {
            return Math.max(1, leaseMinutes);
        }

        public void setLeaseMinutes(int leaseMinutes) {
            this.leaseMinutes = Math.max(1, leaseMinutes);
        }

        public int getStaleMinutes() {
            return Math.max(1, staleMinutes);
        }

        public void setStaleMinutes(int staleMinutes) {
            this.staleMinutes = Math.max(1, staleMinutes);
        }

        public int getHistoryLimit() {
            return Math.max(1, historyLimit);
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = Math.max(1, historyLimit);
        }

        public List<String> getAdminRecipients() {
            return nonBlank(adminRecipients);
        }

        public void setAdminRecipients(List<String> adminRecipients) {
            this.adminRecipients = adminRecipients;
        }
    }

    public static class Scheduler {
        private boolean enabled = false;
        private String zone = "UTC";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getZone() {
            return zone == null || zone.isBlank() ? "UTC" : zone.trim();
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class Cli {
        private boolean run = false;
        private boolean dryRun = false;
        private boolean skipNotifications = false;
        private String states = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isDryRun() {
            return dryRun;
        }

        public void setDryRun(boolean dryRun) {
            this.dryRun = dryRun;
        }

        public boolean isSkipNotifications() {
            return skipNotifications;
        }

        public void setSkipNotifications(boolean skipNotifications) {
            this.skipNotifications = skipNotifications;
        }

        public String getStates() {
            return states == null ? "" : states;
        }

        public void setStates(String states) {
            this.states = states;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(String::trim)
            .toList();
    }
}
