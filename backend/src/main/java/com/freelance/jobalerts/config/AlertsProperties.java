package com.freelance.jobalerts.config;

import com.freelance.jobalerts.pipeline.model.KeyScope;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "alerts")
public class AlertsProperties {
    private Worker worker = new Worker();
    private Delivery delivery = new Delivery();
    private Telegram telegram = new Telegram();
    private Http http = new Http();
    private Stats stats = new Stats();
    private Map<String, Source> sources = new LinkedHashMap<>();

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public void setDelivery(Delivery delivery) {
        this.delivery = delivery;
    }

    public Telegram getTelegram() {
        return telegram;
    }

    public void setTelegram(Telegram telegram) {
        this.telegram = telegram;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Stats getStats() {
        return stats;
    }

    public void setStats(Stats stats) {
        this.stats = stats;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources == null ? new LinkedHashMap<>() : sources;
    }

    public Source source(String sourceId) {
        Source source = sources.get(sourceId);
        return source == null ? new Source() : source;
    }

    public static class Worker {
        private boolean enabled = true;
        private int intervalSeconds = 120;
        private int sourceTimeoutSeconds = 60;
        private long leaseTtlSeconds = 900;
        private int shutdownGraceSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalSeconds() {
            return Math.max(1, intervalSeconds);
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = Math.max(1, intervalSeconds);
        }

        public int getSourceTimeoutSeconds() {
            return Math.max(1, sourceTimeoutSeconds);
        }

        public void setSourceTimeoutSeconds(int sourceTimeoutSeconds) {
            this.sourceTimeoutSeconds = Math.max(1, sourceTimeoutSeconds);
        }

        public long getLeaseTtlSeconds() {
            return Math.max(30, leaseTtlSeconds);
        }

        public void setLeaseTtlSeconds(long leaseTtlSeconds) {
            this.leaseTtlSeconds = Math.max(30, leaseTtlSeconds);
        }

        public int getShutdownGraceSeconds() {
            return Math.max(0, shutdownGraceSeconds);
        }

        public void setShutdownGraceSeconds(int shutdownGraceSeconds) {
            this.shutdownGraceSeconds = Math.max(0, shutdownGraceSeconds);
        }
    }

    public static class Delivery {
        private KeyScope keyScope = KeyScope.RECIPIENT;
        private long minSendIntervalMs = 500;
        private int maxRetryAfterSeconds = 60;
        private int maxMessagesPerRecipient = 10;
        private int descriptionMaxChars = 400;
        private int titleMaxChars = 200;
        private int freshWindowHours = 48;
        private int maxQueryKeywords = 50;

        public KeyScope getKeyScope() {
            return keyScope;
        }

        public void setKeyScope(KeyScope keyScope) {
            this.keyScope = keyScope == null ? KeyScope.RECIPIENT : keyScope;
        }

        public long getMinSendIntervalMs() {
            return Math.max(0, minSendIntervalMs);
        }

        public void setMinSendIntervalMs(long minSendIntervalMs) {
            this.minSendIntervalMs = Math.max(0, minSendIntervalMs);
        }

        public int getMaxRetryAfterSeconds() {
            return Math.max(0, maxRetryAfterSeconds);
        }

        public void setMaxRetryAfterSeconds(int maxRetryAfterSeconds) {
            this.maxRetryAfterSeconds = Math.max(0, maxRetryAfterSeconds);
        }

        public int getMaxMessagesPerRecipient() {
            return Math.max(1, maxMessagesPerRecipient);
        }

        public void setMaxMessagesPerRecipient(int maxMessagesPerRecipient) {
            this.maxMessagesPerRecipient = Math.max(1, maxMessagesPerRecipient);
        }

        public int getDescriptionMaxChars() {
            return Math.max(20, descriptionMaxChars);
        }

        public void setDescriptionMaxChars(int descriptionMaxChars) {
            this.descriptionMaxChars = Math.max(20, descriptionMaxChars);
        }

        public int getTitleMaxChars() {
            return Math.max(20, titleMaxChars);
        }

        public void setTitleMaxChars(int titleMaxChars) {
            this.titleMaxChars = Math.max(20, titleMaxChars);
        }

        public int getFreshWindowHours() {
            return Math.max(1, freshWindowHours);
        }

        public void setFreshWindowHours(int freshWindowHours) {
            this.freshWindowHours = Math.max(1, freshWindowHours);
        }

        public int getMaxQueryKeywords() {
            return Math.max(1, maxQueryKeywords);
        }

        public void setMaxQueryKeywords(int maxQueryKeywords) {
            this.maxQueryKeywords = Math.max(1, maxQueryKeywords);
        }
    }

    public static class Telegram {
        private static final String DEFAULT_API_BASE_URL = "https://api.telegram.org";

        private String botToken;
        private String apiBaseUrl = DEFAULT_API_BASE_URL;
        private int requestTimeoutSeconds = 15;

        public String getBotToken() {
            return botToken == null ? "" : botToken.trim();
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }

        public boolean hasBotToken() {
            return !getBotToken().isEmpty();
        }

        public String getApiBaseUrl() {
            if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
                return DEFAULT_API_BASE_URL;
            }
            String trimmed = apiBaseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Http {
        private static final String DEFAULT_USER_AGENT = "freelance-job-alerts/0.1 (+contact)";

        private String userAgent;
        private int requestTimeoutSeconds = 20;
        private int maxRetries = 2;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 5000;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
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

        public static String normalizeUserAgent(String candidate) {
            if (candidate == null || candidate.isBlank()) {
                return DEFAULT_USER_AGENT;
            }
            return candidate.trim();
        }
    }

    public static class Stats {
        private String filePath;

        public String getFilePath() {
            return filePath == null ? "" : filePath.trim();
        }

        public void setFilePath(String filePath) {
            this.filePath = filePath;
        }
    }

    public static class Source {
        private boolean enabled = true;
        private String url;
        private int maxItems = 30;
        private int intervalSeconds;
        private String affiliatePrefix;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public int getMaxItems() {
            return Math.max(1, maxItems);
        }

        public void setMaxItems(int maxItems) {
            this.maxItems = Math.max(1, maxItems);
        }

        public int getIntervalSeconds() {
            return Math.max(0, intervalSeconds);
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = Math.max(0, intervalSeconds);
        }

        public String getAffiliatePrefix() {
            return affiliatePrefix == null || affiliatePrefix.isBlank() ? null : affiliatePrefix.trim();
        }

        public void setAffiliatePrefix(String affiliatePrefix) {
            this.affiliatePrefix = affiliatePrefix;
        }
    }
}
