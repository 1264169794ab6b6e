package com.example.mailagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the mail agent engine and its integrations.
 */
@ConfigurationProperties(prefix = "mailagent")
public class MailAgentProperties {

    private final Retry retry = new Retry();
    private final Priority priority = new Priority();
    private final Digest digest = new Digest();
    private final Recovery recovery = new Recovery();
    private final Worker worker = new Worker();
    private final Mattermost mattermost = new Mattermost();
    private final Gmail gmail = new Gmail();
    private final Llm llm = new Llm();

    public Retry getRetry() {
        return retry;
    }

    public Priority getPriority() {
        return priority;
    }

    public Digest getDigest() {
        return digest;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public Worker getWorker() {
        return worker;
    }

    public Mattermost getMattermost() {
        return mattermost;
    }

    public Gmail getGmail() {
        return gmail;
    }

    public Llm getLlm() {
        return llm;
    }

    public static class Retry {
        /**
         * Total attempts per port call, the first one included.
         */
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(16);
        private double multiplier = 2.0;
        /**
         * Upper bound for a single port call. Hitting it counts as a transient failure.
         */
        private Duration callTimeout = Duration.ofSeconds(30);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }
    }

    public static class Priority {
        /**
         * Scores at or above the threshold are notified immediately.
         */
        private int threshold = 70;
        private int governmentBoost = 50;
        private int keywordBoost = 30;
        private int senderBoost = 40;
        private List<String> governmentDomains = new ArrayList<>(List.of(
                "finanzamt.de", "auslaenderbehoerde.de", "arbeitsagentur.de",
                "bundesagentur.de", "bmf.de", "bmi.de"));
        private List<String> urgentKeywords = new ArrayList<>(List.of(
                "urgent", "deadline", "immediate", "asap", "action required",
                "wichtig", "dringend", "frist", "eilig", "sofort",
                "срочно", "важно", "крайний срок",
                "терміново", "важливо", "дедлайн"));

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }

        public int getGovernmentBoost() {
            return governmentBoost;
        }

        public void setGovernmentBoost(int governmentBoost) {
            this.governmentBoost = governmentBoost;
        }

        public int getKeywordBoost() {
            return keywordBoost;
        }

        public void setKeywordBoost(int keywordBoost) {
            this.keywordBoost = keywordBoost;
        }

        public int getSenderBoost() {
            return senderBoost;
        }

        public void setSenderBoost(int senderBoost) {
            this.senderBoost = senderBoost;
        }

        public List<String> getGovernmentDomains() {
            return governmentDomains;
        }

        public void setGovernmentDomains(List<String> governmentDomains) {
            this.governmentDomains = governmentDomains;
        }

        public List<String> getUrgentKeywords() {
            return urgentKeywords;
        }

        public void setUrgentKeywords(List<String> urgentKeywords) {
            this.urgentKeywords = urgentKeywords;
        }
    }

    public static class Digest {
        /**
         * How often the scheduler checks which users are due for a digest.
         */
        private String cron = "0 */15 * * * *";
        private LocalTime defaultBatchTime = LocalTime.of(18, 0);
        private String defaultZone = "UTC";

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public LocalTime getDefaultBatchTime() {
            return defaultBatchTime;
        }

        public void setDefaultBatchTime(LocalTime defaultBatchTime) {
            this.defaultBatchTime = defaultBatchTime;
        }

        public String getDefaultZone() {
            return defaultZone;
        }

        public void setDefaultZone(String defaultZone) {
            this.defaultZone = defaultZone;
        }
    }

    public static class Recovery {
        private boolean onStartup = true;
        private Duration sweepDelay = Duration.ofMinutes(5);
        /**
         * Instances untouched for this long in a non-resting state are re-driven by the sweep.
         */
        private Duration staleAfter = Duration.ofMinutes(10);

        public boolean isOnStartup() {
            return onStartup;
        }

        public void setOnStartup(boolean onStartup) {
            this.onStartup = onStartup;
        }

        public Duration getSweepDelay() {
            return sweepDelay;
        }

        public void setSweepDelay(Duration sweepDelay) {
            this.sweepDelay = sweepDelay;
        }

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }
    }

    public static class Worker {
        private int threads = 4;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    public static class Mattermost {
        private String baseUrl = "http://localhost:8065/api/v4";
        private String token = "";
        /**
         * Public URL Mattermost posts interactive button clicks to.
         */
        private String callbackUrl = "http://localhost:8080/api/v1/approvals/mattermost";
        /**
         * Shared secret echoed back in every button context.
         */
        private String callbackToken = "";

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

        public String getCallbackUrl() {
            return callbackUrl;
        }

        public void setCallbackUrl(String callbackUrl) {
            this.callbackUrl = callbackUrl;
        }

        public String getCallbackToken() {
            return callbackToken;
        }

        public void setCallbackToken(String callbackToken) {
            this.callbackToken = callbackToken;
        }
    }

    public static class Gmail {
        private String baseUrl = "https://gmail.googleapis.com/gmail/v1/users/me";
        private String accessToken = "";
        /**
         * Domain used for the Message-ID of replies we send.
         */
        private String messageIdDomain = "mailagent.local";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getAccessToken() {
            return accessToken;
        }

        public void setAccessToken(String accessToken) {
            this.accessToken = accessToken;
        }

        public String getMessageIdDomain() {
            return messageIdDomain;
        }

        public void setMessageIdDomain(String messageIdDomain) {
            this.messageIdDomain = messageIdDomain;
        }
    }

    public static class Llm {
        private String baseUrl = "https://api.openai.com";
        private String apiKey = "";
        private String model = "gpt-4.1-mini";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }
}
