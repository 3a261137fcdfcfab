package com.altrii.mdm.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mdm")
public class MdmProperties {

    /**
     * Shared secret expected in the X-Api-Key header of operator endpoints.
     */
    private String apiKey;

    /**
     * Public base URL devices use to reach the check-in and command endpoints.
     */
    private String serverUrl = "http://localhost:8080";

    /**
     * APNs topic of the MDM push certificate.
     */
    private String topic = "com.altriirecovery.mdm";

    /**
     * When false, enrolled devices are told to use the development APNs environment.
     */
    private boolean production = false;

    private StoreConfig store = new StoreConfig();

    private EnrollmentConfig enrollment = new EnrollmentConfig();

    private CommandConfig commands = new CommandConfig();

    private SigningConfig signing = new SigningConfig();

    private ApnsConfig apns = new ApnsConfig();

    private EntitlementConfig entitlement = new EntitlementConfig();

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public boolean isProduction() {
        return production;
    }

    public void setProduction(boolean production) {
        this.production = production;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store;
    }

    public EnrollmentConfig getEnrollment() {
        return enrollment;
    }

    public void setEnrollment(EnrollmentConfig enrollment) {
        this.enrollment = enrollment;
    }

    public CommandConfig getCommands() {
        return commands;
    }

    public void setCommands(CommandConfig commands) {
        this.commands = commands;
    }

    public SigningConfig getSigning() {
        return signing;
    }

    public void setSigning(SigningConfig signing) {
        this.signing = signing;
    }

    public ApnsConfig getApns() {
        return apns;
    }

    public void setApns(ApnsConfig apns) {
        this.apns = apns;
    }

    public EntitlementConfig getEntitlement() {
        return entitlement;
    }

    public void setEntitlement(EntitlementConfig entitlement) {
        this.entitlement = entitlement;
    }

    public static class StoreConfig {

        /**
         * memory (single instance) or redis (shared between instances)
         */
        private String type = "memory";

        private String redisKeyPrefix = "mdm:";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getRedisKeyPrefix() {
            return redisKeyPrefix;
        }

        public void setRedisKeyPrefix(String redisKeyPrefix) {
            this.redisKeyPrefix = redisKeyPrefix;
        }
    }

    public static class EnrollmentConfig {

        private Duration ticketTtl = Duration.ofHours(24);

        private int codeLength = 12;

        private String downloadFilename = "supervision.mobileconfig";

        public Duration getTicketTtl() {
            return ticketTtl;
        }

        public void setTicketTtl(Duration ticketTtl) {
            this.ticketTtl = ticketTtl;
        }

        public int getCodeLength() {
            return codeLength;
        }

        public void setCodeLength(int codeLength) {
            this.codeLength = codeLength;
        }

        public String getDownloadFilename() {
            return downloadFilename;
        }

        public void setDownloadFilename(String downloadFilename) {
            this.downloadFilename = downloadFilename;
        }
    }

    public static class CommandConfig {

        /**
         * Consecutive failed DeviceLock acknowledgements before an operator alert is raised.
         */
        private int deviceLockAlertThreshold = 3;

        public int getDeviceLockAlertThreshold() {
            return deviceLockAlertThreshold;
        }

        public void setDeviceLockAlertThreshold(int deviceLockAlertThreshold) {
            this.deviceLockAlertThreshold = deviceLockAlertThreshold;
        }
    }

    public static class SigningConfig {

        /**
         * PEM certificate of the profile signing identity. Profiles are served unsigned when absent.
         */
        private String certificatePath;

        private String keyPath;

        public String getCertificatePath() {
            return certificatePath;
        }

        public void setCertificatePath(String certificatePath) {
            this.certificatePath = certificatePath;
        }

        public String getKeyPath() {
            return keyPath;
        }

        public void setKeyPath(String keyPath) {
            this.keyPath = keyPath;
        }
    }

    public static class ApnsConfig {

        private boolean enabled = false;

        /**
         * Path of the .p8 token signing key issued by Apple.
         */
        private String keyPath;

        private String keyId;

        private String teamId;

        private String host = "https://api.sandbox.push.apple.com";

        private Duration tokenTtl = Duration.ofMinutes(50);

        private Duration requestTimeout = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getKeyPath() {
            return keyPath;
        }

        public void setKeyPath(String keyPath) {
            this.keyPath = keyPath;
        }

        public String getKeyId() {
            return keyId;
        }

        public void setKeyId(String keyId) {
            this.keyId = keyId;
        }

        public String getTeamId() {
            return teamId;
        }

        public void setTeamId(String teamId) {
            this.teamId = teamId;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public Duration getTokenTtl() {
            return tokenTtl;
        }

        public void setTokenTtl(Duration tokenTtl) {
            this.tokenTtl = tokenTtl;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class EntitlementConfig {

        /**
         * Tier assumed for every user until a billing-backed directory is wired in.
         */
        private String defaultTier = "PREMIUM";

        public String getDefaultTier() {
            return defaultTier;
        }

        public void setDefaultTier(String defaultTier) {
            this.defaultTier = defaultTier;
        }
    }
}
