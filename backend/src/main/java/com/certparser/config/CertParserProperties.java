package com.certparser.config;

import com.certparser.railway.ErrorCode;
import com.certparser.railway.Result;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "cert-parser")
public class CertParserProperties {
    static final String DEFAULT_CRON = "0 */6 * * *";

    private boolean runOnStartup = true;
    private Auth auth = new Auth();
    private Login login = new Login();
    private Download download = new Download();
    private Scheduler scheduler = new Scheduler();
    private Http http = new Http();

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public Auth getAuth() {
        return auth;
    }

    public void setAuth(Auth auth) {
        this.auth = auth;
    }

    public Login getLogin() {
        return login;
    }

    public void setLogin(Login login) {
        this.login = login;
    }

    public Download getDownload() {
        return download;
    }

    public void setDownload(Download download) {
        this.download = download;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    /**
     * Checks that every upstream setting is present and the cron expression has five fields.
     * All problems are reported together.
     */
    public Result<CertParserProperties> validate() {
        List<String> missing = new ArrayList<>();
        require(missing, "auth.url", auth.getUrl());
        require(missing, "auth.client-id", auth.getClientId());
        require(missing, "auth.client-secret", auth.getClientSecret());
        require(missing, "auth.username", auth.getUsername());
        require(missing, "auth.password", auth.getPassword());
        require(missing, "login.url", login.getUrl());
        require(missing, "login.border-post-id", login.getBorderPostId());
        require(missing, "login.box-id", login.getBoxId());
        require(missing, "login.passenger-control-type", login.getPassengerControlType());
        require(missing, "download.url", download.getUrl());

        List<String> problems = new ArrayList<>();
        if (!missing.isEmpty()) {
            problems.add("missing cert-parser." + String.join(", cert-parser.", missing));
        }
        if (scheduler.getCron().trim().split("\\s+").length != 5) {
            problems.add("scheduler.cron must have five fields: '" + scheduler.getCron() + "'");
        }
        if (!problems.isEmpty()) {
            return Result.failure(ErrorCode.CONFIGURATION_ERROR, "Invalid configuration: " + String.join("; ", problems));
        }
        return Result.success(this);
    }

    private static void require(List<String> missing, String key, String value) {
        if (value == null || value.isBlank()) {
            missing.add(key);
        }
    }

    public static class Auth {
        private String url;
        private String clientId;
        private String clientSecret;
        private String username;
        private String password;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    public static class Login {
        private String url;
        private String borderPostId;
        private String boxId;
        private String passengerControlType;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getBorderPostId() {
            return borderPostId;
        }

        public void setBorderPostId(String borderPostId) {
            this.borderPostId = borderPostId;
        }

        public String getBoxId() {
            return boxId;
        }

        public void setBoxId(String boxId) {
            this.boxId = boxId;
        }

        public String getPassengerControlType() {
            return passengerControlType;
        }

        public void setPassengerControlType(String passengerControlType) {
            this.passengerControlType = passengerControlType;
        }
    }

    public static class Download {
        private String url;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private String cron = DEFAULT_CRON;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron == null || cron.isBlank() ? DEFAULT_CRON : cron.trim();
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        /**
         * Five-field cron expression in Spring's six-field form (seconds pinned to zero).
         */
        public String springCron() {
            return "0 " + getCron();
        }
    }

    public static class Http {
        private int timeoutSeconds = 60;
        private int maxAttempts = 3;
        private int retryBaseDelayMs = 100;
        private int retryMaxDelayMs = 30000;

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
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
    }
}
