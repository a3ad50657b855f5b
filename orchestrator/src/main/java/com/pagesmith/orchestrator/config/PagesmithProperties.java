package com.pagesmith.orchestrator.config;

import com.pagesmith.orchestrator.service.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * All tunables of the service, bound from {@code pagesmith.*}.
 *
 * Secrets (API key, GitHub token, shared secret) are expected to come from the
 * environment, e.g. {@code PAGESMITH_GITHUB_TOKEN}.
 */
@ConfigurationProperties(prefix = "pagesmith")
public class PagesmithProperties {

    private String secret = "";
    private String licenseHolder = "Pagesmith";

    private final Orchestrator orchestrator = new Orchestrator();
    private final Llm          llm          = new Llm();
    private final Github       github       = new Github();
    private final Callback     callback     = new Callback();

    public String getSecret()                 { return secret; }
    public void setSecret(String secret)      { this.secret = secret; }
    public String getLicenseHolder()          { return licenseHolder; }
    public void setLicenseHolder(String v)    { this.licenseHolder = v; }
    public Orchestrator getOrchestrator()     { return orchestrator; }
    public Llm getLlm()                       { return llm; }
    public Github getGithub()                 { return github; }
    public Callback getCallback()             { return callback; }

    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }

    // ------------------------------------------------------------------

    public static class Orchestrator {

        // Caps concurrent runs, and with them concurrent calls to the model and GitHub.
        private int maxConcurrentTasks = 4;

        private Duration budget = Duration.ofMinutes(5);

        public int getMaxConcurrentTasks()              { return maxConcurrentTasks; }
        public void setMaxConcurrentTasks(int v)        { this.maxConcurrentTasks = v; }
        public Duration getBudget()                     { return budget; }
        public void setBudget(Duration budget)          { this.budget = budget; }
    }

    public static class Llm {

        private String baseUrl = "https://aipipe.org/openai/v1";
        private String apiKey  = "";
        private String model   = "gpt-5-nano";
        private Duration timeout = Duration.ofSeconds(90);

        public String getBaseUrl()                { return baseUrl; }
        public void setBaseUrl(String baseUrl)    { this.baseUrl = baseUrl; }
        public String getApiKey()                 { return apiKey; }
        public void setApiKey(String apiKey)      { this.apiKey = apiKey; }
        public String getModel()                  { return model; }
        public void setModel(String model)        { this.model = model; }
        public Duration getTimeout()              { return timeout; }
        public void setTimeout(Duration timeout)  { this.timeout = timeout; }

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public static class Github {

        private String apiUrl   = "https://api.github.com";
        private String token    = "";
        private String username = "";
        private String branch   = "main";
        private String repoPrefix = "tds";
        private int maxNameAttempts = 5;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private final Retry retry = new Retry(3, Duration.ofMillis(500), 2.0, Duration.ofSeconds(8));

        public String getApiUrl()                     { return apiUrl; }
        public void setApiUrl(String apiUrl)          { this.apiUrl = apiUrl; }
        public String getToken()                      { return token; }
        public void setToken(String token)            { this.token = token; }
        public String getUsername()                   { return username; }
        public void setUsername(String username)      { this.username = username; }
        public String getBranch()                     { return branch; }
        public void setBranch(String branch)          { this.branch = branch; }
        public String getRepoPrefix()                 { return repoPrefix; }
        public void setRepoPrefix(String repoPrefix)  { this.repoPrefix = repoPrefix; }
        public int getMaxNameAttempts()               { return maxNameAttempts; }
        public void setMaxNameAttempts(int v)         { this.maxNameAttempts = v; }
        public Duration getRequestTimeout()           { return requestTimeout; }
        public void setRequestTimeout(Duration v)     { this.requestTimeout = v; }
        public Retry getRetry()                       { return retry; }

        public boolean isConfigured() {
            return token != null && !token.isBlank()
                && username != null && !username.isBlank();
        }
    }

    public static class Callback {

        private Duration timeout = Duration.ofSeconds(30);
        private final Retry retry = new Retry(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10));

        public Duration getTimeout()              { return timeout; }
        public void setTimeout(Duration timeout)  { this.timeout = timeout; }
        public Retry getRetry()                   { return retry; }
    }

    /** Capped exponential backoff settings; see {@link RetryPolicy}. */
    public static class Retry {

        private int maxAttempts;
        private Duration initialBackoff;
        private double multiplier;
        private Duration maxBackoff;

        public Retry() {
            this(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10));
        }

        public Retry(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
            this.maxAttempts    = maxAttempts;
            this.initialBackoff = initialBackoff;
            this.multiplier     = multiplier;
            this.maxBackoff     = maxBackoff;
        }

        public int getMaxAttempts()                   { return maxAttempts; }
        public void setMaxAttempts(int v)             { this.maxAttempts = v; }
        public Duration getInitialBackoff()           { return initialBackoff; }
        public void setInitialBackoff(Duration v)     { this.initialBackoff = v; }
        public double getMultiplier()                 { return multiplier; }
        public void setMultiplier(double v)           { this.multiplier = v; }
        public Duration getMaxBackoff()               { return maxBackoff; }
        public void setMaxBackoff(Duration v)         { this.maxBackoff = v; }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff);
        }
    }
}
