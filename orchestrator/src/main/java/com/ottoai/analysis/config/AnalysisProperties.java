package com.ottoai.analysis.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Settings under the {@code analysis.*} prefix.
 *
 * Retry and timeout bounds are policy, not constants: the external service's
 * redelivery window is not documented, so every bound here is overridable.
 */
@Configuration
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    private Service service = new Service();
    private Webhook webhook = new Webhook();
    private Jobs    jobs    = new Jobs();

    public Service getService()            { return service; }
    public void    setService(Service s)   { this.service = s; }
    public Webhook getWebhook()            { return webhook; }
    public void    setWebhook(Webhook w)   { this.webhook = w; }
    public Jobs    getJobs()               { return jobs; }
    public void    setJobs(Jobs j)         { this.jobs = j; }

    /** External analysis service endpoint. */
    public static class Service {
        private String   baseUrl        = "http://localhost:8090";
        private String   apiKey         = "";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String   getBaseUrl()                 { return baseUrl; }
        public void     setBaseUrl(String v)         { this.baseUrl = v; }
        public String   getApiKey()                  { return apiKey; }
        public void     setApiKey(String v)          { this.apiKey = v; }
        public Duration getConnectTimeout()          { return connectTimeout; }
        public void     setConnectTimeout(Duration v){ this.connectTimeout = v; }
        public Duration getRequestTimeout()          { return requestTimeout; }
        public void     setRequestTimeout(Duration v){ this.requestTimeout = v; }
    }

    /** Inbound completion webhook. */
    public static class Webhook {
        /** Shared HMAC secret. Blank rejects every webhook. */
        private String   secret             = "";
        private Duration signatureTolerance = Duration.ofMinutes(5);

        public String   getSecret()                      { return secret; }
        public void     setSecret(String v)              { this.secret = v; }
        public Duration getSignatureTolerance()          { return signatureTolerance; }
        public void     setSignatureTolerance(Duration v){ this.signatureTolerance = v; }
    }

    /** Job lifecycle policy. */
    public static class Jobs {
        private int      maxRetries         = 3;
        private Duration maxJobLifetime     = Duration.ofHours(24);
        private Duration pollInterval       = Duration.ofSeconds(30);
        /** A job is polled only if unchanged for at least this long. */
        private Duration minPollAge         = Duration.ofSeconds(15);
        private Duration supervisorInterval = Duration.ofSeconds(60);
        private Duration lockTtl            = Duration.ofSeconds(30);
        private Duration backoffBase        = Duration.ofSeconds(5);
        private Duration backoffMax         = Duration.ofMinutes(5);
        private int      sweepBatchSize     = 100;
        private int      pollerWorkers      = 4;

        public int      getMaxRetries()                   { return maxRetries; }
        public void     setMaxRetries(int v)              { this.maxRetries = v; }
        public Duration getMaxJobLifetime()               { return maxJobLifetime; }
        public void     setMaxJobLifetime(Duration v)     { this.maxJobLifetime = v; }
        public Duration getPollInterval()                 { return pollInterval; }
        public void     setPollInterval(Duration v)       { this.pollInterval = v; }
        public Duration getMinPollAge()                   { return minPollAge; }
        public void     setMinPollAge(Duration v)         { this.minPollAge = v; }
        public Duration getSupervisorInterval()           { return supervisorInterval; }
        public void     setSupervisorInterval(Duration v) { this.supervisorInterval = v; }
        public Duration getLockTtl()                      { return lockTtl; }
        public void     setLockTtl(Duration v)            { this.lockTtl = v; }
        public Duration getBackoffBase()                  { return backoffBase; }
        public void     setBackoffBase(Duration v)        { this.backoffBase = v; }
        public Duration getBackoffMax()                   { return backoffMax; }
        public void     setBackoffMax(Duration v)         { this.backoffMax = v; }
        public int      getSweepBatchSize()               { return sweepBatchSize; }
        public void     setSweepBatchSize(int v)          { this.sweepBatchSize = v; }
        public int      getPollerWorkers()                { return pollerWorkers; }
        public void     setPollerWorkers(int v)           { this.pollerWorkers = v; }
    }
}
