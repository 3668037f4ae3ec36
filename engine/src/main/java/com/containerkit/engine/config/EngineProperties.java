package com.containerkit.engine.config;

import com.containerkit.engine.comm.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine tuning, bound from {@code engine.*} in application.yml.
 */
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private final Orchestrator   orchestrator   = new Orchestrator();
    private final Jobs           jobs           = new Jobs();
    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final Communication  communication  = new Communication();
    private final Events         events         = new Events();

    public Orchestrator   getOrchestrator()   { return orchestrator; }
    public Jobs           getJobs()           { return jobs; }
    public CircuitBreaker getCircuitBreaker() { return circuitBreaker; }
    public Communication  getCommunication()  { return communication; }
    public Events         getEvents()         { return events; }

    public static class Orchestrator {
        // Applied when the caller's context has no deadline.
        private Duration defaultTimeout = Duration.ofMinutes(10);
        private int      executorThreads = 32;

        public Duration getDefaultTimeout()           { return defaultTimeout; }
        public void     setDefaultTimeout(Duration v) { this.defaultTimeout = v; }
        public int      getExecutorThreads()          { return executorThreads; }
        public void     setExecutorThreads(int v)     { this.executorThreads = v; }
    }

    public static class Jobs {
        private int      workers             = 4;
        private int      queueCapacity       = 100;
        private Duration jobTimeout          = Duration.ofMinutes(30);
        private int      maxRetainedTerminal = 1000;
        // Job type wire value ("analysis", "build", "deploy") -> backing tool name.
        private Map<String, String> tools = new LinkedHashMap<>();

        public int      getWorkers()                    { return workers; }
        public void     setWorkers(int v)               { this.workers = v; }
        public int      getQueueCapacity()              { return queueCapacity; }
        public void     setQueueCapacity(int v)         { this.queueCapacity = v; }
        public Duration getJobTimeout()                 { return jobTimeout; }
        public void     setJobTimeout(Duration v)       { this.jobTimeout = v; }
        public int      getMaxRetainedTerminal()        { return maxRetainedTerminal; }
        public void     setMaxRetainedTerminal(int v)   { this.maxRetainedTerminal = v; }
        public Map<String, String> getTools()           { return tools; }
        public void     setTools(Map<String, String> v) { this.tools = v; }
    }

    public static class CircuitBreaker {
        private int      maxFailures  = 5;
        private Duration resetTimeout = Duration.ofSeconds(60);
        private long     maxBreakers  = 1024;

        public int      getMaxFailures()            { return maxFailures; }
        public void     setMaxFailures(int v)       { this.maxFailures = v; }
        public Duration getResetTimeout()           { return resetTimeout; }
        public void     setResetTimeout(Duration v) { this.resetTimeout = v; }
        public long     getMaxBreakers()            { return maxBreakers; }
        public void     setMaxBreakers(long v)      { this.maxBreakers = v; }
    }

    public static class Communication {
        private int          maxRetries        = 3;
        private Duration     baseDelay         = Duration.ofMillis(100);
        private List<String> retryablePatterns = new ArrayList<>(RetryPolicy.DEFAULT_PATTERNS);
        private int          latencyWindow     = 100;
        private long         maxCorrelations   = 10_000;
        private Duration     correlationTtl    = Duration.ofHours(1);
        private long         maxTrackedTools   = 1024;

        public int          getMaxRetries()                    { return maxRetries; }
        public void         setMaxRetries(int v)               { this.maxRetries = v; }
        public Duration     getBaseDelay()                     { return baseDelay; }
        public void         setBaseDelay(Duration v)           { this.baseDelay = v; }
        public List<String> getRetryablePatterns()             { return retryablePatterns; }
        public void         setRetryablePatterns(List<String> v) { this.retryablePatterns = v; }
        public int          getLatencyWindow()                 { return latencyWindow; }
        public void         setLatencyWindow(int v)            { this.latencyWindow = v; }
        public long         getMaxCorrelations()               { return maxCorrelations; }
        public void         setMaxCorrelations(long v)         { this.maxCorrelations = v; }
        public Duration     getCorrelationTtl()                { return correlationTtl; }
        public void         setCorrelationTtl(Duration v)      { this.correlationTtl = v; }
        public long         getMaxTrackedTools()               { return maxTrackedTools; }
        public void         setMaxTrackedTools(long v)         { this.maxTrackedTools = v; }

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(maxRetries, baseDelay, retryablePatterns);
        }
    }

    public static class Events {
        private int      workers        = 4;
        private int      bufferSize     = 1000;
        private int      maxHistory     = 1000;
        private Duration handlerTimeout = Duration.ofSeconds(30);
        private String   source         = "engine";

        public int      getWorkers()                  { return workers; }
        public void     setWorkers(int v)             { this.workers = v; }
        public int      getBufferSize()               { return bufferSize; }
        public void     setBufferSize(int v)          { this.bufferSize = v; }
        public int      getMaxHistory()               { return maxHistory; }
        public void     setMaxHistory(int v)          { this.maxHistory = v; }
        public Duration getHandlerTimeout()           { return handlerTimeout; }
        public void     setHandlerTimeout(Duration v) { this.handlerTimeout = v; }
        public String   getSource()                   { return source; }
        public void     setSource(String v)           { this.source = v; }
    }
}
