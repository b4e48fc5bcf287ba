package io.recall.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the scoring loop, the judge, the graph outbox and the
 * Neo4j graph store.
 *
 * @see RecallAutoConfiguration
 */
@ConfigurationProperties(prefix = "recall")
public class RecallProperties {

  private final Scoring scoring = new Scoring();
  private final Judge judge = new Judge();
  private final Outbox outbox = new Outbox();
  private final Graph graph = new Graph();
  private final Metrics metrics = new Metrics();

  public Scoring getScoring() {
    return scoring;
  }

  public Judge getJudge() {
    return judge;
  }

  public Outbox getOutbox() {
    return outbox;
  }

  public Graph getGraph() {
    return graph;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Scoring {
    /**
     * Whether the background scoring loop runs.
     */
    private boolean enabled = true;
    private int batchSize = 20;
    private Duration processInterval = Duration.ofMinutes(30);
    /**
     * Delay before the first batch after startup.
     */
    private Duration warmUp = Duration.ofSeconds(45);
    /**
     * Pause after a failed batch.
     */
    private Duration errorCooldown = Duration.ofSeconds(60);
    private int maxConcurrency = 5;
    private boolean feedbackAdjustmentEnabled = true;
    /**
     * Score cache namespace. Change it when the rubric or judge model changes.
     */
    private String evaluatorVersion = "v1";
    /**
     * Overrides of the human feedback score per feedback type code, e.g. {@code like: 8} or
     * {@code not-helpful: 1}.
     */
    private Map<String, Double> feedbackScores = new LinkedHashMap<>();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public Duration getProcessInterval() {
      return processInterval;
    }

    public void setProcessInterval(Duration processInterval) {
      this.processInterval = processInterval;
    }

    public Duration getWarmUp() {
      return warmUp;
    }

    public void setWarmUp(Duration warmUp) {
      this.warmUp = warmUp;
    }

    public Duration getErrorCooldown() {
      return errorCooldown;
    }

    public void setErrorCooldown(Duration errorCooldown) {
      this.errorCooldown = errorCooldown;
    }

    public int getMaxConcurrency() {
      return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
    }

    public boolean isFeedbackAdjustmentEnabled() {
      return feedbackAdjustmentEnabled;
    }

    public void setFeedbackAdjustmentEnabled(boolean feedbackAdjustmentEnabled) {
      this.feedbackAdjustmentEnabled = feedbackAdjustmentEnabled;
    }

    public String getEvaluatorVersion() {
      return evaluatorVersion;
    }

    public void setEvaluatorVersion(String evaluatorVersion) {
      this.evaluatorVersion = evaluatorVersion;
    }

    public Map<String, Double> getFeedbackScores() {
      return feedbackScores;
    }

    public void setFeedbackScores(Map<String, Double> feedbackScores) {
      this.feedbackScores = feedbackScores;
    }
  }

  public static class Judge {
    private String model = "mistralai/mistral-small-3.2-24b-instruct";
    private String baseUrl = "https://openrouter.ai/api/v1";
    /**
     * API key of the OpenAI-compatible endpoint. Without it no judge is configured and
     * the scoring loop stays off.
     */
    private String apiKey;
    private Duration timeout = Duration.ofSeconds(60);
    private int maxAttempts = 3;
    private Duration backoffBase = Duration.ofMillis(800);
    private Duration backoffMax = Duration.ofSeconds(8);

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }

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

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBackoffBase() {
      return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
      this.backoffBase = backoffBase;
    }

    public Duration getBackoffMax() {
      return backoffMax;
    }

    public void setBackoffMax(Duration backoffMax) {
      this.backoffMax = backoffMax;
    }
  }

  public static class Outbox {
    /**
     * Whether the dispatcher runs. Writers are configured either way.
     */
    private boolean enabled = true;
    private String tableName = "graph_outbox";
    private int batchSize = 50;
    private Duration pollInterval = Duration.ofSeconds(5);
    private int maxAttempts = 10;
    /**
     * How long an event may stay processing before it is released back to pending.
     */
    private Duration processingTimeout = Duration.ofMinutes(5);
    private Duration stopTimeout = Duration.ofSeconds(5);
    private final Retry retry = new Retry();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getTableName() {
      return tableName;
    }

    public void setTableName(String tableName) {
      this.tableName = tableName;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getProcessingTimeout() {
      return processingTimeout;
    }

    public void setProcessingTimeout(Duration processingTimeout) {
      this.processingTimeout = processingTimeout;
    }

    public Duration getStopTimeout() {
      return stopTimeout;
    }

    public void setStopTimeout(Duration stopTimeout) {
      this.stopTimeout = stopTimeout;
    }

    public Retry getRetry() {
      return retry;
    }
  }

  public static class Retry {
    private Duration baseDelay = Duration.ofSeconds(1);
    private Duration maxDelay = Duration.ofSeconds(300);

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }
  }

  public static class Graph {
    /**
     * Bolt URI, e.g. {@code neo4j://localhost:7687}. Without it no graph sink is
     * configured and the dispatcher stays off.
     */
    private String uri;
    private String username;
    private String password;
    private String database = "neo4j";
    /**
     * Create the node uniqueness constraints at startup.
     */
    private boolean ensureConstraints = true;

    public String getUri() {
      return uri;
    }

    public void setUri(String uri) {
      this.uri = uri;
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

    public String getDatabase() {
      return database;
    }

    public void setDatabase(String database) {
      this.database = database;
    }

    public boolean isEnsureConstraints() {
      return ensureConstraints;
    }

    public void setEnsureConstraints(boolean ensureConstraints) {
      this.ensureConstraints = ensureConstraints;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "recall";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
