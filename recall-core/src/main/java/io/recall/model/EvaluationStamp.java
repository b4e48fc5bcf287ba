package io.recall.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata written next to a quality score: which model and evaluator version produced
 * it, and when.
 */
public record EvaluationStamp(String modelId, String evaluatorVersion, Instant evaluatedAt) {
  public EvaluationStamp {
    Objects.requireNonNull(modelId, "modelId");
    Objects.requireNonNull(evaluatorVersion, "evaluatorVersion");
    Objects.requireNonNull(evaluatedAt, "evaluatedAt");
  }
}
