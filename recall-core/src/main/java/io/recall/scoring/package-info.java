/**
 * Background quality scoring of assistant messages: {@link io.recall.scoring.Evaluator}
 * and the {@link io.recall.scoring.ScoringLoop} that drives it.
 */
package io.recall.scoring;
