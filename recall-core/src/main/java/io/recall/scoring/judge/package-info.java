/**
 * Model-as-judge scoring: prompts, reply parsing, retries and the issue classifier.
 */
package io.recall.scoring.judge;
