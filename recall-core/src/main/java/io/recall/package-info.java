/**
 * Shared error taxonomy for the recall pipelines.
 *
 * <p>The scoring pipeline lives in {@link io.recall.scoring}; the graph outbox in
 * {@link io.recall.outbox}. Pluggable collaborators are declared in {@link io.recall.spi}.
 */
package io.recall;
