/**
 * Backoff policies shared by the judge client and the outbox dispatcher.
 */
package io.recall.retry;
