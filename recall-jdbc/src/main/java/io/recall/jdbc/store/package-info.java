/**
 * JDBC stores: the graph outbox, the score cache, and the scoring columns of chat messages.
 */
package io.recall.jdbc.store;
