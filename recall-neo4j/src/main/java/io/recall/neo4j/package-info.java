/**
 * Neo4j graph sink for the outbox dispatcher.
 */
package io.recall.neo4j;
