/**
 * Service provider interfaces: stores, transaction context, judge model, graph sink and
 * metrics. Implementations live in the {@code recall-jdbc}, {@code recall-langchain4j},
 * {@code recall-neo4j} and {@code recall-micrometer} modules.
 */
package io.recall.spi;
