package io.recall.spring.boot;

import io.recall.neo4j.Neo4jGraphSink;
import io.recall.spi.GraphSink;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connects the Neo4j graph sink when {@code recall.graph.uri} is set.
 */
@AutoConfiguration(before = RecallAutoConfiguration.class)
@ConditionalOnClass(Neo4jGraphSink.class)
@ConditionalOnProperty(prefix = "recall.graph", name = "uri")
@EnableConfigurationProperties(RecallProperties.class)
public class RecallNeo4jAutoConfiguration {
  private static final Logger logger = Logger.getLogger(RecallNeo4jAutoConfiguration.class.getName());

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(GraphSink.class)
  public Neo4jGraphSink recallGraphSink(RecallProperties properties) {
    RecallProperties.Graph graph = properties.getGraph();
    Neo4jGraphSink sink = Neo4jGraphSink.connect(
        graph.getUri(), graph.getUsername(), graph.getPassword(), graph.getDatabase());
    if (graph.isEnsureConstraints()) {
      try {
        sink.ensureConstraints();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to create graph constraints at " + graph.getUri(), e);
      }
    }
    return sink;
  }
}
