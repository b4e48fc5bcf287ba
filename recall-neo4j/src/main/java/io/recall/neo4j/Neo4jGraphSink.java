package io.recall.neo4j;

import io.recall.model.ConversationUpsert;
import io.recall.model.FeedbackUpsert;
import io.recall.model.MessageUpsert;
import io.recall.outbox.GraphSinkException;
import io.recall.spi.GraphSink;
import org.neo4j.driver.AuthToken;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Query;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Values;
import org.neo4j.driver.exceptions.Neo4jException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link GraphSink} writing to Neo4j. Every statement is a MERGE on the natural id, so
 * replaying an event leaves the graph unchanged.
 *
 * <p>Graph shape: {@code (User)-[:OWNS]->(Conversation)-[:HAS_MESSAGE]->(Message)},
 * {@code (Conversation)-[:HAS_TOPIC]->(Topic)-[:HAS_SUBTOPIC]->(SubTopic)} and
 * {@code (User)-[:GAVE_FEEDBACK {type, score, at}]->(Message)}.
 *
 * <p>Driver failures surface as {@link GraphSinkException} and are retried by the outbox
 * dispatcher.
 */
public final class Neo4jGraphSink implements GraphSink, AutoCloseable {
  private static final Logger logger = Logger.getLogger(Neo4jGraphSink.class.getName());

  static final List<String> CONSTRAINTS = List.of(
      "CREATE CONSTRAINT recall_user_id IF NOT EXISTS FOR (u:User) REQUIRE u.id IS UNIQUE",
      "CREATE CONSTRAINT recall_conversation_id IF NOT EXISTS FOR (c:Conversation) REQUIRE c.id IS UNIQUE",
      "CREATE CONSTRAINT recall_message_id IF NOT EXISTS FOR (m:Message) REQUIRE m.id IS UNIQUE",
      "CREATE CONSTRAINT recall_topic_name IF NOT EXISTS FOR (t:Topic) REQUIRE t.name IS UNIQUE",
      "CREATE CONSTRAINT recall_subtopic_name IF NOT EXISTS FOR (s:SubTopic) REQUIRE s.name IS UNIQUE");

  static final String UPSERT_CONVERSATION = """
      MERGE (u:User {id: $userId})
      MERGE (c:Conversation {id: $conversationId})
      ON CREATE SET c.title = $title, c.updated_at = $at
      ON MATCH SET c.title = CASE WHEN $title = '' THEN c.title ELSE $title END, c.updated_at = $at
      MERGE (u)-[:OWNS]->(c)
      WITH c
      OPTIONAL MATCH (c)-[r:HAS_TOPIC]->(:Topic)
      DELETE r
      WITH DISTINCT c
      FOREACH (_ IN CASE WHEN $topic IS NULL OR $topic = '' THEN [] ELSE [1] END |
        MERGE (t:Topic {name: $topic})
        MERGE (c)-[:HAS_TOPIC]->(t)
        FOREACH (__ IN CASE WHEN $subTopic IS NULL OR $subTopic = '' THEN [] ELSE [1] END |
          MERGE (s:SubTopic {name: $subTopic})
          MERGE (t)-[:HAS_SUBTOPIC]->(s)))
      """;

  static final String UPSERT_MESSAGE = """
      MERGE (c:Conversation {id: $conversationId})
      MERGE (m:Message {id: $messageId})
      ON CREATE SET m.type = $messageType, m.created_at = $at
      MERGE (c)-[:HAS_MESSAGE]->(m)
      """;

  static final String UPSERT_FEEDBACK = """
      MERGE (u:User {id: $userId})
      MERGE (m:Message {id: $messageId})
      MERGE (u)-[f:GAVE_FEEDBACK]->(m)
      SET f.type = $feedbackType, f.score = $score, f.at = $at
      """;

  private final Driver driver;
  private final String database;
  private final boolean ownsDriver;

  /**
   * Uses an existing driver; {@link #close()} leaves it open.
   */
  public Neo4jGraphSink(Driver driver, String database) {
    this(driver, database, false);
  }

  private Neo4jGraphSink(Driver driver, String database, boolean ownsDriver) {
    this.driver = Objects.requireNonNull(driver, "driver");
    this.database = Objects.requireNonNull(database, "database");
    this.ownsDriver = ownsDriver;
  }

  /**
   * Opens a driver owned by the returned sink. Blank credentials connect without auth.
   */
  public static Neo4jGraphSink connect(String uri, String username, String password, String database) {
    AuthToken auth = username == null || username.isBlank()
        ? AuthTokens.none()
        : AuthTokens.basic(username, password);
    return new Neo4jGraphSink(GraphDatabase.driver(uri, auth), database, true);
  }

  /**
   * Creates the uniqueness constraints the MERGE statements rely on. Safe to call on every
   * start.
   */
  public void ensureConstraints() {
    for (String constraint : CONSTRAINTS) {
      write(new Query(constraint));
    }
    logger.info("Neo4j constraints ensured on database " + database);
  }

  @Override
  public void upsertConversation(ConversationUpsert conversation, Instant at) {
    write(conversationQuery(conversation, at));
  }

  @Override
  public void upsertMessage(MessageUpsert message, Instant at) {
    write(messageQuery(message, at));
  }

  @Override
  public void upsertFeedback(FeedbackUpsert feedback) {
    write(feedbackQuery(feedback));
  }

  static Query conversationQuery(ConversationUpsert conversation, Instant at) {
    return new Query(UPSERT_CONVERSATION, Values.parameters(
        "userId", conversation.userId(),
        "conversationId", conversation.conversationId(),
        "title", conversation.title(),
        "topic", conversation.topic(),
        "subTopic", conversation.subTopic(),
        "at", dateTime(at)));
  }

  static Query messageQuery(MessageUpsert message, Instant at) {
    return new Query(UPSERT_MESSAGE, Values.parameters(
        "conversationId", message.conversationId(),
        "messageId", message.messageId(),
        "messageType", message.messageType(),
        "at", dateTime(at)));
  }

  static Query feedbackQuery(FeedbackUpsert feedback) {
    return new Query(UPSERT_FEEDBACK, Values.parameters(
        "userId", feedback.userId(),
        "messageId", feedback.messageId(),
        "feedbackType", feedback.feedbackType(),
        "score", feedback.score(),
        "at", dateTime(feedback.at())));
  }

  private static OffsetDateTime dateTime(Instant at) {
    return at.atOffset(ZoneOffset.UTC);
  }

  private void write(Query query) {
    try (Session session = driver.session(SessionConfig.forDatabase(database))) {
      session.executeWrite(tx -> {
        tx.run(query).consume();
        return null;
      });
    } catch (Neo4jException e) {
      throw new GraphSinkException("Neo4j write failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    if (ownsDriver) {
      driver.close();
    }
  }
}
