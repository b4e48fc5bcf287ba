package io.recall.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.recall.jdbc.store.JdbcOutboxStore;
import io.recall.jdbc.tx.JdbcTransactionManager;
import io.recall.jdbc.tx.ThreadLocalTxContext;
import io.recall.model.ConversationUpsert;
import io.recall.outbox.DispatchResult;
import io.recall.outbox.GraphSyncHandlers;
import io.recall.outbox.HandlerRegistry;
import io.recall.outbox.OutboxDispatcher;
import io.recall.outbox.OutboxWriter;
import io.recall.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private JdbcOutboxStore outboxStore;
  private DataSourceConnectionProvider connectionProvider;
  private ThreadLocalTxContext txContext;
  private JdbcTransactionManager txManager;

  @BeforeEach
  void setUp() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("recall-test-pool");
    hikariDs = new HikariDataSource(config);
    TestDatabases.applySchema(hikariDs, Dialect.H2);

    outboxStore = new JdbcOutboxStore();
    connectionProvider = new DataSourceConnectionProvider(hikariDs);
    txContext = new ThreadLocalTxContext();
    txManager = new JdbcTransactionManager(connectionProvider, txContext);
  }

  @AfterEach
  void tearDown() {
    hikariDs.close();
  }

  @Test
  void concurrentWritersAreDrainedByDispatcher() throws Exception {
    OutboxWriter writer = new OutboxWriter(txContext, outboxStore);
    ExecutorService pool = Executors.newFixedThreadPool(4);
    List<Future<String>> futures = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      String conversationId = "c" + i;
      futures.add(pool.submit(() -> txManager.inTransaction(
          () -> writer.append(new ConversationUpsert("u1", conversationId, "Title " + conversationId, null, null)))));
    }
    for (Future<String> future : futures) {
      future.get(10, TimeUnit.SECONDS);
    }
    pool.shutdown();
    assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

    RecordingGraphSink sink = new RecordingGraphSink();
    OutboxDispatcher dispatcher = OutboxDispatcher.builder()
        .connectionProvider(connectionProvider)
        .outboxStore(outboxStore)
        .handlerRegistry(GraphSyncHandlers.registerAll(new HandlerRegistry(), sink, JsonCodec.getDefault()))
        .batchSize(15)
        .build();

    int dispatched = 0;
    List<DispatchResult> batch;
    while (!(batch = dispatcher.dispatchOnce()).isEmpty()) {
      dispatched += batch.size();
    }

    assertEquals(40, dispatched);
    assertEquals(40, sink.conversations.size());
    assertEquals(40, TestDatabases.count(hikariDs, "SELECT COUNT(*) FROM graph_outbox WHERE status='done'"));
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }
}
