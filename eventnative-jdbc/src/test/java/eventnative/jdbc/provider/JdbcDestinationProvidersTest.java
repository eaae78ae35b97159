package eventnative.jdbc.provider;

import eventnative.RawEvent;
import eventnative.delivery.BackoffPolicy;
import eventnative.delivery.BatchStorageProxy;
import eventnative.delivery.DeliveryContext;
import eventnative.delivery.DeliverySettings;
import eventnative.enrichment.EnrichmentRules;
import eventnative.enrichment.GeoResolver;
import eventnative.enrichment.UserAgentResolver;
import eventnative.jdbc.JdbcDestinationAdapter;
import eventnative.jdbc.dialect.H2Dialect;
import eventnative.jdbc.dialect.RedshiftDialect;
import eventnative.outcome.DeliveryStatus;
import eventnative.outcome.OutcomeCache;
import eventnative.storage.DataLayout;
import eventnative.storage.DestinationConfig;
import eventnative.storage.DestinationConfigException;
import eventnative.storage.DestinationFactory;
import eventnative.storage.DestinationRegistry;
import eventnative.storage.DestinationSpec;
import eventnative.storage.DestinationTypes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDestinationProvidersTest {

  @TempDir
  Path dir;

  private final OutcomeCache outcomes = new OutcomeCache();
  private String url;
  private Connection keepAlive;

  @BeforeEach
  void setUp() throws Exception {
    url = "jdbc:h2:mem:providers_" + System.nanoTime() + ";DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE";
    keepAlive = DriverManager.getConnection(url);
    try (Statement st = keepAlive.createStatement()) {
      st.execute("CREATE TABLE events (eventn_ctx_event_id VARCHAR(64) PRIMARY KEY, amount BIGINT)");
    }
  }

  @AfterEach
  void tearDown() throws Exception {
    keepAlive.close();
  }

  private DestinationFactory factory() {
    DeliverySettings settings = DeliverySettings.builder()
        .maxAttempts(2)
        .backoff(BackoffPolicy.NONE)
        .batchSize(10)
        .bufferCapacity(100)
        .build();
    return DestinationFactory.builder()
        .logEventPath(dir)
        .registry(DestinationRegistry.discover(getClass().getClassLoader()))
        .enrichmentRules(new EnrichmentRules(GeoResolver.NOOP, UserAgentResolver.NOOP))
        .context(DeliveryContext.of(outcomes, settings))
        .build();
  }

  private static DestinationConfig config(String type, Map<String, String> parameters) {
    DestinationConfig config = new DestinationConfig();
    config.setType(type);
    config.setParameters(parameters);
    return config;
  }

  @Test
  void serviceLoaderContributesJdbcTypes() {
    Set<String> types = DestinationRegistry.discover(getClass().getClassLoader()).types();
    assertTrue(types.containsAll(Set.of(DestinationTypes.POSTGRES, DestinationTypes.REDSHIFT,
        DestinationTypes.JDBC)), types.toString());
  }

  @Test
  void jdbcDestinationDeliversBatchIntoH2() throws Exception {
    DestinationConfig config = config(DestinationTypes.JDBC, Map.of("url", url, "max_pool_size", "2"));
    DataLayout layout = new DataLayout();
    layout.setPrimaryKeyFields(List.of("eventn_ctx/event_id"));
    config.setDataLayout(layout);

    try (BatchStorageProxy proxy = (BatchStorageProxy) factory().create("local", config)) {
      proxy.consume(RawEvent.of("t", Map.of("eventn_ctx", Map.of("event_id", "e1"), "amount", 3)));
      proxy.consume(RawEvent.of("t", Map.of("eventn_ctx", Map.of("event_id", "e1"), "amount", 4)));
      proxy.consume(RawEvent.of("t", Map.of("eventn_ctx", Map.of("event_id", "e2"), "amount", 5)));
      proxy.flush();
    }

    assertEquals(DeliveryStatus.SUCCESS, outcomes.lookup("local", "e2").get().status());
    try (Statement st = keepAlive.createStatement();
         ResultSet rs = st.executeQuery("SELECT amount FROM events ORDER BY eventn_ctx_event_id")) {
      assertTrue(rs.next());
      assertEquals(4L, rs.getLong(1));
      assertTrue(rs.next());
      assertEquals(5L, rs.getLong(1));
      assertFalse(rs.next());
    }
  }

  @Test
  void missingTableFailsPermanentlyAfterOneAttempt() throws Exception {
    DestinationConfig config = config(DestinationTypes.JDBC, Map.of("url", url));
    DataLayout layout = new DataLayout();
    layout.setTableNameTemplate("no_such_table");
    config.setDataLayout(layout);

    try (BatchStorageProxy proxy = (BatchStorageProxy) factory().create("local", config)) {
      proxy.consume(RawEvent.of("t", "e1", Map.of("amount", 1)));
      proxy.flush();
    }

    assertEquals(DeliveryStatus.PERMANENT_ERROR, outcomes.lookup("local", "e1").get().status());
    assertEquals(0, outcomes.lookup("local", "e1").get().retries());
  }

  @Test
  void dialectParameterOverridesDetection() throws Exception {
    DestinationSpec spec = factory().resolve("local",
        config(DestinationTypes.JDBC, Map.of("url", url, "dialect", "redshift")));

    try (JdbcDestinationAdapter adapter =
             (JdbcDestinationAdapter) new JdbcDestinationProvider().create(spec)) {
      assertInstanceOf(RedshiftDialect.class, adapter.dialect());
    }
    try (JdbcDestinationAdapter adapter = (JdbcDestinationAdapter) new JdbcDestinationProvider()
        .create(factory().resolve("local", config(DestinationTypes.JDBC, Map.of("url", url))))) {
      assertInstanceOf(H2Dialect.class, adapter.dialect());
    }
  }

  @Test
  void postgresWithoutConnectionParametersFailsAtInit() {
    DestinationConfigException ex = assertThrows(DestinationConfigException.class,
        () -> factory().create("pg", config(DestinationTypes.POSTGRES, Map.of())));

    assertEquals(DestinationConfigException.Kind.ADAPTER_INIT, ex.kind());
    assertTrue(ex.getMessage().contains("'host'"), ex.getMessage());
  }

  @Test
  void jdbcUrlIsBuiltFromHostAndDatabase() {
    DestinationSpec spec = factory().resolve("rs",
        config(DestinationTypes.REDSHIFT, Map.of("host", "cluster.local", "db", "dev")));

    assertEquals("jdbc:postgresql://cluster.local:5439/dev",
        new RedshiftDestinationProvider().jdbcUrl(spec));
    assertEquals("jdbc:postgresql://cluster.local:5432/dev",
        new PostgresDestinationProvider().jdbcUrl(spec));
  }
}
