package com.scholary.audiosync.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.scholary.audiosync.config.LedgerConfig;
import com.scholary.audiosync.ledger.JdbcFingerprintLedger;
import com.scholary.audiosync.ledger.LedgerProperties;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import javax.sql.DataSource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/** Builds a ledger on a SQLite file in a test's temp directory, wired like the application does. */
public final class LedgerFixtures {

  private LedgerFixtures() {}

  public static LedgerProperties properties(Path dir) {
    return new LedgerProperties(
        dir.resolve("sync.db").toString(), true, 5000, Duration.ofMinutes(5), 90);
  }

  public static JdbcFingerprintLedger open(Path dir, Clock clock) {
    return open(dir, clock, dataSource(dir));
  }

  public static DataSource dataSource(Path dir) {
    return new LedgerConfig().ledgerDataSource(properties(dir));
  }

  /** Opens the ledger on the given data source, which must point at {@code dir}'s database. */
  public static JdbcFingerprintLedger open(Path dir, Clock clock, DataSource dataSource) {
    LedgerProperties properties = properties(dir);
    ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
    return new JdbcFingerprintLedger(
        new JdbcTemplate(dataSource),
        new TransactionTemplate(new DataSourceTransactionManager(dataSource)),
        objectMapper,
        properties,
        clock);
  }
}
