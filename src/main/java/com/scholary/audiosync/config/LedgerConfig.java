package com.scholary.audiosync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiosync.exception.StorageException;
import com.scholary.audiosync.ledger.FingerprintLedger;
import com.scholary.audiosync.ledger.JdbcFingerprintLedger;
import com.scholary.audiosync.ledger.LedgerProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * Configuration for the sync ledger.
 *
 * <p>The ledger is a single SQLite file. Spring Boot's JDBC auto-configuration builds the
 * JdbcTemplate and transaction manager on top of the data source declared here.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(LedgerConfig.class);

  @Bean
  public DataSource ledgerDataSource(LedgerProperties properties) {
    Path dbFile = PathExpander.expand(properties.path()).toAbsolutePath();
    try {
      Path parent = dbFile.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
    } catch (IOException e) {
      String message = String.format("Cannot create ledger directory for %s", dbFile);
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }

    SQLiteConfig config = new SQLiteConfig();
    config.setBusyTimeout(properties.busyTimeoutMs());
    config.setJournalMode(SQLiteConfig.JournalMode.WAL);

    SQLiteDataSource dataSource = new SQLiteDataSource(config);
    dataSource.setUrl("jdbc:sqlite:" + dbFile);
    LOGGER.info(
        "Ledger data source: file={}, busyTimeoutMs={}", dbFile, properties.busyTimeoutMs());
    return dataSource;
  }

  @Bean
  public FingerprintLedger fingerprintLedger(
      JdbcTemplate jdbcTemplate,
      TransactionTemplate transactionTemplate,
      ObjectMapper objectMapper,
      LedgerProperties properties,
      Clock clock) {
    return new JdbcFingerprintLedger(
        jdbcTemplate, transactionTemplate, objectMapper, properties, clock);
  }
}
