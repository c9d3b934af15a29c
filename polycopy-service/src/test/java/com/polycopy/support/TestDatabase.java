package com.polycopy.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polycopy.ledger.Wallet;
import com.polycopy.ledger.WalletRepository;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.Map;

/**
 * Fresh in-memory H2 database with the production schema applied.
 */
public final class TestDatabase {

  private TestDatabase() {
  }

  public static EmbeddedDatabase create() {
    return new EmbeddedDatabaseBuilder()
        .generateUniqueName(true)
        .setType(EmbeddedDatabaseType.H2)
        .addScript("classpath:schema.sql")
        .build();
  }

  public static TransactionTemplate transactionTemplate(DataSource dataSource) {
    return new TransactionTemplate(new DataSourceTransactionManager(dataSource));
  }

  public static ObjectMapper objectMapper() {
    return new ObjectMapper().findAndRegisterModules();
  }

  public static Wallet wallet(WalletRepository repository, String userId, String code, Instant createdAt) {
    repository.insert(Wallet.create(userId, "@" + userId, "0x" + userId, "kms://" + userId, Map.of(), code, createdAt));
    return repository.findByUserId(userId).orElseThrow();
  }
}
