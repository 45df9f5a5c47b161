package org.detectk.metric.anomaly.storage;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;
import org.detectk.metric.anomaly.storage.jdbc.JdbcMetricStorage;

public class MetricStorageProvider {
  private static final String STORAGE_TYPE = "type";
  private static final String STORAGE_TYPE_MEMORY = "memory";
  private static final String STORAGE_TYPE_JDBC = "jdbc";

  private static final String JDBC_CONFIG = "jdbc";
  private static final String JDBC_URL = "url";
  private static final String JDBC_USER = "user";
  private static final String JDBC_PASSWORD = "password";
  private static final String JDBC_MAX_POOL_SIZE = "maximumPoolSize";
  private static final String JDBC_INITIALIZE_SCHEMA = "initializeSchema";
  private static final int DEFAULT_MAX_POOL_SIZE = 4;
  private static final boolean DEFAULT_INITIALIZE_SCHEMA = true;

  public static StorageBackend getProvider(Config storageConfig) {
    String storageType =
        storageConfig.hasPath(STORAGE_TYPE)
            ? storageConfig.getString(STORAGE_TYPE)
            : STORAGE_TYPE_MEMORY;
    switch (storageType) {
      case STORAGE_TYPE_MEMORY:
        return new InMemoryMetricStorage();
      case STORAGE_TYPE_JDBC:
        return createJdbcStorage(storageConfig.getConfig(JDBC_CONFIG));
      default:
        throw new RuntimeException(String.format("Invalid storage type:%s", storageType));
    }
  }

  private static JdbcMetricStorage createJdbcStorage(Config jdbcConfig) {
    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setPoolName("detectk-storage");
    hikariConfig.setJdbcUrl(jdbcConfig.getString(JDBC_URL));
    if (jdbcConfig.hasPath(JDBC_USER)) {
      hikariConfig.setUsername(jdbcConfig.getString(JDBC_USER));
    }
    if (jdbcConfig.hasPath(JDBC_PASSWORD)) {
      hikariConfig.setPassword(jdbcConfig.getString(JDBC_PASSWORD));
    }
    hikariConfig.setMaximumPoolSize(
        jdbcConfig.hasPath(JDBC_MAX_POOL_SIZE)
            ? jdbcConfig.getInt(JDBC_MAX_POOL_SIZE)
            : DEFAULT_MAX_POOL_SIZE);

    JdbcMetricStorage storage = new JdbcMetricStorage(new HikariDataSource(hikariConfig));
    boolean initializeSchema =
        jdbcConfig.hasPath(JDBC_INITIALIZE_SCHEMA)
            ? jdbcConfig.getBoolean(JDBC_INITIALIZE_SCHEMA)
            : DEFAULT_INITIALIZE_SCHEMA;
    if (initializeSchema) {
      try {
        storage.initializeSchema();
      } catch (StorageException e) {
        storage.close();
        throw new RuntimeException(e);
      }
    }
    return storage;
  }
}
