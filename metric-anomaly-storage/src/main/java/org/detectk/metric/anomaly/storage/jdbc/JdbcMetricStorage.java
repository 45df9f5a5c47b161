package org.detectk.metric.anomaly.storage.jdbc;

import com.google.common.base.Preconditions;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import javax.sql.DataSource;
import org.detectk.metric.anomaly.datamodel.DetectionResult;
import org.detectk.metric.anomaly.datamodel.Direction;
import org.detectk.metric.anomaly.datamodel.Measurement;
import org.detectk.metric.anomaly.datamodel.StoredDetection;
import org.detectk.metric.anomaly.datamodel.exception.StorageException;
import org.detectk.metric.anomaly.storage.BatchSaveSummary;
import org.detectk.metric.anomaly.storage.DataKind;
import org.detectk.metric.anomaly.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable storage over a JDBC database with {@code CREATE TABLE IF NOT EXISTS} and {@code
 * TIMESTAMP WITH TIME ZONE} support, such as H2 or PostgreSQL. Rows are upserted one key at a time
 * inside a batch transaction: an update that touches no row becomes an insert. An insert that
 * loses a race against a concurrent writer is retried as an update, so the last writer wins.
 *
 * <p>Context and metadata maps are stored as JSON text; timestamps as {@code TIMESTAMP WITH TIME
 * ZONE} in UTC.
 */
public class JdbcMetricStorage implements StorageBackend {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcMetricStorage.class);

  static final String DATAPOINTS_TABLE = "dtk_datapoints";
  static final String DETECTIONS_TABLE = "dtk_detections";
  static final String CHECKPOINTS_TABLE = "dtk_checkpoints";
  static final String ALERT_STATE_TABLE = "dtk_alert_state";

  private static final List<String> SCHEMA =
      List.of(
          "CREATE TABLE IF NOT EXISTS "
              + DATAPOINTS_TABLE
              + " (metric_name VARCHAR(255) NOT NULL,"
              + " collected_at TIMESTAMP(9) WITH TIME ZONE NOT NULL,"
              + " metric_value DOUBLE PRECISION,"
              + " context VARCHAR(4096) NOT NULL,"
              + " PRIMARY KEY (metric_name, collected_at))",
          "CREATE TABLE IF NOT EXISTS "
              + DETECTIONS_TABLE
              + " (metric_name VARCHAR(255) NOT NULL,"
              + " detector_id VARCHAR(64) NOT NULL,"
              + " detected_at TIMESTAMP(9) WITH TIME ZONE NOT NULL,"
              + " metric_value DOUBLE PRECISION,"
              + " is_anomaly BOOLEAN NOT NULL,"
              + " anomaly_score DOUBLE PRECISION,"
              + " lower_bound DOUBLE PRECISION,"
              + " upper_bound DOUBLE PRECISION,"
              + " direction VARCHAR(10),"
              + " percent_deviation DOUBLE PRECISION,"
              + " metadata VARCHAR(4096) NOT NULL,"
              + " alert_sent BOOLEAN NOT NULL,"
              + " alert_reason VARCHAR(1024),"
              + " PRIMARY KEY (metric_name, detector_id, detected_at))",
          "CREATE TABLE IF NOT EXISTS "
              + CHECKPOINTS_TABLE
              + " (metric_name VARCHAR(255) NOT NULL PRIMARY KEY,"
              + " last_loaded_at TIMESTAMP(9) WITH TIME ZONE NOT NULL)",
          "CREATE TABLE IF NOT EXISTS "
              + ALERT_STATE_TABLE
              + " (metric_name VARCHAR(255) NOT NULL,"
              + " detector_id VARCHAR(64) NOT NULL,"
              + " last_dispatch_at TIMESTAMP(9) WITH TIME ZONE NOT NULL,"
              + " PRIMARY KEY (metric_name, detector_id))");

  private static final String SELECT_DATAPOINT =
      "SELECT metric_value, context FROM "
          + DATAPOINTS_TABLE
          + " WHERE metric_name = ? AND collected_at = ?";
  private static final String UPDATE_DATAPOINT =
      "UPDATE "
          + DATAPOINTS_TABLE
          + " SET metric_value = ?, context = ? WHERE metric_name = ? AND collected_at = ?";
  private static final String INSERT_DATAPOINT =
      "INSERT INTO "
          + DATAPOINTS_TABLE
          + " (metric_value, context, metric_name, collected_at) VALUES (?, ?, ?, ?)";
  private static final String QUERY_DATAPOINTS =
      "SELECT collected_at, metric_value, context FROM "
          + DATAPOINTS_TABLE
          + " WHERE metric_name = ? AND collected_at >= ? AND collected_at < ?"
          + " ORDER BY collected_at";

  private static final String DETECTION_COLUMNS =
      "metric_value, is_anomaly, anomaly_score, lower_bound, upper_bound, direction,"
          + " percent_deviation, metadata, alert_sent, alert_reason";
  private static final String SELECT_DETECTION =
      "SELECT "
          + DETECTION_COLUMNS
          + " FROM "
          + DETECTIONS_TABLE
          + " WHERE metric_name = ? AND detector_id = ? AND detected_at = ?";
  private static final String UPDATE_DETECTION =
      "UPDATE "
          + DETECTIONS_TABLE
          + " SET metric_value = ?, is_anomaly = ?, anomaly_score = ?, lower_bound = ?,"
          + " upper_bound = ?, direction = ?, percent_deviation = ?, metadata = ?,"
          + " alert_sent = ?, alert_reason = ?"
          + " WHERE metric_name = ? AND detector_id = ? AND detected_at = ?";
  private static final String INSERT_DETECTION =
      "INSERT INTO "
          + DETECTIONS_TABLE
          + " ("
          + DETECTION_COLUMNS
          + ", metric_name, detector_id, detected_at)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
  private static final String QUERY_DETECTIONS =
      "SELECT detected_at, "
          + DETECTION_COLUMNS
          + " FROM "
          + DETECTIONS_TABLE
          + " WHERE metric_name = ? AND detector_id = ? AND detected_at >= ? AND detected_at < ?"
          + " ORDER BY detected_at";

  private static final String SELECT_CHECKPOINT =
      "SELECT last_loaded_at FROM " + CHECKPOINTS_TABLE + " WHERE metric_name = ?";
  private static final String ADVANCE_CHECKPOINT =
      "UPDATE "
          + CHECKPOINTS_TABLE
          + " SET last_loaded_at = ? WHERE metric_name = ? AND last_loaded_at < ?";
  private static final String INSERT_CHECKPOINT =
      "INSERT INTO " + CHECKPOINTS_TABLE + " (last_loaded_at, metric_name) VALUES (?, ?)";

  private static final String SELECT_DISPATCH =
      "SELECT last_dispatch_at FROM "
          + ALERT_STATE_TABLE
          + " WHERE metric_name = ? AND detector_id = ?";
  private static final String ADVANCE_DISPATCH =
      "UPDATE "
          + ALERT_STATE_TABLE
          + " SET last_dispatch_at = ? WHERE metric_name = ? AND detector_id = ?"
          + " AND last_dispatch_at < ?";
  private static final String INSERT_DISPATCH =
      "INSERT INTO "
          + ALERT_STATE_TABLE
          + " (last_dispatch_at, metric_name, detector_id) VALUES (?, ?, ?)";

  private final DataSource dataSource;

  public JdbcMetricStorage(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  /** Creates the four tables when they do not exist yet. */
  public void initializeSchema() throws StorageException {
    try (Connection connection = dataSource.getConnection();
        Statement statement = connection.createStatement()) {
      for (String ddl : SCHEMA) {
        statement.execute(ddl);
      }
      LOGGER.info("Storage schema ready at {}", connection.getMetaData().getURL());
    } catch (SQLException e) {
      throw new StorageException("Unable to create storage schema", e);
    }
  }

  @Override
  public BatchSaveSummary saveBatch(String metricName, List<Measurement> batch)
      throws StorageException {
    Preconditions.checkArgument(metricName != null, "metricName is required");
    if (batch.isEmpty()) {
      return BatchSaveSummary.EMPTY;
    }
    try (Connection connection = dataSource.getConnection()) {
      connection.setAutoCommit(false);
      try {
        int inserted = 0, updated = 0, unchanged = 0;
        for (Measurement measurement : batch) {
          switch (upsertDatapoint(connection, metricName, measurement)) {
            case INSERTED:
              inserted++;
              break;
            case UPDATED:
              updated++;
              break;
            default:
              unchanged++;
          }
        }
        connection.commit();
        LOGGER.debug(
            "Saved batch for metric {}: inserted {}, updated {}, unchanged {}",
            metricName,
            inserted,
            updated,
            unchanged);
        return new BatchSaveSummary(inserted, updated, unchanged);
      } catch (SQLException e) {
        connection.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new StorageException(
          String.format("Failed to save %d measurements of %s", batch.size(), metricName), e);
    }
  }

  @Override
  public List<Measurement> queryWindow(
      String metricName,
      Instant endTime,
      Duration window,
      Predicate<Map<String, Object>> contextFilter)
      throws StorageException {
    List<Measurement> result = new ArrayList<>();
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(QUERY_DATAPOINTS)) {
      statement.setString(1, metricName);
      statement.setObject(2, toTimestamp(endTime.minus(window)));
      statement.setObject(3, toTimestamp(endTime));
      try (ResultSet rows = statement.executeQuery()) {
        while (rows.next()) {
          Map<String, Object> context = JsonColumns.readMap(rows.getString(3));
          if (contextFilter.test(context)) {
            result.add(
                Measurement.of(readInstant(rows, 1), readNullableDouble(rows, 2), context));
          }
        }
      }
      return result;
    } catch (SQLException e) {
      throw new StorageException(
          String.format("Failed to query window of %s ending %s", metricName, endTime), e);
    }
  }

  @Override
  public Optional<Instant> getCheckpoint(String metricName) throws StorageException {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(SELECT_CHECKPOINT)) {
      statement.setString(1, metricName);
      try (ResultSet rows = statement.executeQuery()) {
        return rows.next() ? Optional.of(readInstant(rows, 1)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new StorageException("Failed to read checkpoint of " + metricName, e);
    }
  }

  @Override
  public void setCheckpoint(String metricName, Instant timestamp) throws StorageException {
    try (Connection connection = dataSource.getConnection()) {
      advanceOrInsert(
          connection,
          ADVANCE_CHECKPOINT,
          INSERT_CHECKPOINT,
          SELECT_CHECKPOINT,
          timestamp,
          metricName);
    } catch (SQLException e) {
      throw new StorageException(
          String.format("Failed to store checkpoint %s of %s", timestamp, metricName), e);
    }
  }

  @Override
  public BatchSaveSummary saveDetections(List<StoredDetection> batch) throws StorageException {
    if (batch.isEmpty()) {
      return BatchSaveSummary.EMPTY;
    }
    try (Connection connection = dataSource.getConnection()) {
      connection.setAutoCommit(false);
      try {
        int inserted = 0, updated = 0, unchanged = 0;
        for (StoredDetection detection : batch) {
          switch (upsertDetection(connection, detection)) {
            case INSERTED:
              inserted++;
              break;
            case UPDATED:
              updated++;
              break;
            default:
              unchanged++;
          }
        }
        connection.commit();
        return new BatchSaveSummary(inserted, updated, unchanged);
      } catch (SQLException e) {
        connection.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new StorageException(String.format("Failed to save %d detections", batch.size()), e);
    }
  }

  @Override
  public List<StoredDetection> queryDetections(
      String metricName, String detectorId, Instant endTime, Duration window)
      throws StorageException {
    List<StoredDetection> result = new ArrayList<>();
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(QUERY_DETECTIONS)) {
      statement.setString(1, metricName);
      statement.setString(2, detectorId);
      statement.setObject(3, toTimestamp(endTime.minus(window)));
      statement.setObject(4, toTimestamp(endTime));
      try (ResultSet rows = statement.executeQuery()) {
        while (rows.next()) {
          result.add(readDetection(rows, 2, metricName, detectorId, readInstant(rows, 1)));
        }
      }
      return result;
    } catch (SQLException e) {
      throw new StorageException(
          String.format("Failed to query detections of %s/%s", metricName, detectorId), e);
    }
  }

  @Override
  public int purgeOlderThan(Instant cutoff, DataKind kind) throws StorageException {
    String sql;
    switch (kind) {
      case MEASUREMENTS:
        sql = "DELETE FROM " + DATAPOINTS_TABLE + " WHERE collected_at < ?";
        break;
      case DETECTIONS:
        sql = "DELETE FROM " + DETECTIONS_TABLE + " WHERE detected_at < ?";
        break;
      default:
        throw new UnsupportedOperationException("Unsupported data kind: " + kind);
    }
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setObject(1, toTimestamp(cutoff));
      int removed = statement.executeUpdate();
      LOGGER.info("Purged {} {} rows older than {}", removed, kind, cutoff);
      return removed;
    } catch (SQLException e) {
      throw new StorageException(
          String.format("Failed to purge %s older than %s", kind, cutoff), e);
    }
  }

  @Override
  public Optional<Instant> lastDispatch(String metricName, String detectorId)
      throws StorageException {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(SELECT_DISPATCH)) {
      statement.setString(1, metricName);
      statement.setString(2, detectorId);
      try (ResultSet rows = statement.executeQuery()) {
        return rows.next() ? Optional.of(readInstant(rows, 1)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new StorageException(
          String.format("Failed to read alert state of %s/%s", metricName, detectorId), e);
    }
  }

  @Override
  public void recordDispatch(String metricName, String detectorId, Instant dispatchedAt)
      throws StorageException {
    try (Connection connection = dataSource.getConnection()) {
      advanceOrInsert(
          connection,
          ADVANCE_DISPATCH,
          INSERT_DISPATCH,
          SELECT_DISPATCH,
          dispatchedAt,
          metricName,
          detectorId);
    } catch (SQLException e) {
      throw new StorageException(
          String.format("Failed to record alert dispatch of %s/%s", metricName, detectorId), e);
    }
  }

  @Override
  public void close() {
    if (dataSource instanceof HikariDataSource) {
      ((HikariDataSource) dataSource).close();
    }
  }

  private UpsertOutcome upsertDatapoint(
      Connection connection, String metricName, Measurement measurement) throws SQLException {
    String context = JsonColumns.writeMap(measurement.getContext());
    OffsetDateTime collectedAt = toTimestamp(measurement.getTimestamp());
    try (PreparedStatement select = connection.prepareStatement(SELECT_DATAPOINT)) {
      select.setString(1, metricName);
      select.setObject(2, collectedAt);
      try (ResultSet rows = select.executeQuery()) {
        if (rows.next()
            && Objects.equals(readNullableDouble(rows, 1), measurement.getValue())
            && context.equals(rows.getString(2))) {
          return UpsertOutcome.UNCHANGED;
        }
      }
    }
    return upsert(
        connection,
        UPDATE_DATAPOINT,
        INSERT_DATAPOINT,
        statement -> {
          setNullableDouble(statement, 1, measurement.getValue());
          statement.setString(2, context);
          statement.setString(3, metricName);
          statement.setObject(4, collectedAt);
        });
  }

  private UpsertOutcome upsertDetection(Connection connection, StoredDetection detection)
      throws SQLException {
    DetectionResult result = detection.getResult();
    OffsetDateTime detectedAt = toTimestamp(result.getTimestamp());
    try (PreparedStatement select = connection.prepareStatement(SELECT_DETECTION)) {
      select.setString(1, result.getMetricName());
      select.setString(2, result.getDetectorId());
      select.setObject(3, detectedAt);
      try (ResultSet rows = select.executeQuery()) {
        if (rows.next()
            && sameRow(
                readDetection(
                    rows,
                    1,
                    result.getMetricName(),
                    result.getDetectorId(),
                    result.getTimestamp()),
                detection)) {
          return UpsertOutcome.UNCHANGED;
        }
      }
    }
    return upsert(
        connection,
        UPDATE_DETECTION,
        INSERT_DETECTION,
        statement -> {
          setNullableDouble(statement, 1, result.getValue());
          statement.setBoolean(2, result.isAnomaly());
          setNullableDouble(statement, 3, result.getScore());
          setNullableDouble(statement, 4, result.getLowerBound());
          setNullableDouble(statement, 5, result.getUpperBound());
          statement.setString(
              6, result.getDirection() == null ? null : result.getDirection().getLabel());
          setNullableDouble(statement, 7, result.getPercentDeviation());
          statement.setString(8, JsonColumns.writeMap(result.getMetadata()));
          statement.setBoolean(9, detection.isAlertSent());
          statement.setString(10, detection.getAlertReason());
          statement.setString(11, result.getMetricName());
          statement.setString(12, result.getDetectorId());
          statement.setObject(13, detectedAt);
        });
  }

  /**
   * Runs the update, inserting when no row matched. Both statements share their parameter order,
   * key columns last.
   */
  private static UpsertOutcome upsert(
      Connection connection, String updateSql, String insertSql, StatementBinder binder)
      throws SQLException {
    if (executeUpdate(connection, updateSql, binder) > 0) {
      return UpsertOutcome.UPDATED;
    }
    try {
      executeUpdate(connection, insertSql, binder);
      return UpsertOutcome.INSERTED;
    } catch (SQLException e) {
      if (!isDuplicateKey(e)) {
        throw e;
      }
      executeUpdate(connection, updateSql, binder);
      return UpsertOutcome.UPDATED;
    }
  }

  /**
   * Moves a stored timestamp forward only. {@code keys} bind after the timestamp in every
   * statement.
   */
  private static void advanceOrInsert(
      Connection connection,
      String advanceSql,
      String insertSql,
      String selectSql,
      Instant timestamp,
      String... keys)
      throws SQLException {
    OffsetDateTime value = toTimestamp(timestamp);
    StatementBinder advance =
        statement -> {
          statement.setObject(1, value);
          for (int i = 0; i < keys.length; i++) {
            statement.setString(i + 2, keys[i]);
          }
          statement.setObject(keys.length + 2, value);
        };
    if (executeUpdate(connection, advanceSql, advance) > 0) {
      return;
    }
    try (PreparedStatement select = connection.prepareStatement(selectSql)) {
      for (int i = 0; i < keys.length; i++) {
        select.setString(i + 1, keys[i]);
      }
      try (ResultSet rows = select.executeQuery()) {
        if (rows.next()) {
          return;
        }
      }
    }
    StatementBinder insert =
        statement -> {
          statement.setObject(1, value);
          for (int i = 0; i < keys.length; i++) {
            statement.setString(i + 2, keys[i]);
          }
        };
    try {
      executeUpdate(connection, insertSql, insert);
    } catch (SQLException e) {
      if (!isDuplicateKey(e)) {
        throw e;
      }
      executeUpdate(connection, advanceSql, advance);
    }
  }

  private static int executeUpdate(Connection connection, String sql, StatementBinder binder)
      throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      binder.bind(statement);
      return statement.executeUpdate();
    }
  }

  private static StoredDetection readDetection(
      ResultSet rows, int firstColumn, String metricName, String detectorId, Instant timestamp)
      throws SQLException {
    String direction = rows.getString(firstColumn + 5);
    DetectionResult result =
        DetectionResult.builder()
            .metricName(metricName)
            .detectorId(detectorId)
            .timestamp(timestamp)
            .value(readNullableDouble(rows, firstColumn))
            .anomaly(rows.getBoolean(firstColumn + 1))
            .score(readNullableDouble(rows, firstColumn + 2))
            .lowerBound(readNullableDouble(rows, firstColumn + 3))
            .upperBound(readNullableDouble(rows, firstColumn + 4))
            .direction(direction == null ? null : Direction.fromLabel(direction))
            .percentDeviation(readNullableDouble(rows, firstColumn + 6))
            .metadata(JsonColumns.readMap(rows.getString(firstColumn + 7)))
            .build();
    return new StoredDetection(
        result, rows.getBoolean(firstColumn + 8), rows.getString(firstColumn + 9));
  }

  private static boolean sameRow(StoredDetection stored, StoredDetection candidate) {
    DetectionResult a = stored.getResult();
    DetectionResult b = candidate.getResult();
    return Objects.equals(a.getValue(), b.getValue())
        && a.isAnomaly() == b.isAnomaly()
        && Objects.equals(a.getScore(), b.getScore())
        && Objects.equals(a.getLowerBound(), b.getLowerBound())
        && Objects.equals(a.getUpperBound(), b.getUpperBound())
        && a.getDirection() == b.getDirection()
        && Objects.equals(a.getPercentDeviation(), b.getPercentDeviation())
        && JsonColumns.writeMap(a.getMetadata()).equals(JsonColumns.writeMap(b.getMetadata()))
        && stored.isAlertSent() == candidate.isAlertSent()
        && Objects.equals(stored.getAlertReason(), candidate.getAlertReason());
  }

  private static boolean isDuplicateKey(SQLException e) {
    // SQLSTATE class 23: integrity constraint violation
    return e.getSQLState() != null && e.getSQLState().startsWith("23");
  }

  private static OffsetDateTime toTimestamp(Instant instant) {
    return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
  }

  private static Instant readInstant(ResultSet rows, int column) throws SQLException {
    return rows.getObject(column, OffsetDateTime.class).toInstant();
  }

  private static Double readNullableDouble(ResultSet rows, int column) throws SQLException {
    double value = rows.getDouble(column);
    return rows.wasNull() ? null : value;
  }

  private static void setNullableDouble(PreparedStatement statement, int index, Double value)
      throws SQLException {
    if (value == null) {
      statement.setNull(index, Types.DOUBLE);
    } else {
      statement.setDouble(index, value);
    }
  }

  private enum UpsertOutcome {
    INSERTED,
    UPDATED,
    UNCHANGED
  }

  @FunctionalInterface
  private interface StatementBinder {
    void bind(PreparedStatement statement) throws SQLException;
  }
}
