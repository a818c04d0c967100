package ca.gc.cra.snare.infrastructure.persistence;

import ca.gc.cra.snare.application.port.EventStoreException;
import ca.gc.cra.snare.application.port.EventStorePort;
import ca.gc.cra.snare.application.query.AttackFilter;
import ca.gc.cra.snare.application.query.AttackQuery;
import ca.gc.cra.snare.application.query.AttackStatistics;
import ca.gc.cra.snare.application.query.Page;
import ca.gc.cra.snare.domain.alert.Alert;
import ca.gc.cra.snare.domain.alert.AlertType;
import ca.gc.cra.snare.domain.attack.AttackEvent;
import ca.gc.cra.snare.domain.attack.AttackPattern;
import ca.gc.cra.snare.domain.attack.AttackType;
import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.domain.attack.SourceCount;
import ca.gc.cra.snare.domain.attack.ThreatLevel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link EventStorePort} backed by a single SQLite file through JDBC.
 * <p><strong>Why:</strong> A honeypot needs durable, dependency-free storage that survives restarts and can be
 * copied off the host for analysis.</p>
 * <p><strong>Thread-safety:</strong> One connection guarded by one {@link ReentrantLock}; every read and write
 * runs inside the lock, so readers never see partial rows and ids are assigned in commit order.</p>
 * <p><strong>Durability:</strong> Auto-commit; each insert is committed before the method returns. The journal
 * runs in WAL mode.</p>
 * <p><strong>Format:</strong> Timestamps are ISO-8601 UTC text; enums are stored by constant name.</p>
 *
 * @since 0.1.0
 */
public final class SqliteEventStore implements EventStorePort {
  private static final Logger log = LoggerFactory.getLogger(SqliteEventStore.class);
  private static final int TOP_SOURCES = 10;

  private static final List<String> SCHEMA = List.of(
      "CREATE TABLE IF NOT EXISTS attack_events ("
          + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
          + " timestamp TEXT NOT NULL,"
          + " source_ip TEXT NOT NULL,"
          + " source_port INTEGER NOT NULL,"
          + " protocol TEXT NOT NULL,"
          + " attack_type TEXT NOT NULL,"
          + " raw_payload TEXT,"
          + " threat_level TEXT,"
          + " attack_pattern TEXT)",
      "CREATE INDEX IF NOT EXISTS idx_attack_events_timestamp ON attack_events(timestamp)",
      "CREATE INDEX IF NOT EXISTS idx_attack_events_source_ip ON attack_events(source_ip)",
      "CREATE INDEX IF NOT EXISTS idx_attack_events_protocol ON attack_events(protocol)",
      "CREATE TABLE IF NOT EXISTS alerts ("
          + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
          + " timestamp TEXT NOT NULL,"
          + " source_ip TEXT NOT NULL,"
          + " alert_type TEXT NOT NULL,"
          + " detail TEXT,"
          + " attack_id INTEGER)");

  private static final String INSERT_ATTACK = "INSERT INTO attack_events"
      + " (timestamp, source_ip, source_port, protocol, attack_type, raw_payload, threat_level, attack_pattern)"
      + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
  private static final String INSERT_ALERT =
      "INSERT INTO alerts (timestamp, source_ip, alert_type, detail, attack_id) VALUES (?, ?, ?, ?, ?)";
  private static final String ATTACK_COLUMNS = "id, timestamp, source_ip, source_port, protocol, attack_type,"
      + " raw_payload, threat_level, attack_pattern";

  private final Connection connection;
  private final String location;
  private final ReentrantLock lock = new ReentrantLock();
  private volatile boolean closed;

  private SqliteEventStore(Connection connection, String location) {
    this.connection = connection;
    this.location = location;
  }

  /**
   * Opens (creating if needed) a database file and its schema.
   *
   * @param path database file; parent directories are created
   * @return open store
   * @throws EventStoreException if the file cannot be created or the schema applied
   */
  public static SqliteEventStore open(Path path) {
    Objects.requireNonNull(path, "path");
    Path absolute = path.toAbsolutePath();
    try {
      Path parent = absolute.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
    } catch (IOException ex) {
      throw new EventStoreException("cannot create directory for " + absolute, ex);
    }
    return connect("jdbc:sqlite:" + absolute, absolute.toString());
  }

  /**
   * Opens a private in-memory database, discarded on close.
   *
   * @return open store
   */
  public static SqliteEventStore inMemory() {
    return connect("jdbc:sqlite::memory:", ":memory:");
  }

  private static SqliteEventStore connect(String url, String location) {
    Connection connection = null;
    try {
      connection = DriverManager.getConnection(url);
      try (Statement stmt = connection.createStatement()) {
        stmt.execute("PRAGMA journal_mode=WAL");
        for (String ddl : SCHEMA) {
          stmt.executeUpdate(ddl);
        }
      }
      log.info("Event store opened at {}", location);
      return new SqliteEventStore(connection, location);
    } catch (SQLException ex) {
      if (connection != null) {
        try {
          connection.close();
        } catch (SQLException closeEx) {
          ex.addSuppressed(closeEx);
        }
      }
      throw new EventStoreException("cannot open event store at " + location, ex);
    }
  }

  @Override
  public long recordAttack(AttackEvent event) {
    Objects.requireNonNull(event, "event");
    if (event.isPersisted()) {
      throw new IllegalArgumentException("event already persisted with id " + event.id());
    }
    lock.lock();
    try (PreparedStatement stmt = prepare(INSERT_ATTACK)) {
      stmt.setString(1, event.timestamp().toString());
      stmt.setString(2, event.sourceIp());
      stmt.setInt(3, event.sourcePort());
      stmt.setString(4, event.protocol().name());
      stmt.setString(5, event.attackType().name());
      stmt.setString(6, event.rawPayload());
      stmt.setString(7, event.threatLevel().name());
      stmt.setString(8, event.attackPattern().name());
      stmt.executeUpdate();
      return lastInsertId();
    } catch (SQLException ex) {
      throw new EventStoreException("failed to record attack from " + event.sourceIp(), ex);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<AttackEvent> getAttacks(AttackQuery query) {
    Objects.requireNonNull(query, "query");
    StringBuilder sql = new StringBuilder("SELECT ").append(ATTACK_COLUMNS).append(" FROM attack_events");
    List<String> values = new ArrayList<>(query.filters().size());
    String joiner = " WHERE ";
    for (Map.Entry<AttackFilter, String> filter : query.filters().entrySet()) {
      sql.append(joiner).append(filter.getKey().column()).append(" = ?");
      values.add(filter.getValue());
      joiner = " AND ";
    }
    sql.append(" ORDER BY id DESC LIMIT ? OFFSET ?");

    lock.lock();
    try (PreparedStatement stmt = prepare(sql.toString())) {
      int index = 1;
      for (String value : values) {
        stmt.setString(index++, value);
      }
      stmt.setInt(index++, query.page().limit());
      stmt.setInt(index, query.page().offset());
      List<AttackEvent> events = new ArrayList<>();
      try (ResultSet rs = stmt.executeQuery()) {
        while (rs.next()) {
          events.add(readAttack(rs));
        }
      }
      return events;
    } catch (SQLException ex) {
      throw new EventStoreException("failed to list attacks", ex);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<AttackEvent> getAttackById(long id) {
    lock.lock();
    try (PreparedStatement stmt = prepare("SELECT " + ATTACK_COLUMNS + " FROM attack_events WHERE id = ?")) {
      stmt.setLong(1, id);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? Optional.of(readAttack(rs)) : Optional.empty();
      }
    } catch (SQLException ex) {
      throw new EventStoreException("failed to load attack " + id, ex);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public AttackStatistics getAttackStatistics() {
    lock.lock();
    try {
      long total = scalar("SELECT COUNT(*) FROM attack_events");
      long uniqueSources = scalar("SELECT COUNT(DISTINCT source_ip) FROM attack_events");
      Map<String, Long> byType = grouped("attack_type");
      Map<String, Long> byLevel = grouped("threat_level");
      List<SourceCount> top = new ArrayList<>(TOP_SOURCES);
      try (PreparedStatement stmt = prepare("SELECT source_ip, COUNT(*) AS cnt FROM attack_events"
          + " GROUP BY source_ip ORDER BY cnt DESC, source_ip ASC LIMIT ?")) {
        stmt.setInt(1, TOP_SOURCES);
        try (ResultSet rs = stmt.executeQuery()) {
          while (rs.next()) {
            top.add(new SourceCount(rs.getString(1), rs.getLong(2)));
          }
        }
      }
      return new AttackStatistics(total, uniqueSources, byType, byLevel, top);
    } catch (SQLException ex) {
      throw new EventStoreException("failed to compute attack statistics", ex);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public long recordAlert(Alert alert) {
    Objects.requireNonNull(alert, "alert");
    if (alert.id() != null) {
      throw new IllegalArgumentException("alert already persisted with id " + alert.id());
    }
    lock.lock();
    try (PreparedStatement stmt = prepare(INSERT_ALERT)) {
      stmt.setString(1, alert.timestamp().toString());
      stmt.setString(2, alert.sourceIp());
      stmt.setString(3, alert.alertType().name());
      stmt.setString(4, alert.detail());
      if (alert.attackId() == null) {
        stmt.setNull(5, Types.INTEGER);
      } else {
        stmt.setLong(5, alert.attackId());
      }
      stmt.executeUpdate();
      return lastInsertId();
    } catch (SQLException ex) {
      throw new EventStoreException("failed to record alert for " + alert.sourceIp(), ex);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<Alert> getAlerts(Page page) {
    Objects.requireNonNull(page, "page");
    lock.lock();
    try (PreparedStatement stmt = prepare("SELECT id, timestamp, source_ip, alert_type, detail, attack_id"
        + " FROM alerts ORDER BY id DESC LIMIT ? OFFSET ?")) {
      stmt.setInt(1, page.limit());
      stmt.setInt(2, page.offset());
      List<Alert> alerts = new ArrayList<>();
      try (ResultSet rs = stmt.executeQuery()) {
        while (rs.next()) {
          long attackId = rs.getLong(6);
          Long linked = rs.wasNull() ? null : attackId;
          alerts.add(new Alert(
              rs.getLong(1),
              Instant.parse(rs.getString(2)),
              rs.getString(3),
              AlertType.valueOf(rs.getString(4)),
              rs.getString(5),
              linked));
        }
      }
      return alerts;
    } catch (SQLException ex) {
      throw new EventStoreException("failed to list alerts", ex);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      connection.close();
      log.info("Event store at {} closed", location);
    } catch (SQLException ex) {
      throw new EventStoreException("failed to close event store at " + location, ex);
    } finally {
      lock.unlock();
    }
  }

  private PreparedStatement prepare(String sql) throws SQLException {
    if (closed) {
      throw new EventStoreException("event store at " + location + " is closed");
    }
    return connection.prepareStatement(sql);
  }

  private long lastInsertId() throws SQLException {
    try (Statement stmt = connection.createStatement();
        ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
      if (!rs.next()) {
        throw new SQLException("last_insert_rowid() returned no row");
      }
      return rs.getLong(1);
    }
  }

  private long scalar(String sql) throws SQLException {
    try (PreparedStatement stmt = prepare(sql); ResultSet rs = stmt.executeQuery()) {
      return rs.next() ? rs.getLong(1) : 0L;
    }
  }

  private Map<String, Long> grouped(String column) throws SQLException {
    Map<String, Long> counts = new LinkedHashMap<>();
    try (PreparedStatement stmt =
            prepare("SELECT " + column + ", COUNT(*) FROM attack_events GROUP BY " + column);
        ResultSet rs = stmt.executeQuery()) {
      while (rs.next()) {
        String key = rs.getString(1);
        counts.put(key == null ? "UNKNOWN" : key, rs.getLong(2));
      }
    }
    return counts;
  }

  private static AttackEvent readAttack(ResultSet rs) throws SQLException {
    return new AttackEvent(
        rs.getLong("id"),
        Instant.parse(rs.getString("timestamp")),
        rs.getString("source_ip"),
        rs.getInt("source_port"),
        Protocol.fromString(rs.getString("protocol")),
        AttackType.fromString(rs.getString("attack_type")),
        rs.getString("raw_payload"),
        parseLevel(rs.getString("threat_level")),
        AttackPattern.fromString(rs.getString("attack_pattern")));
  }

  private static ThreatLevel parseLevel(String stored) {
    return stored == null ? ThreatLevel.LOW : ThreatLevel.fromString(stored);
  }
}
