/**
 * JdbcMonitorStore.java
 *
 * 基于 Spring JdbcTemplate 的 MonitorStore 实现，表结构见 schema.sql。
 * 每次调用都是独立的短事务，连接由连接池按调用借还，因此可被采集循环、处理循环和查询方并发使用。
 * 告警元数据以 JSON (Gson) 形式存放在 metadata_json 列中。
 */
package club.ppmc.monitor.store;

import club.ppmc.monitor.exception.PersistenceException;
import club.ppmc.monitor.model.Alert;
import club.ppmc.monitor.model.DashboardSummary;
import club.ppmc.monitor.model.DependencyStatus;
import club.ppmc.monitor.model.MetricSample;
import club.ppmc.monitor.model.Severity;
import club.ppmc.monitor.model.SystemHealthStatus;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.lang.reflect.Type;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
@Slf4j
public class JdbcMonitorStore implements MonitorStore {

    private static final Type METADATA_TYPE = new TypeToken<Map<String, Object>>() {}.getType();
    private static final Duration LATEST_SAMPLE_LOOKBACK = Duration.ofHours(1);

    private static final String INSERT_METRIC = """
            INSERT INTO metrics ("timestamp", cpu_percent, memory_percent, disk_percent, active_connections,
                                 cache_status, store_status, api_response_ms, queue_depth, error_rate_percent)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_ALERT = """
            INSERT INTO alerts (id, alert_type, severity, message, component, created_at, resolved, resolved_at, metadata_json)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_METRICS = """
            SELECT "timestamp", cpu_percent, memory_percent, disk_percent, active_connections,
                   cache_status, store_status, api_response_ms, queue_depth, error_rate_percent
            FROM metrics WHERE "timestamp" > ? ORDER BY "timestamp" DESC, id DESC
            """;

    private static final String SELECT_ALERTS = """
            SELECT id, alert_type, severity, message, component, created_at, resolved, resolved_at, metadata_json
            FROM alerts WHERE created_at > ? ORDER BY created_at DESC, id DESC
            """;

    private static final String ALERT_STATS = """
            SELECT COUNT(*) AS total,
                   SUM(CASE WHEN resolved = FALSE THEN 1 ELSE 0 END) AS active,
                   SUM(CASE WHEN resolved = FALSE AND severity = 'CRITICAL' THEN 1 ELSE 0 END) AS critical,
                   SUM(CASE WHEN resolved = FALSE AND severity = 'WARNING' THEN 1 ELSE 0 END) AS warning
            FROM alerts WHERE created_at > ?
            """;

    private static final String RESOLVE_ALERT =
            "UPDATE alerts SET resolved = TRUE, resolved_at = ? WHERE id = ? AND resolved = FALSE";

    private final JdbcTemplate jdbcTemplate;
    private final Gson gson;
    private final Clock clock;

    private final RowMapper<MetricSample> metricRowMapper = this::mapMetric;
    private final RowMapper<Alert> alertRowMapper = this::mapAlert;

    public JdbcMonitorStore(JdbcTemplate jdbcTemplate, Gson gson, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.gson = gson;
        this.clock = clock;
    }

    @Override
    public void appendMetric(MetricSample sample) {
        try {
            jdbcTemplate.update(INSERT_METRIC,
                    toDb(sample.timestamp()),
                    sample.cpuPercent(),
                    sample.memoryPercent(),
                    sample.diskPercent(),
                    sample.activeConnections(),
                    sample.cacheStatus().wireValue(),
                    sample.storeStatus().wireValue(),
                    sample.apiResponseTimeMs(),
                    sample.queueDepth(),
                    sample.errorRatePercent());
        } catch (DataAccessException e) {
            throw new PersistenceException("appendMetric", "写入指标快照失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void appendAlert(Alert alert) {
        String metadataJson;
        try {
            metadataJson = alert.getMetadata().isEmpty() ? null : gson.toJson(alert.getMetadata());
        } catch (RuntimeException e) {
            throw new PersistenceException("appendAlert", "告警元数据无法序列化: " + alert.getId(), e);
        }

        try {
            jdbcTemplate.update(INSERT_ALERT,
                    alert.getId(),
                    alert.getAlertType(),
                    alert.getSeverity().name(),
                    alert.getMessage(),
                    alert.getComponent(),
                    toDb(alert.getCreatedAt()),
                    alert.isResolved(),
                    toDb(alert.getResolvedAt()),
                    metadataJson);
        } catch (DuplicateKeyException e) {
            throw new PersistenceException("appendAlert", "告警 ID 已存在，拒绝重复写入: " + alert.getId(), e);
        } catch (DataAccessException e) {
            throw new PersistenceException("appendAlert", "写入告警失败: " + e.getMessage(), e);
        }
    }

    @Override
    public List<MetricSample> queryMetrics(Instant since) {
        try {
            return jdbcTemplate.query(SELECT_METRICS, metricRowMapper, toDb(since));
        } catch (DataAccessException e) {
            throw new PersistenceException("queryMetrics", "查询指标快照失败: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Alert> queryAlerts(Instant since) {
        try {
            return jdbcTemplate.query(SELECT_ALERTS, alertRowMapper, toDb(since));
        } catch (DataAccessException e) {
            throw new PersistenceException("queryAlerts", "查询告警失败: " + e.getMessage(), e);
        }
    }

    @Override
    public DashboardSummary dashboardSummary(Duration lookback) {
        Instant now = clock.instant();
        List<MetricSample> recent = queryMetrics(now.minus(LATEST_SAMPLE_LOOKBACK));
        MetricSample latest = recent.isEmpty() ? null : recent.get(0);

        try {
            return jdbcTemplate.queryForObject(ALERT_STATS, (rs, rowNum) -> {
                int total = rs.getInt("total");
                int active = rs.getInt("active");
                int critical = rs.getInt("critical");
                int warning = rs.getInt("warning");
                SystemHealthStatus status = critical > 0
                        ? SystemHealthStatus.CRITICAL
                        : warning > 0 ? SystemHealthStatus.WARNING : SystemHealthStatus.HEALTHY;
                return new DashboardSummary(status, active, critical, total, latest, false, null);
            }, toDb(now.minus(lookback)));
        } catch (DataAccessException e) {
            throw new PersistenceException("dashboardSummary", "统计告警失败: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean resolveAlert(String id, Instant resolvedAt) {
        try {
            return jdbcTemplate.update(RESOLVE_ALERT, toDb(resolvedAt), id) > 0;
        } catch (DataAccessException e) {
            throw new PersistenceException("resolveAlert", "更新告警状态失败: " + e.getMessage(), e);
        }
    }

    private MetricSample mapMetric(ResultSet rs, int rowNum) throws SQLException {
        return new MetricSample(
                fromDb(rs.getObject("timestamp", OffsetDateTime.class)),
                rs.getDouble("cpu_percent"),
                rs.getDouble("memory_percent"),
                rs.getDouble("disk_percent"),
                rs.getInt("active_connections"),
                DependencyStatus.fromWireValue(rs.getString("cache_status")),
                DependencyStatus.fromWireValue(rs.getString("store_status")),
                rs.getDouble("api_response_ms"),
                rs.getLong("queue_depth"),
                rs.getDouble("error_rate_percent"));
    }

    private Alert mapAlert(ResultSet rs, int rowNum) throws SQLException {
        return Alert.builder()
                .id(rs.getString("id"))
                .alertType(rs.getString("alert_type"))
                .severity(Severity.valueOf(rs.getString("severity")))
                .message(rs.getString("message"))
                .component(rs.getString("component"))
                .createdAt(fromDb(rs.getObject("created_at", OffsetDateTime.class)))
                .resolved(rs.getBoolean("resolved"))
                .resolvedAt(fromDb(rs.getObject("resolved_at", OffsetDateTime.class)))
                .metadata(parseMetadata(rs.getString("id"), rs.getString("metadata_json")))
                .build();
    }

    private Map<String, Object> parseMetadata(String alertId, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return gson.fromJson(json, METADATA_TYPE);
        } catch (JsonParseException e) {
            // 元数据损坏不应影响告警本身的读取
            log.warn("告警 {} 的元数据无法解析，已忽略: {}", alertId, e.getMessage());
            return Map.of();
        }
    }

    private static OffsetDateTime toDb(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant fromDb(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
