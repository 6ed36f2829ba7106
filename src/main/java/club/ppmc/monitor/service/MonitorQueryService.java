/**
 * MonitorQueryService.java
 *
 * 提供给外部仪表盘层的只读查询接口，是对 MonitorStore 的无状态包装，不会修改任何监控状态。
 * 存储不可用时降级为空结果并记录日志，保证仪表盘总能拿到一个“尽可能好”的视图。
 */
package club.ppmc.monitor.service;

import club.ppmc.monitor.config.MonitorProperties;
import club.ppmc.monitor.exception.PersistenceException;
import club.ppmc.monitor.model.Alert;
import club.ppmc.monitor.model.DashboardSummary;
import club.ppmc.monitor.model.MetricSample;
import club.ppmc.monitor.store.MonitorStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class MonitorQueryService {

    private final MonitorStore store;
    private final MonitorService monitorService;
    private final Duration summaryLookback;
    private final Clock clock;

    public MonitorQueryService(
            MonitorStore store, MonitorService monitorService, MonitorProperties properties, Clock clock) {
        this.store = store;
        this.monitorService = monitorService;
        this.summaryLookback = properties.getSummaryLookback();
        this.clock = clock;
    }

    /**
     * 最近若干小时内的告警，按时间倒序。
     *
     * @param hours 回溯小时数，必须为正。
     */
    public List<Alert> recentAlerts(int hours) {
        Instant since = since(hours);
        try {
            return store.queryAlerts(since);
        } catch (PersistenceException e) {
            log.error("查询最近 {} 小时的告警失败，返回空列表。", hours, e);
            return List.of();
        }
    }

    /**
     * 最近若干小时内的指标快照，按时间倒序。
     *
     * @param hours 回溯小时数，必须为正。
     */
    public List<MetricSample> recentMetrics(int hours) {
        Instant since = since(hours);
        try {
            return store.queryMetrics(since);
        } catch (PersistenceException e) {
            log.error("查询最近 {} 小时的指标失败，返回空列表。", hours, e);
            return List.of();
        }
    }

    public DashboardSummary dashboardSummary() {
        DashboardSummary summary;
        try {
            summary = store.dashboardSummary(summaryLookback);
        } catch (PersistenceException e) {
            log.error("生成仪表盘汇总失败，返回空汇总。", e);
            summary = DashboardSummary.empty();
        }
        return summary.withMonitoringState(
                monitorService.isMonitoringActive(), monitorService.lastHealthCheck().orElse(null));
    }

    private Instant since(int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("hours 必须为正数: " + hours);
        }
        return clock.instant().minus(Duration.ofHours(hours));
    }
}
