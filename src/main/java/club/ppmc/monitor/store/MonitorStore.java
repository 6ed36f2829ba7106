/**
 * MonitorStore.java
 *
 * 指标快照与告警的只追加存储，可按时间窗口查询。
 * 采集循环写入指标，处理循环写入告警，外部仪表盘层并发读取，实现必须可以被多个线程同时调用。
 * 所有失败都以 PersistenceException 的形式抛出，由调用方记录日志后丢弃。
 */
package club.ppmc.monitor.store;

import club.ppmc.monitor.model.Alert;
import club.ppmc.monitor.model.DashboardSummary;
import club.ppmc.monitor.model.MetricSample;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public interface MonitorStore {

    void appendMetric(MetricSample sample);

    /**
     * 追加一条告警。相同 ID 的告警已存在时拒绝写入，已有记录保持不变。
     *
     * @throws club.ppmc.monitor.exception.PersistenceException 写入失败或 ID 重复时。
     */
    void appendAlert(Alert alert);

    /** 时间戳晚于 since 的快照，按时间倒序。 */
    List<MetricSample> queryMetrics(Instant since);

    /** 创建时间晚于 since 的告警，按时间倒序。 */
    List<Alert> queryAlerts(Instant since);

    /**
     * 汇总回溯窗口内的告警统计与最近一小时内的最新快照。
     * 有未解决的 CRITICAL 时状态为 CRITICAL，否则有未解决的 WARNING 时为 WARNING，否则为 HEALTHY。
     * 返回值中的 monitoringActive / lastHealthCheck 不由存储负责，固定为 false / null。
     */
    DashboardSummary dashboardSummary(Duration lookback);

    /**
     * 将告警标记为已解决（运维人员操作）。
     *
     * @return 是否有记录被更新；告警不存在或已解决时为 false。
     */
    boolean resolveAlert(String id, Instant resolvedAt);
}
