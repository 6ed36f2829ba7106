/**
 * DashboardSummary.java
 *
 * 提供给外部仪表盘层的汇总视图。
 * 告警统计与最新快照来自存储；monitoringActive 与 lastHealthCheck 由 MonitorService 补充。
 */
package club.ppmc.monitor.model;

import java.time.Instant;

/**
 * @param status             整体状态。
 * @param activeAlertCount   回溯窗口内未解决的告警数。
 * @param criticalAlertCount 回溯窗口内未解决的 CRITICAL 告警数。
 * @param totalAlerts        回溯窗口内的告警总数（含已解决）。
 * @param latestSample       最近一小时内的最新采样，可能为 null。
 * @param monitoringActive   后台监控循环是否在运行。
 * @param lastHealthCheck    最近一次完成采样的时间，可能为 null。
 */
public record DashboardSummary(
        SystemHealthStatus status,
        int activeAlertCount,
        int criticalAlertCount,
        int totalAlerts,
        MetricSample latestSample,
        boolean monitoringActive,
        Instant lastHealthCheck
) {

    public static DashboardSummary empty() {
        return new DashboardSummary(SystemHealthStatus.HEALTHY, 0, 0, 0, null, false, null);
    }

    public DashboardSummary withMonitoringState(boolean active, Instant lastCheck) {
        return new DashboardSummary(
                status, activeAlertCount, criticalAlertCount, totalAlerts, latestSample, active, lastCheck);
    }
}
