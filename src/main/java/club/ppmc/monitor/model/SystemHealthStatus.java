/**
 * SystemHealthStatus.java
 *
 * 仪表盘展示的整体系统状态，由回溯窗口内未解决的告警推导得出。
 */
package club.ppmc.monitor.model;

public enum SystemHealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
