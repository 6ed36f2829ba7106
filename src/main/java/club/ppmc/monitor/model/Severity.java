/**
 * Severity.java
 *
 * 告警严重级别。枚举声明顺序即严重程度顺序：INFO < WARNING < CRITICAL。
 */
package club.ppmc.monitor.model;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
