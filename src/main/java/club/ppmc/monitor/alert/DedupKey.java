/**
 * DedupKey.java
 *
 * 告警去重键。包含严重级别，因此从 WARNING 升级到 CRITICAL 永远不会被之前的 WARNING 抑制，
 * 只有同一级别的重复告警会在窗口内被抑制。
 */
package club.ppmc.monitor.alert;

import club.ppmc.monitor.model.Alert;
import club.ppmc.monitor.model.Severity;

public record DedupKey(String alertType, String component, Severity severity) {

    public static DedupKey of(Alert alert) {
        return new DedupKey(alert.getAlertType(), alert.getComponent(), alert.getSeverity());
    }
}
