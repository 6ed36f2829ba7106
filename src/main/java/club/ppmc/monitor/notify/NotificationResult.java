/**
 * NotificationResult.java
 *
 * 一次通知分发的结果。
 */
package club.ppmc.monitor.notify;

public enum NotificationResult {
    /** 至少一个渠道送达。 */
    DELIVERED,
    /** 没有配置任何可用渠道，未尝试发送。 */
    SKIPPED,
    /** 所有已配置的渠道都发送失败。 */
    FAILED
}
