/**
 * ProcessingOutcome.java
 *
 * 一个候选告警在 AlertProcessor 中的终态。
 */
package club.ppmc.monitor.alert;

public enum ProcessingOutcome {
    /** 在去重窗口内，既未持久化也未通知。 */
    SUPPRESSED,
    /** 非 CRITICAL，已写入存储，不需要通知。 */
    PERSISTED,
    /** 非 CRITICAL，写入存储失败（已记录日志），去重窗口已释放。 */
    PERSIST_FAILED,
    /** CRITICAL，已至少通过一个渠道送达。持久化是否成功不影响该状态，失败另有日志。 */
    NOTIFIED,
    /** CRITICAL，通知未送达（渠道失败或未配置）。 */
    NOTIFICATION_FAILED
}
