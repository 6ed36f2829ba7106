/**
 * AlertProcessor.java
 *
 * 告警处理状态机：接收 -> 去重抑制（终态），或 接收 -> 持久化 / 持久化失败 -> [CRITICAL] 通知 / 通知失败（终态）。
 * 去重窗口由本类独占，只会在告警处理循环的线程中被访问。
 * 持久化与通知各自独立做了异常保护：存储失败不会阻止通知，通知失败也不会影响后续告警的处理。
 */
package club.ppmc.monitor.alert;

import club.ppmc.monitor.exception.PersistenceException;
import club.ppmc.monitor.model.Alert;
import club.ppmc.monitor.model.Severity;
import club.ppmc.monitor.notify.NotificationDispatcher;
import club.ppmc.monitor.notify.NotificationResult;
import club.ppmc.monitor.store.MonitorStore;
import java.time.Clock;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class AlertProcessor {

    private final MonitorStore store;
    private final NotificationDispatcher dispatcher;
    private final DedupWindow dedupWindow;
    private final Clock clock;

    public AlertProcessor(MonitorStore store, NotificationDispatcher dispatcher, DedupWindow dedupWindow, Clock clock) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.dedupWindow = dedupWindow;
        this.clock = clock;
    }

    /**
     * 处理一个候选告警。
     *
     * @param alert 从队列取出的候选告警。
     * @return 该告警的终态。
     */
    public ProcessingOutcome process(Alert alert) {
        Instant now = clock.instant();
        housekeeping(now);

        DedupKey key = DedupKey.of(alert);
        if (!dedupWindow.tryAcquire(key, now)) {
            log.debug("告警 {} 在去重窗口内，已抑制。", alert.getId());
            return ProcessingOutcome.SUPPRESSED;
        }

        boolean persisted = persist(alert);

        if (alert.getSeverity() != Severity.CRITICAL) {
            if (persisted) {
                return ProcessingOutcome.PERSISTED;
            }
            // 没有存下来也没有通知，释放窗口让下一次同类告警重试
            dedupWindow.release(key);
            return ProcessingOutcome.PERSIST_FAILED;
        }

        NotificationResult result;
        try {
            result = dispatcher.dispatch(alert);
        } catch (RuntimeException e) {
            log.error("发送告警 {} 的通知时发生意外错误", alert.getId(), e);
            result = NotificationResult.FAILED;
        }
        return result == NotificationResult.DELIVERED
                ? ProcessingOutcome.NOTIFIED
                : ProcessingOutcome.NOTIFICATION_FAILED;
    }

    private boolean persist(Alert alert) {
        try {
            store.appendAlert(alert);
            log.info("已记录 {} 告警 {}: {}", alert.getSeverity(), alert.getId(), alert.getMessage());
            return true;
        } catch (PersistenceException e) {
            log.error("持久化告警 {} 失败。", alert.getId(), e);
        } catch (RuntimeException e) {
            log.error("持久化告警 {} 时发生意外错误。", alert.getId(), e);
        }
        return false;
    }

    /**
     * 清理过期的去重条目。处理循环在每次取队列超时时调用，处理每个告警前也会调用。
     */
    public void housekeeping() {
        housekeeping(clock.instant());
    }

    private void housekeeping(Instant now) {
        int evicted = dedupWindow.evictExpired(now);
        if (evicted > 0) {
            log.debug("已清理 {} 个过期的去重条目。", evicted);
        }
    }

    int trackedKeys() {
        return dedupWindow.size();
    }
}
