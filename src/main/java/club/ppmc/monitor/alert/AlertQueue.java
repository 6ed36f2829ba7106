/**
 * AlertQueue.java
 *
 * 采集循环与告警处理循环之间唯一的交接点：一个有界、线程安全的 FIFO 队列。
 * 队列满时生产者最多等待 offerTimeout；仍然放不进去的告警会被拒绝并以 ERROR 级别记录，绝不静默丢弃。
 * wakeUp() 放入一个唤醒标记，让正在等待的消费者立即返回空结果，用于停止时不必等满一个取队列超时。
 */
package club.ppmc.monitor.alert;

import club.ppmc.monitor.model.Alert;
import club.ppmc.monitor.model.Severity;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class AlertQueue {

    private static final Alert WAKE_UP = Alert.builder()
            .id("wake-up")
            .alertType("wake-up")
            .severity(Severity.INFO)
            .component("alert-queue")
            .createdAt(Instant.EPOCH)
            .build();

    private final BlockingQueue<Alert> queue;
    private final int capacity;
    private final Duration offerTimeout;

    public AlertQueue(int capacity, Duration offerTimeout) {
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.capacity = capacity;
        this.offerTimeout = offerTimeout;
    }

    /**
     * 将告警放入队列。
     *
     * @return 是否成功入队；false 时告警已被记录为拒绝。
     */
    public boolean push(Alert alert) {
        try {
            if (queue.offer(alert, offerTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.error("告警队列已满 (容量 {})，拒绝告警 {}: {}", capacity, alert.getId(), alert.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("告警 {} 入队时线程被中断，告警未入队。", alert.getId());
            return false;
        }
    }

    /**
     * 从队列取出一个告警，最多等待 timeout。
     *
     * @return 取到的告警；超时或被唤醒时为空。
     * @throws InterruptedException 等待期间线程被中断。
     */
    public Optional<Alert> pop(Duration timeout) throws InterruptedException {
        Alert next = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return next == WAKE_UP ? Optional.empty() : Optional.ofNullable(next);
    }

    /**
     * 唤醒正在 pop 中等待的消费者。队列已满时消费者本来就不会等待，标记直接放弃。
     */
    public void wakeUp() {
        queue.offer(WAKE_UP);
    }

    public int size() {
        return queue.size();
    }
}
