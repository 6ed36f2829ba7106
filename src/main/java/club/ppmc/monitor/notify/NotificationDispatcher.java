/**
 * NotificationDispatcher.java
 *
 * 尽力而为地把 CRITICAL 告警投递到所有已配置的通知渠道。
 * 每个渠道每次调用只尝试一次，失败只记录日志，不重试、不退避，也不向调用方抛出异常；
 * 告警本身已经持久化，可由仪表盘或人工跟进。没有任何渠道配置时退化为记录一条警告的空操作。
 */
package club.ppmc.monitor.notify;

import club.ppmc.monitor.model.Alert;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class NotificationDispatcher {

    private final List<NotificationChannel> channels;

    public NotificationDispatcher(List<NotificationChannel> channels) {
        this.channels = List.copyOf(channels);
    }

    /**
     * 投递一条告警。
     *
     * @param alert 要投递的告警。
     * @return 投递结果，从不抛出异常。
     */
    public NotificationResult dispatch(Alert alert) {
        List<NotificationChannel> configured = channels.stream()
                .filter(NotificationChannel::isConfigured)
                .toList();
        if (configured.isEmpty()) {
            log.warn("未配置任何通知渠道（SMTP 凭据/收件人或 Webhook），无法发送告警 {}", alert.getId());
            return NotificationResult.SKIPPED;
        }

        boolean delivered = false;
        for (NotificationChannel channel : configured) {
            try {
                channel.send(alert);
                delivered = true;
                log.info("告警 {} 已通过 {} 发送。", alert.getId(), channel.name());
            } catch (Exception e) {
                log.error("通过 {} 发送告警 {} 失败", channel.name(), alert.getId(), e);
            }
        }
        return delivered ? NotificationResult.DELIVERED : NotificationResult.FAILED;
    }
}
