/**
 * AlertFactory.java
 *
 * 统一创建告警并分配唯一 ID。
 * ID 格式为 {type}:{component}:{sequence}，sequence 是进程内单调递增的计数器，
 * 以启动时的毫秒时间戳为初值，因此同一秒内的大量告警以及重启前后的告警都不会冲突。
 */
package club.ppmc.monitor.alert;

import club.ppmc.monitor.model.Alert;
import club.ppmc.monitor.model.Severity;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class AlertFactory {

    private final Clock clock;
    private final AtomicLong sequence;

    public AlertFactory(Clock clock) {
        this.clock = clock;
        this.sequence = new AtomicLong(clock.millis());
    }

    /**
     * 以当前时间创建告警。
     */
    public Alert create(String alertType, Severity severity, String message, String component,
                        Map<String, Object> metadata) {
        return create(alertType, severity, message, component, metadata, clock.instant());
    }

    public Alert create(String alertType, Severity severity, String message, String component,
                        Map<String, Object> metadata, Instant createdAt) {
        return Alert.builder()
                .id(nextId(alertType, component))
                .alertType(alertType)
                .severity(severity)
                .message(message)
                .component(component)
                .createdAt(createdAt)
                .metadata(metadata)
                .build();
    }

    private String nextId(String alertType, String component) {
        return alertType + ":" + component + ":" + sequence.incrementAndGet();
    }
}
