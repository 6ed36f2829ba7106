/**
 * Alert.java
 *
 * 一次阈值越界（或手动提交的测试告警）的记录。
 * 创建后不可变。解决状态只在存储中更新 (MonitorStore.resolveAlert)，读回的告警反映当时的状态。
 * 由 ThresholdEvaluator 通过 AlertFactory 创建，经 AlertQueue 交给 AlertProcessor 处理。
 */
package club.ppmc.monitor.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode(of = "id")
public class Alert {

    /** 唯一标识，格式为 {type}:{component}:{sequence}。 */
    private final String id;

    /** 触发的规则键，例如 "cpu_usage"。 */
    private final String alertType;

    private final Severity severity;
    private final String message;
    private final String component;
    private final Instant createdAt;

    /** 附加信息（观测值、阈值等），不可变。 */
    private final Map<String, Object> metadata;

    private final boolean resolved;
    private final Instant resolvedAt;

    @Builder
    public Alert(
            String id,
            String alertType,
            Severity severity,
            String message,
            String component,
            Instant createdAt,
            boolean resolved,
            Instant resolvedAt,
            Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.alertType = Objects.requireNonNull(alertType, "alertType");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = message != null ? message : "";
        this.component = Objects.requireNonNull(component, "component");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.resolved = resolved;
        this.resolvedAt = resolvedAt;
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
