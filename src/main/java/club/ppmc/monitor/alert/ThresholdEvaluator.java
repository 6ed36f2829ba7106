/**
 * ThresholdEvaluator.java
 *
 * 将一个 MetricSample 与阈值配置比较，产生零个或多个候选告警。
 * 除了从 AlertFactory 领取告警 ID 之外没有任何副作用，不做 I/O。
 *
 * 数值规则：value >= critical 产生一个 CRITICAL；否则 value >= warning 产生一个 WARNING；否则不产生。
 * 同一规则对同一采样最多只产生一个告警。状态规则：依赖状态不是 CONNECTED 时产生一个 CRITICAL。
 * 候选告警按 MetricRule 的声明顺序输出。
 */
package club.ppmc.monitor.alert;

import club.ppmc.monitor.config.ThresholdConfig;
import club.ppmc.monitor.config.ThresholdConfig.ThresholdLevels;
import club.ppmc.monitor.model.Alert;
import club.ppmc.monitor.model.DependencyStatus;
import club.ppmc.monitor.model.MetricSample;
import club.ppmc.monitor.model.Severity;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ThresholdEvaluator {

    private final AlertFactory alertFactory;

    public ThresholdEvaluator(AlertFactory alertFactory) {
        this.alertFactory = alertFactory;
    }

    public List<Alert> evaluate(MetricSample sample, ThresholdConfig config) {
        List<Alert> candidates = new ArrayList<>();
        for (MetricRule rule : MetricRule.values()) {
            Alert alert = rule.isNumeric()
                    ? evaluateNumeric(rule, sample, config.levelsFor(rule))
                    : evaluateStatus(rule, sample);
            if (alert != null) {
                candidates.add(alert);
            }
        }
        return candidates;
    }

    private Alert evaluateNumeric(MetricRule rule, MetricSample sample, ThresholdLevels levels) {
        double value = rule.valueOf(sample);
        Severity severity;
        double threshold;
        if (value >= levels.critical()) {
            severity = Severity.CRITICAL;
            threshold = levels.critical();
        } else if (value >= levels.warning()) {
            severity = Severity.WARNING;
            threshold = levels.warning();
        } else {
            // 也覆盖 NaN：与任何数比较都为 false
            return null;
        }

        String qualifier = severity == Severity.CRITICAL ? "严重" : "过高";
        String message = String.format(Locale.ROOT, rule.messageTemplate(), qualifier, value);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("threshold_breach", true);
        metadata.put("value", value);
        metadata.put("threshold", threshold);
        return alertFactory.create(rule.alertType(), severity, message, rule.component(), metadata, sample.timestamp());
    }

    private Alert evaluateStatus(MetricRule rule, MetricSample sample) {
        DependencyStatus status = rule.statusOf(sample);
        if (status.isHealthy()) {
            return null;
        }
        String message = String.format(Locale.ROOT, rule.messageTemplate(), status.wireValue());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("threshold_breach", true);
        metadata.put("status", status.wireValue());
        return alertFactory.create(
                rule.alertType(), Severity.CRITICAL, message, rule.component(), metadata, sample.timestamp());
    }
}
