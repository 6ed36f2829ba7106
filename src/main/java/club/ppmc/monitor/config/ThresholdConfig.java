/**
 * ThresholdConfig.java
 *
 * 经过校验的阈值配置：每条数值规则对应一对 (warning, critical)。
 * 在启动时由 MonitorProperties 构建一次，之后不可变，可被采集循环安全地共享。
 */
package club.ppmc.monitor.config;

import club.ppmc.monitor.alert.MetricRule;
import club.ppmc.monitor.exception.MonitorConfigurationException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public final class ThresholdConfig {

    private static final String KEY_PREFIX = "monitor.thresholds.";

    private final Map<MetricRule, ThresholdLevels> levels;

    private ThresholdConfig(Map<MetricRule, ThresholdLevels> levels) {
        this.levels = Collections.unmodifiableMap(levels);
    }

    /**
     * 全部使用内置默认值的配置。
     */
    public static ThresholdConfig defaults() {
        return from(Map.of());
    }

    /**
     * 以内置默认值为基础，叠加配置文件中给出的阈值，并逐条校验。
     *
     * @param overrides 配置名 -> 阈值，可以只给出 warning 或 critical 其中之一。
     * @return 校验通过的配置。
     * @throws MonitorConfigurationException 出现未知规则、负数或非有限数值、或 warning >= critical 时。
     */
    public static ThresholdConfig from(Map<String, MonitorProperties.Threshold> overrides) {
        for (String key : overrides.keySet()) {
            if (MetricRule.byConfigKey(key).isEmpty()) {
                throw new MonitorConfigurationException("未知的阈值规则: " + key, KEY_PREFIX + key);
            }
        }

        Map<MetricRule, ThresholdLevels> levels = new EnumMap<>(MetricRule.class);
        for (MetricRule rule : MetricRule.values()) {
            if (!rule.isNumeric()) {
                continue;
            }
            MonitorProperties.Threshold override = overrides.get(rule.configKey());
            double warning = rule.defaultWarning();
            double critical = rule.defaultCritical();
            if (override != null) {
                if (override.getWarning() != null) {
                    warning = override.getWarning();
                }
                if (override.getCritical() != null) {
                    critical = override.getCritical();
                }
            }
            levels.put(rule, validate(rule, warning, critical));
        }
        return new ThresholdConfig(levels);
    }

    private static ThresholdLevels validate(MetricRule rule, double warning, double critical) {
        String key = KEY_PREFIX + rule.configKey();
        if (!Double.isFinite(warning) || !Double.isFinite(critical)) {
            throw new MonitorConfigurationException(
                    String.format("规则 %s 的阈值必须是有限数值: warning=%s, critical=%s", rule.configKey(), warning, critical),
                    key);
        }
        if (warning < 0 || critical < 0) {
            throw new MonitorConfigurationException(
                    String.format("规则 %s 的阈值不能为负数: warning=%s, critical=%s", rule.configKey(), warning, critical),
                    key);
        }
        if (warning >= critical) {
            throw new MonitorConfigurationException(
                    String.format("规则 %s 的 warning (%s) 必须小于 critical (%s)", rule.configKey(), warning, critical),
                    key);
        }
        return new ThresholdLevels(warning, critical);
    }

    /**
     * 获取某条数值规则的阈值。
     *
     * @throws IllegalArgumentException 如果传入的是状态规则。
     */
    public ThresholdLevels levelsFor(MetricRule rule) {
        ThresholdLevels result = levels.get(rule);
        if (result == null) {
            throw new IllegalArgumentException("规则 " + rule + " 没有数值阈值");
        }
        return result;
    }

    @Override
    public String toString() {
        return "ThresholdConfig" + levels;
    }

    /**
     * 单条规则的两级阈值。比较使用 >=，即等于阈值即触发。
     */
    public record ThresholdLevels(double warning, double critical) {}
}
