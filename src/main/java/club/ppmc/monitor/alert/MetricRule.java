/**
 * MetricRule.java
 *
 * 所有告警规则的目录。枚举的声明顺序就是评估顺序，
 * 因此同一个采样触发多条规则时，候选告警的顺序是稳定且可复现的。
 * 数值规则带有内置默认阈值；状态规则只要依赖状态不是 CONNECTED 就产生 CRITICAL。
 */
package club.ppmc.monitor.alert;

import club.ppmc.monitor.model.DependencyStatus;
import club.ppmc.monitor.model.MetricSample;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

public enum MetricRule {
    CPU_USAGE("cpu_usage", "cpu-usage", "system", 80.0, 95.0,
            MetricSample::cpuPercent, "CPU 使用率%s: %.1f%%"),
    MEMORY_USAGE("memory_usage", "memory-usage", "system", 80.0, 95.0,
            MetricSample::memoryPercent, "内存使用率%s: %.1f%%"),
    DISK_USAGE("disk_usage", "disk-usage", "system", 85.0, 95.0,
            MetricSample::diskPercent, "磁盘使用率%s: %.1f%%"),
    CACHE_CONNECTION("cache_connection", "cache",
            MetricSample::cacheStatus, "缓存连接异常 (%s)，异步任务可能失败"),
    STORE_CONNECTION("store_connection", "database",
            MetricSample::storeStatus, "数据库连接异常 (%s)，应用可能无法正常工作"),
    API_PERFORMANCE("api_performance", "api-performance", "api", 2000.0, 5000.0,
            MetricSample::apiResponseTimeMs, "API 响应时间%s: %.0fms"),
    QUEUE_BACKLOG("queue_backlog", "queue-backlog", "queue", 50.0, 100.0,
            sample -> sample.queueDepth(), "任务队列积压%s: %.0f 个任务"),
    ERROR_RATE("error_rate", "error-rate", "application", 5.0, 15.0,
            MetricSample::errorRatePercent, "错误率%s: %.1f%%");

    private final String alertType;
    private final String configKey;
    private final String component;
    private final double defaultWarning;
    private final double defaultCritical;
    private final ToDoubleFunction<MetricSample> valueExtractor;
    private final Function<MetricSample, DependencyStatus> statusExtractor;
    private final String messageTemplate;

    MetricRule(String alertType, String configKey, String component,
               double defaultWarning, double defaultCritical,
               ToDoubleFunction<MetricSample> valueExtractor, String messageTemplate) {
        this.alertType = alertType;
        this.configKey = configKey;
        this.component = component;
        this.defaultWarning = defaultWarning;
        this.defaultCritical = defaultCritical;
        this.valueExtractor = valueExtractor;
        this.statusExtractor = null;
        this.messageTemplate = messageTemplate;
    }

    MetricRule(String alertType, String component,
               Function<MetricSample, DependencyStatus> statusExtractor, String messageTemplate) {
        this.alertType = alertType;
        this.configKey = null;
        this.component = component;
        this.defaultWarning = Double.NaN;
        this.defaultCritical = Double.NaN;
        this.valueExtractor = null;
        this.statusExtractor = statusExtractor;
        this.messageTemplate = messageTemplate;
    }

    public String alertType() {
        return alertType;
    }

    /** 数值规则在 monitor.thresholds 下的配置名；状态规则为 null。 */
    public String configKey() {
        return configKey;
    }

    public String component() {
        return component;
    }

    public boolean isNumeric() {
        return valueExtractor != null;
    }

    public double defaultWarning() {
        return defaultWarning;
    }

    public double defaultCritical() {
        return defaultCritical;
    }

    double valueOf(MetricSample sample) {
        return valueExtractor.applyAsDouble(sample);
    }

    DependencyStatus statusOf(MetricSample sample) {
        return statusExtractor.apply(sample);
    }

    String messageTemplate() {
        return messageTemplate;
    }

    public static Optional<MetricRule> byConfigKey(String key) {
        return Arrays.stream(values())
                .filter(MetricRule::isNumeric)
                .filter(rule -> rule.configKey.equals(key))
                .findFirst();
    }
}
