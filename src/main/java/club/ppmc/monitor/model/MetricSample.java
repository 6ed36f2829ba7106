/**
 * MetricSample.java
 *
 * 某一时刻主机与外部依赖健康状况的不可变快照。
 * 由 MetricsCollector 在每个采样周期生成一次，写入存储后不再修改。
 * 任何字段在探测失败时都必须有一个保守的“不健康”哨兵值，而不是缺失。
 */
package club.ppmc.monitor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 一次采样的全部指标。
 *
 * @param timestamp          采样时间，同一采集器内严格递增。
 * @param cpuPercent         CPU 使用率 (0-100)。
 * @param memoryPercent      内存使用率 (0-100)。
 * @param diskPercent        磁盘使用率 (0-100)。
 * @param activeConnections  活动网络连接数。
 * @param cacheStatus        缓存依赖状态。
 * @param storeStatus        关系型存储依赖状态。
 * @param apiResponseTimeMs  外部 API 响应时间（毫秒），失败时为 {@link #FAILED_API_RESPONSE_MS}。
 * @param queueDepth         工作队列积压任务数。
 * @param errorRatePercent   最近窗口内的错误率 (0-100)。
 */
public record MetricSample(
        Instant timestamp,
        double cpuPercent,
        double memoryPercent,
        double diskPercent,
        int activeConnections,
        DependencyStatus cacheStatus,
        DependencyStatus storeStatus,
        double apiResponseTimeMs,
        long queueDepth,
        double errorRatePercent
) {

    /** API 探测失败时使用的响应时间哨兵值。 */
    public static final double FAILED_API_RESPONSE_MS = 9999.0;

    public MetricSample {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(cacheStatus, "cacheStatus");
        Objects.requireNonNull(storeStatus, "storeStatus");
        if (activeConnections < 0) {
            throw new IllegalArgumentException("activeConnections must not be negative: " + activeConnections);
        }
        if (queueDepth < 0) {
            throw new IllegalArgumentException("queueDepth must not be negative: " + queueDepth);
        }
    }

    /**
     * 整个采样过程失败时使用的全降级快照。
     * 依赖全部标记为 ERROR，API 延迟取哨兵值，错误率取 100%，
     * 这样“全部不可用”本身就是一个可被告警的状态。
     */
    public static MetricSample degraded(Instant timestamp) {
        return new MetricSample(
                timestamp,
                0.0,
                0.0,
                0.0,
                0,
                DependencyStatus.ERROR,
                DependencyStatus.ERROR,
                FAILED_API_RESPONSE_MS,
                0,
                100.0);
    }
}
