/**
 * MetricsCollector.java
 *
 * 每个采样周期被采集循环调用一次，汇总主机指标与全部依赖探测结果，生成一个不可变的 MetricSample。
 * 依赖探测在独立的线程池中并行执行，每个探测都受其自身超时的限制；
 * 超时或异常的探测只会让对应字段取“不健康”的哨兵值，绝不会中断整个采样。
 * 超时后不会中断仍在执行的探测，它会依靠自身客户端的超时自行结束。
 */
package club.ppmc.monitor.collector;

import club.ppmc.monitor.model.DependencyStatus;
import club.ppmc.monitor.model.MetricSample;
import club.ppmc.monitor.model.ProbeResult;
import club.ppmc.monitor.probe.DependencyProbe;
import club.ppmc.monitor.probe.ErrorRateSource;
import club.ppmc.monitor.probe.QueueDepthSource;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class MetricsCollector {

    private static final int PROBE_POOL_SIZE = 8;

    private final HostMetricsSampler hostSampler;
    private final DependencyProbe cacheProbe;
    private final DependencyProbe storeProbe;
    private final DependencyProbe apiProbe;
    private final QueueDepthSource queueDepthSource;
    private final ErrorRateSource errorRateSource;
    private final Clock clock;
    private final ExecutorService probeExecutor;

    // 上一个采样时间戳，保证同一采集器内时间戳严格递增
    private Instant lastTimestamp = Instant.MIN;

    public MetricsCollector(
            HostMetricsSampler hostSampler,
            @Qualifier("cacheProbe") DependencyProbe cacheProbe,
            @Qualifier("storeProbe") DependencyProbe storeProbe,
            @Qualifier("apiProbe") DependencyProbe apiProbe,
            QueueDepthSource queueDepthSource,
            ErrorRateSource errorRateSource,
            Clock clock) {
        this.hostSampler = hostSampler;
        this.cacheProbe = cacheProbe;
        this.storeProbe = storeProbe;
        this.apiProbe = apiProbe;
        this.queueDepthSource = queueDepthSource;
        this.errorRateSource = errorRateSource;
        this.clock = clock;
        var threadFactory = new CustomizableThreadFactory("monitor-probe-");
        threadFactory.setDaemon(true);
        this.probeExecutor = Executors.newFixedThreadPool(PROBE_POOL_SIZE, threadFactory);
    }

    /**
     * 采集一次完整的指标快照。该方法从不抛出异常。
     *
     * @return 本周期的快照；即使所有依赖都不可用也会返回一个降级后的快照。
     */
    public MetricSample collect() {
        Instant timestamp = nextTimestamp();
        try {
            // 先并行启动全部探测，再逐个等待，总耗时受最慢的探测超时约束
            Future<ProbeResult> cache = probeExecutor.submit(cacheProbe::probe);
            Future<ProbeResult> store = probeExecutor.submit(storeProbe::probe);
            Future<ProbeResult> api = probeExecutor.submit(apiProbe::probe);
            Future<Long> queueDepth = probeExecutor.submit((Callable<Long>) queueDepthSource::currentDepth);
            Future<Double> errorRate = probeExecutor.submit((Callable<Double>) errorRateSource::recentErrorRatePercent);

            HostMetricsSampler.HostMetrics host = sampleHost();

            return new MetricSample(
                    timestamp,
                    host.cpuPercent(),
                    host.memoryPercent(),
                    host.diskPercent(),
                    host.activeConnections(),
                    toStatus(cacheProbe.name(), await(cacheProbe.name(), cache, cacheProbe.timeout())),
                    toStatus(storeProbe.name(), await(storeProbe.name(), store, storeProbe.timeout())),
                    toResponseTime(await(apiProbe.name(), api, apiProbe.timeout())),
                    toQueueDepth(await("queue-depth", queueDepth, queueDepthSource.timeout())),
                    toErrorRate(await("error-rate", errorRate, errorRateSource.timeout())));
        } catch (RuntimeException e) {
            log.error("构建指标快照时发生意外错误，返回全降级快照。", e);
            return MetricSample.degraded(timestamp);
        }
    }

    private HostMetricsSampler.HostMetrics sampleHost() {
        try {
            return hostSampler.sample();
        } catch (RuntimeException e) {
            log.warn("采集主机指标失败: {}", e.getMessage());
            return HostMetricsSampler.HostMetrics.unavailable();
        }
    }

    /**
     * 在给定超时内等待探测结果。超时、异常和中断都转换为失败的 Outcome。
     */
    private <T> Outcome<T> await(String name, Future<T> future, Duration timeout) {
        try {
            return Outcome.success(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            log.warn("依赖探测 {} 在 {} ms 内未完成，使用降级值。", name, timeout.toMillis());
            return Outcome.failure();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("依赖探测 {} 失败: {}", name, cause.toString());
            return Outcome.failure();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待依赖探测 {} 时线程被中断，使用降级值。", name);
            return Outcome.failure();
        }
    }

    private static DependencyStatus toStatus(String name, Outcome<ProbeResult> outcome) {
        if (!outcome.succeeded() || outcome.value() == null) {
            return DependencyStatus.ERROR;
        }
        if (!outcome.value().healthy()) {
            log.warn("依赖 {} 不可用。", name);
            return DependencyStatus.DISCONNECTED;
        }
        return DependencyStatus.CONNECTED;
    }

    private static double toResponseTime(Outcome<ProbeResult> outcome) {
        if (!outcome.succeeded() || outcome.value() == null || !outcome.value().healthy()) {
            return MetricSample.FAILED_API_RESPONSE_MS;
        }
        return outcome.value().latencyMs();
    }

    private static long toQueueDepth(Outcome<Long> outcome) {
        if (!outcome.succeeded() || outcome.value() == null) {
            return 0;
        }
        return Math.max(0, outcome.value());
    }

    private static double toErrorRate(Outcome<Double> outcome) {
        if (!outcome.succeeded() || outcome.value() == null || outcome.value().isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, outcome.value()));
    }

    private synchronized Instant nextTimestamp() {
        Instant now = clock.instant();
        if (!now.isAfter(lastTimestamp)) {
            now = lastTimestamp.plusMillis(1);
        }
        lastTimestamp = now;
        return now;
    }

    @PreDestroy
    public void shutdown() {
        probeExecutor.shutdownNow();
    }

    /**
     * 一次等待的结果：成功时携带值，失败时 value 为 null。
     */
    private record Outcome<T>(boolean succeeded, T value) {

        static <T> Outcome<T> success(T value) {
            return new Outcome<>(true, value);
        }

        static <T> Outcome<T> failure() {
            return new Outcome<>(false, null);
        }
    }
}
