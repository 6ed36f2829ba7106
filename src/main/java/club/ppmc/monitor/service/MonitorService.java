/**
 * MonitorService.java
 *
 * 监控子系统的唯一实例，持有自己的告警队列、去重窗口和存储句柄，并管理两个相互独立的后台循环：
 *   1. 采集循环：采集 -> 持久化快照 -> 阈值评估 -> 告警入队 -> 休眠一个采样周期；
 *      出现意外异常时记录日志并休眠两个周期，避免空转。
 *   2. 处理循环：从队列取告警（带超时）-> 超时则清理去重窗口，否则 去重 -> 持久化 -> 通知。
 * 两个循环只通过 AlertQueue 通信。停止是协作式的：每次启动都会发放一个新的运行令牌，
 * 循环在每轮开始时检查令牌；休眠（包括出错后的退避）等待在令牌上，停止请求会立即唤醒它，
 * 正在等待队列的处理循环则由 AlertQueue.wakeUp() 唤醒。再次启动前会等待上一轮的两个循环退出。
 * 循环线程不是守护线程，监控运行期间它们使进程保持存活。
 */
package club.ppmc.monitor.service;

import club.ppmc.monitor.alert.AlertFactory;
import club.ppmc.monitor.alert.AlertProcessor;
import club.ppmc.monitor.alert.AlertQueue;
import club.ppmc.monitor.alert.DedupWindow;
import club.ppmc.monitor.alert.ThresholdEvaluator;
import club.ppmc.monitor.collector.MetricsCollector;
import club.ppmc.monitor.config.MonitorProperties;
import club.ppmc.monitor.config.ThresholdConfig;
import club.ppmc.monitor.exception.PersistenceException;
import club.ppmc.monitor.model.Alert;
import club.ppmc.monitor.model.MetricSample;
import club.ppmc.monitor.model.Severity;
import club.ppmc.monitor.notify.NotificationDispatcher;
import club.ppmc.monitor.store.MonitorStore;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class MonitorService {

    private static final String TEST_ALERT_TYPE = "test_alert";
    private static final String TEST_ALERT_COMPONENT = "admin_test";

    private final MetricsCollector collector;
    private final ThresholdEvaluator evaluator;
    private final ThresholdConfig thresholdConfig;
    private final MonitorStore store;
    private final AlertFactory alertFactory;
    private final Clock clock;
    private final Duration samplingInterval;
    private final Duration pollTimeout;
    private final Duration restartGrace;

    private final AlertQueue alertQueue;
    private final AlertProcessor alertProcessor;

    private final ExecutorService collectorExecutor;
    private final ExecutorService processorExecutor;

    // 当前运行的令牌；为 null 或已停止表示未运行
    private final AtomicReference<RunToken> runToken = new AtomicReference<>();
    private final AtomicReference<Instant> lastHealthCheck = new AtomicReference<>();
    private final AtomicInteger activeLoops = new AtomicInteger();

    public MonitorService(
            MetricsCollector collector,
            ThresholdEvaluator evaluator,
            ThresholdConfig thresholdConfig,
            MonitorStore store,
            NotificationDispatcher dispatcher,
            AlertFactory alertFactory,
            MonitorProperties properties,
            Clock clock) {
        this.collector = collector;
        this.evaluator = evaluator;
        this.thresholdConfig = thresholdConfig;
        this.store = store;
        this.alertFactory = alertFactory;
        this.clock = clock;
        this.samplingInterval = properties.getSamplingInterval();
        this.pollTimeout = properties.getQueue().getPollTimeout();
        // 停止后循环最多还要完成一次采集：一个采样周期加上全部探测时限
        MonitorProperties.Probes probes = properties.getProbes();
        this.restartGrace = samplingInterval
                .plus(probes.getCacheTimeout())
                .plus(probes.getStoreTimeout())
                .plus(probes.getApiTimeout())
                .plus(probes.getErrorRateTimeout());

        this.alertQueue = new AlertQueue(properties.getQueue().getCapacity(), properties.getQueue().getOfferTimeout());
        this.alertProcessor = new AlertProcessor(store, dispatcher, new DedupWindow(properties.getDedupWindow()), clock);

        this.collectorExecutor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("monitor-collector-"));
        this.processorExecutor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("monitor-alert-processor-"));
    }

    /**
     * 启动两个后台循环。已经在运行时调用无效果。
     * 上一轮的循环仍在退出时，先等待它们结束（最多一个采样周期加上全部探测时限）。
     */
    public synchronized void startMonitoring() {
        RunToken previous = runToken.get();
        if (previous != null && previous.isRunning()) {
            log.info("后台监控已在运行，忽略重复启动。");
            return;
        }
        if (previous != null) {
            awaitPreviousRun(previous);
        }
        RunToken token = new RunToken();
        runToken.set(token);
        collectorExecutor.execute(() -> collectorLoop(token));
        processorExecutor.execute(() -> processorLoop(token));
        log.info("后台监控已启动，采样周期 {}，队列轮询超时 {}。", samplingInterval, pollTimeout);
    }

    private void awaitPreviousRun(RunToken previous) {
        try {
            if (!previous.awaitExit(restartGrace)) {
                log.warn("上一轮监控循环未能在 {} 内退出，新循环将在其结束后开始。", restartGrace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待上一轮监控循环退出时线程被中断。");
        }
    }

    /**
     * 请求停止两个后台循环。正在休眠或等待队列的循环会被立即唤醒并退出；
     * 正在采集或处理告警的循环在当前这一步完成后退出。
     */
    public synchronized void stopMonitoring() {
        RunToken token = runToken.get();
        if (token == null || !token.isRunning()) {
            return;
        }
        token.stop();
        alertQueue.wakeUp();
        log.info("后台监控已请求停止。");
    }

    public boolean isMonitoringActive() {
        RunToken token = runToken.get();
        return token != null && token.isRunning();
    }

    /**
     * 最近一次完成采样的时间；从未采样时为空。
     */
    public Optional<Instant> lastHealthCheck() {
        return Optional.ofNullable(lastHealthCheck.get());
    }

    /**
     * 提交一条测试告警，用于验证告警管线（去重、持久化、通知）是否工作正常。
     *
     * @param severity 测试告警的级别；CRITICAL 会触发一次真实的通知。
     * @param message  告警内容。
     * @return 已入队的告警。
     * @throws IllegalStateException 监控未运行（没有处理循环消费队列）或队列已满时。
     */
    public Alert submitTestAlert(Severity severity, String message) {
        if (!isMonitoringActive()) {
            throw new IllegalStateException("后台监控未运行，无法提交测试告警");
        }
        Alert alert = alertFactory.create(
                TEST_ALERT_TYPE, severity, message, TEST_ALERT_COMPONENT, Map.of("test", true));
        if (!alertQueue.push(alert)) {
            throw new IllegalStateException("告警队列已满，测试告警未入队: " + alert.getId());
        }
        log.info("测试告警 {} 已入队。", alert.getId());
        return alert;
    }

    /**
     * 由运维人员将告警标记为已解决，解决时间取当前时间。
     *
     * @param alertId 告警 ID。
     * @return 是否有告警被更新；告警不存在或已解决时为 false。
     * @throws club.ppmc.monitor.exception.PersistenceException 存储不可用时。
     */
    public boolean resolveAlert(String alertId) {
        if (alertId == null || alertId.isBlank()) {
            throw new IllegalArgumentException("告警 ID 不能为空");
        }
        boolean resolved = store.resolveAlert(alertId, clock.instant());
        if (resolved) {
            log.info("告警 {} 已标记为已解决。", alertId);
        } else {
            log.info("告警 {} 不存在或已解决，未做更改。", alertId);
        }
        return resolved;
    }

    private void collectorLoop(RunToken token) {
        activeLoops.incrementAndGet();
        log.info("采集循环已启动。");
        try {
            while (token.isRunning()) {
                Duration pause = samplingInterval;
                try {
                    runCollectionCycle(token);
                } catch (RuntimeException e) {
                    log.error("采集循环出错，{} 后重试。", samplingInterval.multipliedBy(2), e);
                    pause = samplingInterval.multipliedBy(2);
                }
                if (token.awaitStop(pause)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            activeLoops.decrementAndGet();
            token.loopExited();
            log.info("采集循环已退出。");
        }
    }

    private void runCollectionCycle(RunToken token) {
        MetricSample sample = collector.collect();
        if (!token.isRunning()) {
            // 采集期间收到了停止请求，本周期的结果不再产出
            return;
        }
        lastHealthCheck.set(sample.timestamp());

        try {
            store.appendMetric(sample);
        } catch (PersistenceException e) {
            log.error("持久化指标快照失败，继续评估告警。", e);
        }

        List<Alert> candidates = evaluator.evaluate(sample, thresholdConfig);
        for (Alert alert : candidates) {
            alertQueue.push(alert);
        }
        if (!candidates.isEmpty()) {
            log.debug("本周期产生 {} 个候选告警。", candidates.size());
        }
    }

    private void processorLoop(RunToken token) {
        activeLoops.incrementAndGet();
        log.info("告警处理循环已启动。");
        try {
            while (token.isRunning()) {
                try {
                    Optional<Alert> next = alertQueue.pop(pollTimeout);
                    if (next.isEmpty()) {
                        alertProcessor.housekeeping();
                        continue;
                    }
                    alertProcessor.process(next.get());
                } catch (RuntimeException e) {
                    log.error("处理告警时出错，继续处理下一条。", e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            activeLoops.decrementAndGet();
            token.loopExited();
            log.info("告警处理循环已退出。");
        }
    }

    /** 当前仍在执行的后台循环数（0 到 2）。 */
    int activeLoopCount() {
        return activeLoops.get();
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 MonitorService...");
        stopMonitoring();
        collectorExecutor.shutdownNow();
        processorExecutor.shutdownNow();
        try {
            if (!collectorExecutor.awaitTermination(1, TimeUnit.SECONDS)
                    || !processorExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                log.warn("监控循环未能在 1 秒内结束。");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 一次启动对应的运行令牌。停止信号可以唤醒正在休眠的循环，两个循环退出时各自登记。
     */
    private static final class RunToken {

        private final CountDownLatch stopSignal = new CountDownLatch(1);
        private final CountDownLatch exited = new CountDownLatch(2);

        boolean isRunning() {
            return stopSignal.getCount() > 0;
        }

        void stop() {
            stopSignal.countDown();
        }

        /**
         * 休眠至多 pause。
         *
         * @return 期间收到停止请求时为 true。
         */
        boolean awaitStop(Duration pause) throws InterruptedException {
            return stopSignal.await(pause.toMillis(), TimeUnit.MILLISECONDS);
        }

        void loopExited() {
            exited.countDown();
        }

        boolean awaitExit(Duration timeout) throws InterruptedException {
            return exited.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
