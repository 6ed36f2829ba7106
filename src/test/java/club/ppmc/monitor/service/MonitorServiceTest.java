package club.ppmc.monitor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import club.ppmc.monitor.Samples;
import club.ppmc.monitor.alert.AlertFactory;
import club.ppmc.monitor.alert.ThresholdEvaluator;
import club.ppmc.monitor.collector.MetricsCollector;
import club.ppmc.monitor.config.MonitorProperties;
import club.ppmc.monitor.config.ThresholdConfig;
import club.ppmc.monitor.exception.PersistenceException;
import club.ppmc.monitor.model.Alert;
import club.ppmc.monitor.model.Severity;
import club.ppmc.monitor.notify.NotificationDispatcher;
import club.ppmc.monitor.notify.NotificationResult;
import club.ppmc.monitor.store.MonitorStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MonitorService 后台循环")
class MonitorServiceTest {

    private MetricsCollector collector;
    private MonitorStore store;
    private NotificationDispatcher dispatcher;
    private MonitorService service;

    private final AtomicReference<Double> cpu = new AtomicReference<>(10.0);
    private final AtomicInteger collections = new AtomicInteger();

    @BeforeEach
    void setUp() {
        collector = mock(MetricsCollector.class);
        when(collector.collect()).thenAnswer(invocation -> {
            collections.incrementAndGet();
            return Samples.withCpu(Instant.now(), cpu.get());
        });
        store = mock(MonitorStore.class);
        dispatcher = mock(NotificationDispatcher.class);
        when(dispatcher.dispatch(any())).thenReturn(NotificationResult.DELIVERED);

        service = newService(Duration.ofMillis(50), Duration.ofMillis(50));
    }

    private MonitorService newService(Duration samplingInterval, Duration pollTimeout) {
        MonitorProperties properties = new MonitorProperties();
        properties.setSamplingInterval(samplingInterval);
        properties.getQueue().setPollTimeout(pollTimeout);

        Clock clock = Clock.systemUTC();
        AlertFactory factory = new AlertFactory(clock);
        return new MonitorService(collector, new ThresholdEvaluator(factory), ThresholdConfig.defaults(),
                store, dispatcher, factory, properties, clock);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    @DisplayName("启动后周期性采样并持久化快照")
    void collectsPeriodically() {
        assertThat(service.lastHealthCheck()).isEmpty();

        service.startMonitoring();

        assertThat(service.isMonitoringActive()).isTrue();
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(store, atLeast(3)).appendMetric(any()));
        assertThat(service.lastHealthCheck()).isPresent();
        assertThat(service.activeLoopCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("停止后两个循环都退出，不再采样")
    void stopTerminatesBothLoops() throws InterruptedException {
        service.startMonitoring();
        await().atMost(Duration.ofSeconds(5)).until(() -> service.activeLoopCount() == 2);

        service.stopMonitoring();

        assertThat(service.isMonitoringActive()).isFalse();
        await().atMost(Duration.ofSeconds(5)).until(() -> service.activeLoopCount() == 0);
        int collectedAtStop = collections.get();
        Thread.sleep(200);
        assertThat(collections.get()).isEqualTo(collectedAtStop);
    }

    @Test
    @DisplayName("重复启动无效果，停止后可以再次启动")
    void startIsIdempotentAndRestartable() {
        service.startMonitoring();
        service.startMonitoring();
        await().atMost(Duration.ofSeconds(5)).until(() -> service.activeLoopCount() == 2);

        service.stopMonitoring();
        await().atMost(Duration.ofSeconds(5)).until(() -> service.activeLoopCount() == 0);

        service.startMonitoring();
        await().atMost(Duration.ofSeconds(5)).until(() -> service.activeLoopCount() == 2);
        assertThat(service.isMonitoringActive()).isTrue();
    }

    @Test
    @DisplayName("出错退避期间停止，两个循环在一个采样周期内退出")
    void stopDuringErrorBackoffExitsPromptly() {
        doAnswer(invocation -> {
            collections.incrementAndGet();
            throw new IllegalStateException("OSHI 读取失败");
        }).when(collector).collect();
        service.shutdown();
        service = newService(Duration.ofSeconds(1), Duration.ofSeconds(30));

        service.startMonitoring();
        await().atMost(Duration.ofSeconds(5)).until(() -> collections.get() >= 1 && service.activeLoopCount() == 2);

        service.stopMonitoring();

        await().atMost(Duration.ofMillis(900)).until(() -> service.activeLoopCount() == 0);
        assertThat(collections.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("停止后立即重新启动，新一轮循环正常消费队列")
    void restartRightAfterStopKeepsProcessing() {
        service.shutdown();
        service = newService(Duration.ofSeconds(1), Duration.ofSeconds(30));
        service.startMonitoring();
        await().atMost(Duration.ofSeconds(5)).until(() -> service.activeLoopCount() == 2);

        service.stopMonitoring();
        service.startMonitoring();

        assertThat(service.isMonitoringActive()).isTrue();
        await().atMost(Duration.ofSeconds(5)).until(() -> service.activeLoopCount() == 2);
        Alert alert = service.submitTestAlert(Severity.WARNING, "重启后自检");
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(store).appendAlert(alert));
    }

    @Test
    @DisplayName("持续越界只通知一次")
    void sustainedBreachNotifiesOnce() {
        cpu.set(97.0);

        service.startMonitoring();

        await().atMost(Duration.ofSeconds(5)).until(() -> collections.get() >= 5);
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                verify(dispatcher).dispatch(argThat(alert -> "cpu_usage".equals(alert.getAlertType()))));
        verify(dispatcher, times(1)).dispatch(any());
        verify(store, times(1)).appendAlert(any());
    }

    @Test
    @DisplayName("快照持久化失败不影响告警")
    void metricPersistenceFailureDoesNotStopAlerts() {
        doThrow(new PersistenceException("appendMetric", "database is locked")).when(store).appendMetric(any());
        cpu.set(85.0);

        service.startMonitoring();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                verify(store).appendAlert(argThat(alert -> alert.getSeverity() == Severity.WARNING)));
        await().atMost(Duration.ofSeconds(5)).until(() -> collections.get() >= 3);
    }

    @Test
    @DisplayName("未运行时拒绝测试告警")
    void testAlertRejectedWhenInactive() {
        assertThatThrownBy(() -> service.submitTestAlert(Severity.CRITICAL, "test"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("测试告警走完整条告警管线")
    void testAlertFlowsThroughPipeline() {
        service.startMonitoring();

        Alert alert = service.submitTestAlert(Severity.CRITICAL, "管线自检");

        assertThat(alert.getAlertType()).isEqualTo("test_alert");
        assertThat(alert.getComponent()).isEqualTo("admin_test");
        assertThat(alert.getMetadata()).containsEntry("test", true);
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            verify(store).appendAlert(alert);
            verify(dispatcher).dispatch(alert);
        });
    }

    @Test
    @DisplayName("运维人员解决告警时使用当前时间")
    void resolveAlertUsesCurrentTime() {
        when(store.resolveAlert(eq("cpu_usage:system:7"), any())).thenReturn(true);
        Instant before = Instant.now();

        assertThat(service.resolveAlert("cpu_usage:system:7")).isTrue();

        verify(store).resolveAlert(eq("cpu_usage:system:7"),
                argThat(at -> !at.isBefore(before) && !at.isAfter(Instant.now())));
    }

    @Test
    @DisplayName("不存在的告警返回 false，空 ID 被拒绝")
    void resolveAlertEdgeCases() {
        assertThat(service.resolveAlert("missing")).isFalse();

        assertThatThrownBy(() -> service.resolveAlert(" "))
                .isInstanceOf(IllegalArgumentException.class);
        verify(store, never()).resolveAlert(eq(" "), any());
    }
}
