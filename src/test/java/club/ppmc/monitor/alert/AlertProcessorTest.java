package club.ppmc.monitor.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import club.ppmc.monitor.MutableClock;
import club.ppmc.monitor.Samples;
import club.ppmc.monitor.config.ThresholdConfig;
import club.ppmc.monitor.exception.PersistenceException;
import club.ppmc.monitor.model.Alert;
import club.ppmc.monitor.model.Severity;
import club.ppmc.monitor.notify.NotificationDispatcher;
import club.ppmc.monitor.notify.NotificationResult;
import club.ppmc.monitor.store.MonitorStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("AlertProcessor 去重、持久化与通知")
class AlertProcessorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private MonitorStore store;
    private NotificationDispatcher dispatcher;
    private AlertFactory factory;
    private AlertProcessor processor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = mock(MonitorStore.class);
        dispatcher = mock(NotificationDispatcher.class);
        when(dispatcher.dispatch(any())).thenReturn(NotificationResult.DELIVERED);
        factory = new AlertFactory(clock);
        processor = new AlertProcessor(store, dispatcher, new DedupWindow(Duration.ofMinutes(5)), clock);
    }

    private Alert alert(String type, String component, Severity severity) {
        return factory.create(type, severity, "m", component, Map.of());
    }

    @Test
    @DisplayName("WARNING 只持久化，不通知")
    void warningIsPersistedOnly() {
        Alert warning = alert("memory_usage", "system", Severity.WARNING);

        assertThat(processor.process(warning)).isEqualTo(ProcessingOutcome.PERSISTED);
        verify(store).appendAlert(warning);
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    @DisplayName("CRITICAL 持久化后通知")
    void criticalIsNotified() {
        Alert critical = alert("cpu_usage", "system", Severity.CRITICAL);

        assertThat(processor.process(critical)).isEqualTo(ProcessingOutcome.NOTIFIED);
        verify(store).appendAlert(critical);
        verify(dispatcher).dispatch(critical);
    }

    @Test
    @DisplayName("窗口内重复告警被抑制，既不持久化也不通知")
    void duplicateWithinWindowIsSuppressed() {
        processor.process(alert("cpu_usage", "system", Severity.CRITICAL));
        clock.advance(Duration.ofSeconds(30));

        Alert repeat = alert("cpu_usage", "system", Severity.CRITICAL);
        assertThat(processor.process(repeat)).isEqualTo(ProcessingOutcome.SUPPRESSED);

        verify(store, never()).appendAlert(repeat);
        verify(dispatcher, times(1)).dispatch(any());
    }

    @Test
    @DisplayName("WARNING 升级为 CRITICAL 不会被已有的 WARNING 抑制")
    void escalationIsNotSuppressed() {
        processor.process(alert("cpu_usage", "system", Severity.WARNING));
        clock.advance(Duration.ofSeconds(30));

        Alert escalated = alert("cpu_usage", "system", Severity.CRITICAL);
        assertThat(processor.process(escalated)).isEqualTo(ProcessingOutcome.NOTIFIED);
    }

    @Test
    @DisplayName("窗口过期后再次放行，且过期条目被清理")
    void windowExpiry() {
        processor.process(alert("error_rate", "application", Severity.WARNING));
        clock.advance(Duration.ofMinutes(5));

        processor.housekeeping();
        assertThat(processor.trackedKeys()).isZero();

        assertThat(processor.process(alert("error_rate", "application", Severity.WARNING)))
                .isEqualTo(ProcessingOutcome.PERSISTED);
    }

    @Test
    @DisplayName("存储失败不影响通知")
    void storeFailureStillNotifies() {
        doThrow(new PersistenceException("appendAlert", "磁盘已满")).when(store).appendAlert(any());

        assertThat(processor.process(alert("store_connection", "database", Severity.CRITICAL)))
                .isEqualTo(ProcessingOutcome.NOTIFIED);
        verify(dispatcher).dispatch(any());
    }

    @Test
    @DisplayName("WARNING 持久化失败时记为持久化失败，下一次同类告警不被抑制")
    void warningPersistFailureIsReportedAndRetried() {
        doThrow(new PersistenceException("appendAlert", "database is locked"))
                .doNothing()
                .when(store).appendAlert(any());

        assertThat(processor.process(alert("disk_usage", "system", Severity.WARNING)))
                .isEqualTo(ProcessingOutcome.PERSIST_FAILED);
        assertThat(processor.trackedKeys()).isZero();

        clock.advance(Duration.ofSeconds(30));
        assertThat(processor.process(alert("disk_usage", "system", Severity.WARNING)))
                .isEqualTo(ProcessingOutcome.PERSISTED);
        verify(store, times(2)).appendAlert(any());
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    @DisplayName("通知未送达时记为通知失败")
    void undeliveredNotification() {
        when(dispatcher.dispatch(any())).thenReturn(NotificationResult.SKIPPED);

        assertThat(processor.process(alert("cache_connection", "cache", Severity.CRITICAL)))
                .isEqualTo(ProcessingOutcome.NOTIFICATION_FAILED);
    }

    @Test
    @DisplayName("cpu 依次为 50, 92, 97, 40：一条 WARNING 一条 CRITICAL，只通知一次")
    void cpuSequenceEndToEnd() {
        ThresholdEvaluator evaluator = new ThresholdEvaluator(factory);
        ThresholdConfig config = ThresholdConfig.defaults();
        List<ProcessingOutcome> outcomes = new ArrayList<>();

        for (double cpu : new double[] {50.0, 92.0, 97.0, 40.0}) {
            for (Alert candidate : evaluator.evaluate(Samples.withCpu(clock.instant(), cpu), config)) {
                outcomes.add(processor.process(candidate));
            }
            clock.advance(Duration.ofSeconds(30));
        }

        assertThat(outcomes).containsExactly(ProcessingOutcome.PERSISTED, ProcessingOutcome.NOTIFIED);
        ArgumentCaptor<Alert> persisted = ArgumentCaptor.forClass(Alert.class);
        verify(store, times(2)).appendAlert(persisted.capture());
        assertThat(persisted.getAllValues()).extracting(Alert::getSeverity)
                .containsExactly(Severity.WARNING, Severity.CRITICAL);
        verify(dispatcher, times(1)).dispatch(any());
    }
}
