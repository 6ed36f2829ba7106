package club.ppmc.monitor.alert;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.monitor.MutableClock;
import club.ppmc.monitor.Samples;
import club.ppmc.monitor.config.ThresholdConfig;
import club.ppmc.monitor.model.Alert;
import club.ppmc.monitor.model.DependencyStatus;
import club.ppmc.monitor.model.MetricSample;
import club.ppmc.monitor.model.Severity;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ThresholdEvaluator 阈值评估")
class ThresholdEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private ThresholdEvaluator evaluator;
    private final ThresholdConfig config = ThresholdConfig.defaults();

    @BeforeEach
    void setUp() {
        evaluator = new ThresholdEvaluator(new AlertFactory(new MutableClock(NOW)));
    }

    @Test
    @DisplayName("全部健康的采样不产生告警")
    void healthySampleProducesNothing() {
        assertThat(evaluator.evaluate(Samples.healthy(NOW), config)).isEmpty();
    }

    @ParameterizedTest(name = "cpu={0} -> {1}")
    @CsvSource({
            "79.9, NONE",
            "80.0, WARNING",
            "94.9, WARNING",
            "95.0, CRITICAL",
            "100.0, CRITICAL"
    })
    @DisplayName("等于阈值即触发，且每条规则最多一个告警")
    void cpuBoundaries(double cpu, String expected) {
        List<Alert> alerts = evaluator.evaluate(Samples.withCpu(NOW, cpu), config);

        if ("NONE".equals(expected)) {
            assertThat(alerts).isEmpty();
            return;
        }
        assertThat(alerts).hasSize(1);
        Alert alert = alerts.get(0);
        assertThat(alert.getSeverity()).isEqualTo(Severity.valueOf(expected));
        assertThat(alert.getAlertType()).isEqualTo("cpu_usage");
        assertThat(alert.getComponent()).isEqualTo("system");
        assertThat(alert.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("数值告警携带观测值与命中的阈值")
    void numericMetadata() {
        Alert alert = evaluator.evaluate(Samples.withCpu(NOW, 97.0), config).get(0);

        assertThat(alert.getMetadata())
                .containsEntry("threshold_breach", true)
                .containsEntry("value", 97.0)
                .containsEntry("threshold", 95.0);
        assertThat(alert.getMessage()).contains("97.0%").contains("严重");
    }

    @Test
    @DisplayName("多条规则同时触发时按固定顺序输出")
    void multipleRulesInDeclarationOrder() {
        MetricSample sample = new MetricSample(NOW, 96.0, 85.0, 90.0, 10,
                DependencyStatus.DISCONNECTED, DependencyStatus.CONNECTED, 2500.0, 120, 6.0);

        List<Alert> alerts = evaluator.evaluate(sample, config);

        assertThat(alerts).extracting(Alert::getAlertType).containsExactly(
                "cpu_usage", "memory_usage", "disk_usage", "cache_connection",
                "api_performance", "queue_backlog", "error_rate");
        assertThat(alerts).extracting(Alert::getSeverity).containsExactly(
                Severity.CRITICAL, Severity.WARNING, Severity.WARNING, Severity.CRITICAL,
                Severity.WARNING, Severity.CRITICAL, Severity.WARNING);
        assertThat(alerts).extracting(Alert::getId).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("依赖状态为 error 或 disconnected 都产生 CRITICAL")
    void statusRules() {
        MetricSample sample = new MetricSample(NOW, 10.0, 20.0, 30.0, 5,
                DependencyStatus.ERROR, DependencyStatus.DISCONNECTED, 120.0, 3, 0.5);

        List<Alert> alerts = evaluator.evaluate(sample, config);

        assertThat(alerts).hasSize(2);
        assertThat(alerts.get(0).getComponent()).isEqualTo("cache");
        assertThat(alerts.get(0).getMetadata()).containsEntry("status", "error");
        assertThat(alerts.get(1).getComponent()).isEqualTo("database");
        assertThat(alerts.get(1).getMetadata()).containsEntry("status", "disconnected");
        assertThat(alerts).allMatch(alert -> alert.getSeverity() == Severity.CRITICAL);
    }

    @Test
    @DisplayName("全降级快照本身会触发告警")
    void degradedSampleIsAlertable() {
        List<Alert> alerts = evaluator.evaluate(MetricSample.degraded(NOW), config);

        assertThat(alerts).extracting(Alert::getAlertType).containsExactly(
                "cache_connection", "store_connection", "api_performance", "error_rate");
        assertThat(alerts).allMatch(alert -> alert.getSeverity() == Severity.CRITICAL);
    }

    @Test
    @DisplayName("NaN 观测值不触发任何规则")
    void nanNeverFires() {
        assertThat(evaluator.evaluate(Samples.withCpu(NOW, Double.NaN), config)).isEmpty();
    }
}
