package club.ppmc.monitor;

import club.ppmc.monitor.model.DependencyStatus;
import club.ppmc.monitor.model.MetricSample;
import java.time.Instant;

/**
 * 构造测试用快照：除指定字段外全部为健康值。
 */
public final class Samples {

    private Samples() {
    }

    public static MetricSample healthy(Instant at) {
        return new MetricSample(at, 10.0, 20.0, 30.0, 5,
                DependencyStatus.CONNECTED, DependencyStatus.CONNECTED, 120.0, 3, 0.5);
    }

    public static MetricSample withCpu(Instant at, double cpu) {
        return new MetricSample(at, cpu, 20.0, 30.0, 5,
                DependencyStatus.CONNECTED, DependencyStatus.CONNECTED, 120.0, 3, 0.5);
    }
}
