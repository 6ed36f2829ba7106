/**
 * DatabaseProbe.java
 *
 * 通过执行 "SELECT 1" 检查关系型存储是否可用。
 * 使用一个独立的 JdbcTemplate 并设置查询超时，避免探测拖慢整个采样周期。
 */
package club.ppmc.monitor.probe;

import club.ppmc.monitor.config.MonitorProperties;
import club.ppmc.monitor.model.ProbeResult;
import java.time.Duration;
import javax.sql.DataSource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component("storeProbe")
public class DatabaseProbe implements DependencyProbe {

    private final JdbcTemplate probeTemplate;
    private final Duration timeout;

    public DatabaseProbe(DataSource dataSource, MonitorProperties properties) {
        this.timeout = properties.getProbes().getStoreTimeout();
        this.probeTemplate = new JdbcTemplate(dataSource);
        this.probeTemplate.setQueryTimeout((int) Math.max(1, timeout.toSeconds()));
    }

    @Override
    public String name() {
        return "database";
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public ProbeResult probe() {
        long start = System.nanoTime();
        Integer one = probeTemplate.queryForObject("SELECT 1", Integer.class);
        double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
        return Integer.valueOf(1).equals(one) ? ProbeResult.healthy(latencyMs) : ProbeResult.unhealthy(latencyMs);
    }
}
