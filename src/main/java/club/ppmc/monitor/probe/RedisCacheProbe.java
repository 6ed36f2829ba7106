/**
 * RedisCacheProbe.java
 *
 * 通过 PING 命令检查 Redis 缓存是否可用。
 * 命令超时由 spring.data.redis.timeout 控制。
 */
package club.ppmc.monitor.probe;

import club.ppmc.monitor.config.MonitorProperties;
import club.ppmc.monitor.model.ProbeResult;
import java.time.Duration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

@Component("cacheProbe")
public class RedisCacheProbe implements DependencyProbe {

    private final RedisConnectionFactory connectionFactory;
    private final Duration timeout;

    public RedisCacheProbe(RedisConnectionFactory connectionFactory, MonitorProperties properties) {
        this.connectionFactory = connectionFactory;
        this.timeout = properties.getProbes().getCacheTimeout();
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public ProbeResult probe() {
        long start = System.nanoTime();
        try (RedisConnection connection = connectionFactory.getConnection()) {
            String reply = connection.ping();
            double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
            return "PONG".equalsIgnoreCase(reply) ? ProbeResult.healthy(latencyMs) : ProbeResult.unhealthy(latencyMs);
        }
    }
}
