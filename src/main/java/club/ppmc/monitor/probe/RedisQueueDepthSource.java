/**
 * RedisQueueDepthSource.java
 *
 * 读取 Redis 中异步任务列表的长度 (LLEN) 作为工作队列深度。
 */
package club.ppmc.monitor.probe;

import club.ppmc.monitor.config.MonitorProperties;
import java.time.Duration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisQueueDepthSource implements QueueDepthSource {

    private final StringRedisTemplate redisTemplate;
    private final String queueKey;
    private final Duration timeout;

    public RedisQueueDepthSource(StringRedisTemplate redisTemplate, MonitorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.queueKey = properties.getProbes().getQueueKey();
        this.timeout = properties.getProbes().getCacheTimeout();
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public long currentDepth() {
        Long size = redisTemplate.opsForList().size(queueKey);
        return size == null ? 0 : Math.max(0, size);
    }
}
