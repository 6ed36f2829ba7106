/**
 * DependencyProbe.java
 *
 * 外部依赖健康检查的统一接口。每个依赖（缓存、关系型存储、外部 API）各有一个实现。
 * 调用方 (MetricsCollector) 会用 timeout() 给出的时长限制等待时间；
 * 实现本身也应通过其客户端的超时设置保证调用会在合理时间内返回。
 */
package club.ppmc.monitor.probe;

import club.ppmc.monitor.model.ProbeResult;
import java.time.Duration;

public interface DependencyProbe {

    /** 依赖名称，用于日志。 */
    String name();

    /** 单次探测允许的最长时间。 */
    Duration timeout();

    /**
     * 执行一次探测。
     *
     * @return 健康状态与耗时。
     * @throws Exception 探测过程中出现的任何错误，调用方会将其转换为降级值。
     */
    ProbeResult probe() throws Exception;
}
