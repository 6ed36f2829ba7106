/**
 * QueueDepthSource.java
 *
 * 提供当前工作队列积压深度的外部协作者。
 */
package club.ppmc.monitor.probe;

import java.time.Duration;

public interface QueueDepthSource {

    Duration timeout();

    /**
     * @return 当前积压的任务数，不会为负。
     * @throws Exception 读取失败时抛出。
     */
    long currentDepth() throws Exception;
}
