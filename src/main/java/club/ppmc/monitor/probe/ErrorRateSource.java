/**
 * ErrorRateSource.java
 *
 * 提供最近一段时间内请求错误率的外部协作者，例如由日志处理器推算。
 */
package club.ppmc.monitor.probe;

import java.time.Duration;

public interface ErrorRateSource {

    Duration timeout();

    /**
     * @return 0 到 100 之间的错误率百分比。
     * @throws Exception 读取失败时抛出。
     */
    double recentErrorRatePercent() throws Exception;
}
