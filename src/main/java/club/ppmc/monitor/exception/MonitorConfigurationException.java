/**
 * MonitorConfigurationException.java
 *
 * 一个自定义的运行时异常，表示监控配置无效（例如阈值 warning >= critical、出现负数边界或未知的规则名）。
 * 只在启动阶段抛出，此时采集循环与处理循环都尚未启动，因此该异常会直接终止应用启动。
 * 它携带出错的配置键，便于运维人员定位问题。
 */
package club.ppmc.monitor.exception;

import lombok.Getter;

@Getter
public class MonitorConfigurationException extends RuntimeException {

    /** 出错的配置键，例如 "monitor.thresholds.cpu-usage"。 */
    private final String configKey;

    /**
     * 构造函数。
     * @param message 详细的错误信息。
     * @param configKey 出错的配置键。
     */
    public MonitorConfigurationException(String message, String configKey) {
        super(message);
        this.configKey = configKey;
    }
}
