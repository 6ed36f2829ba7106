/**
 * DependencyStatus.java
 *
 * 外部依赖（缓存、关系型存储）的连接状态。
 * 持久化时使用小写的 wireValue，与历史数据保持一致。
 */
package club.ppmc.monitor.model;

import java.util.Arrays;

public enum DependencyStatus {
    CONNECTED("connected"),
    DISCONNECTED("disconnected"),
    ERROR("error");

    private final String wireValue;

    DependencyStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean isHealthy() {
        return this == CONNECTED;
    }

    /**
     * 从数据库中读取的字符串还原状态。无法识别的值一律视为 ERROR。
     */
    public static DependencyStatus fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.wireValue.equalsIgnoreCase(value))
                .findFirst()
                .orElse(ERROR);
    }
}
