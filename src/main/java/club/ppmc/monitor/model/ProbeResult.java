/**
 * ProbeResult.java
 *
 * 单次依赖探测的结果，由各 DependencyProbe 返回。
 */
package club.ppmc.monitor.model;

/**
 * @param healthy   依赖是否可用。
 * @param latencyMs 探测耗时（毫秒）。
 */
public record ProbeResult(boolean healthy, double latencyMs) {

    public static ProbeResult healthy(double latencyMs) {
        return new ProbeResult(true, latencyMs);
    }

    public static ProbeResult unhealthy(double latencyMs) {
        return new ProbeResult(false, latencyMs);
    }
}
