/**
 * HostMetricsSampler.java
 *
 * 负责采集本机的系统资源信息（CPU、内存、磁盘、网络连接数）。
 * 它依赖于 Oshi 库进行跨平台的系统信息获取。
 * 每一项读数都单独做了异常保护，任何一项失败都只会把该项降级为 0，而不会影响其它读数。
 */
package club.ppmc.monitor.collector;

import club.ppmc.monitor.config.MonitorProperties;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.hardware.CentralProcessor;
import oshi.hardware.GlobalMemory;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.software.os.OSFileStore;
import oshi.software.os.OperatingSystem;

@Component
@Slf4j
public class HostMetricsSampler {

    private final HardwareAbstractionLayer hardware;
    private final OperatingSystem operatingSystem;
    private final CentralProcessor processor;
    private final String diskMount;

    // 用于计算CPU使用率的状态变量，只在采集线程中访问
    private long[] prevTicks;

    public HostMetricsSampler(MonitorProperties properties) {
        SystemInfo systemInfo = new SystemInfo();
        this.hardware = systemInfo.getHardware();
        this.operatingSystem = systemInfo.getOperatingSystem();
        this.processor = hardware.getProcessor();
        this.diskMount = properties.getProbes().getDiskMount();
        this.prevTicks = processor.getSystemCpuLoadTicks();
        log.info("主机指标采样器已初始化，磁盘挂载点: {}", diskMount);
    }

    /**
     * 采集一次主机指标。从不抛出异常。
     *
     * @return 本次读数，失败的项为 0。
     */
    public synchronized HostMetrics sample() {
        return new HostMetrics(cpuPercent(), memoryPercent(), diskPercent(), activeConnections());
    }

    private double cpuPercent() {
        try {
            // 两次 tick 快照之间的负载，首个周期以构造时的快照为基准
            double load = processor.getSystemCpuLoadBetweenTicks(prevTicks) * 100.0;
            this.prevTicks = processor.getSystemCpuLoadTicks();
            return clampPercent(load);
        } catch (RuntimeException e) {
            log.warn("采集CPU使用率失败: {}", e.getMessage());
            return 0.0;
        }
    }

    private double memoryPercent() {
        try {
            GlobalMemory memory = hardware.getMemory();
            long total = memory.getTotal();
            if (total <= 0) {
                return 0.0;
            }
            return clampPercent((total - memory.getAvailable()) * 100.0 / total);
        } catch (RuntimeException e) {
            log.warn("采集内存使用率失败: {}", e.getMessage());
            return 0.0;
        }
    }

    private double diskPercent() {
        try {
            List<OSFileStore> stores = operatingSystem.getFileSystem().getFileStores();
            OSFileStore store = stores.stream()
                    .filter(s -> diskMount.equals(s.getMount()))
                    .findFirst()
                    // 找不到指定挂载点时退化为容量最大的文件系统
                    .orElseGet(() -> stores.stream()
                            .max(Comparator.comparingLong(OSFileStore::getTotalSpace))
                            .orElse(null));
            if (store == null || store.getTotalSpace() <= 0) {
                return 0.0;
            }
            long used = store.getTotalSpace() - store.getUsableSpace();
            return clampPercent(used * 100.0 / store.getTotalSpace());
        } catch (RuntimeException e) {
            log.warn("采集磁盘使用率失败: {}", e.getMessage());
            return 0.0;
        }
    }

    private int activeConnections() {
        try {
            return operatingSystem.getInternetProtocolStats().getConnections().size();
        } catch (RuntimeException e) {
            log.warn("采集网络连接数失败: {}", e.getMessage());
            return 0;
        }
    }

    private static double clampPercent(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }

    /**
     * 一次主机读数。
     *
     * @param cpuPercent        CPU 使用率 (0-100)。
     * @param memoryPercent     内存使用率 (0-100)。
     * @param diskPercent       磁盘使用率 (0-100)。
     * @param activeConnections 活动网络连接数。
     */
    public record HostMetrics(double cpuPercent, double memoryPercent, double diskPercent, int activeConnections) {

        public static HostMetrics unavailable() {
            return new HostMetrics(0.0, 0.0, 0.0, 0);
        }
    }
}
