/**
 * MonitorLifecycleListener.java
 *
 * 这是一个Spring事件监听器，负责把后台监控的生命周期与应用的生命周期绑定。
 * 应用就绪后（此时配置校验已经全部通过）按 monitor.autostart 决定是否启动监控；
 * 应用上下文关闭时请求停止监控。
 */
package club.ppmc.monitor.listener;

import club.ppmc.monitor.config.MonitorProperties;
import club.ppmc.monitor.service.MonitorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class MonitorLifecycleListener {

    private final MonitorService monitorService;
    private final boolean autostart;

    public MonitorLifecycleListener(MonitorService monitorService, MonitorProperties properties) {
        this.monitorService = monitorService;
        this.autostart = properties.isAutostart();
    }

    @EventListener
    public void handleApplicationReady(ApplicationReadyEvent event) {
        if (!autostart) {
            log.info("monitor.autostart=false，后台监控需要手动启动。");
            return;
        }
        monitorService.startMonitoring();
    }

    @EventListener
    public void handleContextClosed(ContextClosedEvent event) {
        if (monitorService.isMonitoringActive()) {
            log.info("应用正在关闭，停止后台监控。");
            monitorService.stopMonitoring();
        }
    }
}
