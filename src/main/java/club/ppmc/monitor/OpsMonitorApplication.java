/**
 * OpsMonitorApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动整个监控应用：配置在启动阶段完成校验，随后由 MonitorLifecycleListener 启动后台循环。
 */
package club.ppmc.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OpsMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpsMonitorApplication.class, args);
    }
}
