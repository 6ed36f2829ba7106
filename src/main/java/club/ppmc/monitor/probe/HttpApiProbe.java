/**
 * HttpApiProbe.java
 *
 * 请求外部 API 的健康检查地址并测量响应时间。
 * 只有 2xx 响应被视为健康；RestTemplate 的连接与读取超时见 AppConfig。
 */
package club.ppmc.monitor.probe;

import club.ppmc.monitor.config.MonitorProperties;
import club.ppmc.monitor.model.ProbeResult;
import java.time.Duration;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

@Component("apiProbe")
public class HttpApiProbe implements DependencyProbe {

    private final RestTemplate restTemplate;
    private final String healthUrl;
    private final Duration timeout;

    public HttpApiProbe(RestTemplate restTemplate, MonitorProperties properties) {
        this.restTemplate = restTemplate;
        this.healthUrl = properties.getProbes().getApiHealthUrl();
        this.timeout = properties.getProbes().getApiTimeout();
    }

    @Override
    public String name() {
        return "api";
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public ProbeResult probe() {
        long start = System.nanoTime();
        ResponseEntity<String> response = restTemplate.getForEntity(healthUrl, String.class);
        double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
        return response.getStatusCode().is2xxSuccessful()
                ? ProbeResult.healthy(latencyMs)
                : ProbeResult.unhealthy(latencyMs);
    }
}
