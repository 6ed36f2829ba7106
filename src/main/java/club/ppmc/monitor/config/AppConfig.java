/**
 * AppConfig.java
 *
 * 监控应用的基础配置类。
 * 定义应用级别的Bean：统一的时钟、带超时的 RestTemplate、用于 JSON 序列化的 Gson，
 * 以及在启动时校验过的阈值配置。
 */
package club.ppmc.monitor.config;

import com.google.gson.Gson;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
@Slf4j
public class AppConfig {

    /**
     * 所有与时间相关的逻辑（采样时间戳、去重窗口、查询窗口）都从这个时钟取时间，便于测试。
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 定义一个全局的 RestTemplate Bean，用于 API 健康探测和 Webhook 通知。
     * 连接与读取超时都取 API 探测超时，保证一次 HTTP 调用不会无限阻塞采集或处理循环。
     *
     * @return 一个配置了超时的 RestTemplate 实例。
     */
    @Bean
    public RestTemplate restTemplate(MonitorProperties properties) {
        int timeoutMillis = (int) properties.getProbes().getApiTimeout().toMillis();
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        return new RestTemplate(requestFactory);
    }

    /**
     * 定义一个全局的 Gson Bean。
     * 用于告警元数据的持久化（metadata_json 列）以及 Webhook 载荷的序列化。
     *
     * @return 一个新的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return new Gson();
    }

    /**
     * 在启动阶段校验阈值配置。配置无效时抛出 MonitorConfigurationException，应用启动失败。
     */
    @Bean
    public ThresholdConfig thresholdConfig(MonitorProperties properties) {
        ThresholdConfig config = ThresholdConfig.from(properties.getThresholds());
        log.info("阈值配置已加载: {}", config);
        return config;
    }
}
