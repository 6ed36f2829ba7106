/**
 * WebhookNotificationChannel.java
 *
 * 以 JSON POST 的形式把告警推送到配置的 Webhook 地址。非 2xx 响应由 RestTemplate 以异常形式报告。
 */
package club.ppmc.monitor.notify;

import club.ppmc.monitor.config.MonitorProperties;
import club.ppmc.monitor.model.Alert;
import com.google.gson.Gson;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

@Component
public class WebhookNotificationChannel implements NotificationChannel {

    private final RestTemplate restTemplate;
    private final Gson gson;
    private final String webhookUrl;

    public WebhookNotificationChannel(RestTemplate restTemplate, Gson gson, MonitorProperties properties) {
        this.restTemplate = restTemplate;
        this.gson = gson;
        this.webhookUrl = properties.getNotification().getWebhookUrl();
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.hasText(webhookUrl);
    }

    @Override
    public void send(Alert alert) {
        var headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        restTemplate.postForEntity(webhookUrl, new HttpEntity<>(toPayload(alert), headers), String.class);
    }

    String toPayload(Alert alert) {
        // java.time 类型无法被 Gson 反射序列化，这里先转换为字符串
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", alert.getId());
        payload.put("alertType", alert.getAlertType());
        payload.put("severity", alert.getSeverity().name());
        payload.put("component", alert.getComponent());
        payload.put("message", alert.getMessage());
        payload.put("createdAt", alert.getCreatedAt().toString());
        payload.put("metadata", alert.getMetadata());
        return gson.toJson(payload);
    }
}
