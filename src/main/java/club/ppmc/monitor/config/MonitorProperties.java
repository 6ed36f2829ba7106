/**
 * MonitorProperties.java
 *
 * 监控子系统的全部可配置项，绑定 application.properties 中 "monitor." 前缀下的键。
 * 简单的取值范围由 Bean Validation 校验；阈值之间的交叉约束由 ThresholdConfig 在启动时校验。
 * 任何一项校验失败都会使应用启动失败，此时后台循环尚未开始。
 * SMTP 凭据不在这里，而是沿用 Spring 自带的 spring.mail.* 配置。
 */
package club.ppmc.monitor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    /** 应用就绪后是否自动启动后台监控循环。 */
    private boolean autostart = true;

    /** 采样周期。 */
    @NotNull
    @DurationMin(millis = 1)
    private Duration samplingInterval = Duration.ofSeconds(30);

    /** 相同 (类型, 组件, 级别) 告警的去重窗口。 */
    @NotNull
    @DurationMin(millis = 1)
    private Duration dedupWindow = Duration.ofMinutes(5);

    /** 仪表盘汇总统计告警时回溯的时间范围。 */
    @NotNull
    @DurationMin(millis = 1)
    private Duration summaryLookback = Duration.ofHours(24);

    @Valid
    private Queue queue = new Queue();

    /**
     * 按规则配置的阈值，键为规则的配置名（例如 "cpu-usage"）。
     * 未出现的规则使用内置默认值。
     */
    @Valid
    private Map<String, Threshold> thresholds = new LinkedHashMap<>();

    @Valid
    private Probes probes = new Probes();

    @Valid
    private Notification notification = new Notification();

    @Data
    public static class Queue {

        /** 告警队列容量。 */
        @Min(1)
        private int capacity = 1000;

        /** 处理循环从队列取告警的等待时间，超时后执行去重窗口清理。 */
        @NotNull
        @DurationMin(millis = 1)
        private Duration pollTimeout = Duration.ofSeconds(30);

        /** 队列已满时采集循环最多等待多久。 */
        @NotNull
        private Duration offerTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Threshold {
        private Double warning;
        private Double critical;
    }

    @Data
    public static class Probes {

        @NotNull
        @DurationMin(millis = 1)
        private Duration cacheTimeout = Duration.ofSeconds(5);

        @NotNull
        @DurationMin(millis = 1)
        private Duration storeTimeout = Duration.ofSeconds(5);

        @NotNull
        @DurationMin(millis = 1)
        private Duration apiTimeout = Duration.ofSeconds(10);

        /** 读取日志尾部推算错误率的时限。 */
        @NotNull
        @DurationMin(millis = 1)
        private Duration errorRateTimeout = Duration.ofSeconds(5);

        /** 外部 API 的健康检查地址。 */
        @NotBlank
        private String apiHealthUrl = "http://localhost:5000/api/health";

        /** 工作队列在 Redis 中的列表键。 */
        @NotBlank
        private String queueKey = "task_queue";

        /** 用于推算错误率的应用日志文件。 */
        @NotBlank
        private String errorLogFile = "logs/app.log";

        /** 推算错误率时读取日志尾部的行数。 */
        @Min(1)
        private int errorLogLines = 1000;

        /** 计为一次请求的日志行标记。 */
        @NotBlank
        private String requestMarker = "Request:";

        /** 计为一次错误的日志行标记，任意一个匹配即可。 */
        private List<String> errorMarkers = new ArrayList<>(List.of("ERROR", "WARNING"));

        /** 统计磁盘使用率的挂载点。 */
        @NotBlank
        private String diskMount = "/";
    }

    @Data
    public static class Notification {

        /** 告警邮件收件人。 */
        private List<String> recipients = new ArrayList<>();

        /** 发件人地址，为空时使用 spring.mail.username。 */
        private String from;

        private String subjectPrefix = "[ops-monitor]";

        /** 可选的 Webhook 地址，CRITICAL 告警会以 JSON POST 到此地址。 */
        private String webhookUrl;
    }
}
