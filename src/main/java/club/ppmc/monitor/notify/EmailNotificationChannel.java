/**
 * EmailNotificationChannel.java
 *
 * 通过 SMTP 发送告警邮件。
 * 只有在配置了 spring.mail.host（从而存在 JavaMailSender）、SMTP 用户名和密码、并且至少有一个收件人时才启用。
 * 发送的超时由 spring.mail.properties.mail.smtp.*timeout 控制，保证不会长时间阻塞处理循环。
 */
package club.ppmc.monitor.notify;

import club.ppmc.monitor.config.MonitorProperties;
import club.ppmc.monitor.model.Alert;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class EmailNotificationChannel implements NotificationChannel {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final JavaMailSender mailSender;
    private final String username;
    private final String password;
    private final List<String> recipients;
    private final String from;
    private final String subjectPrefix;

    public EmailNotificationChannel(
            ObjectProvider<JavaMailSender> mailSender,
            MonitorProperties properties,
            @Value("${spring.mail.username:}") String username,
            @Value("${spring.mail.password:}") String password) {
        this.mailSender = mailSender.getIfAvailable();
        this.username = username;
        this.password = password;
        MonitorProperties.Notification notification = properties.getNotification();
        this.recipients = notification.getRecipients().stream()
                .map(String::trim)
                .filter(StringUtils::hasText)
                .toList();
        this.from = StringUtils.hasText(notification.getFrom()) ? notification.getFrom() : username;
        this.subjectPrefix = notification.getSubjectPrefix();
    }

    @Override
    public String name() {
        return "email";
    }

    @Override
    public boolean isConfigured() {
        return mailSender != null
                && StringUtils.hasText(username)
                && StringUtils.hasText(password)
                && !recipients.isEmpty();
    }

    @Override
    public void send(Alert alert) {
        var message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(recipients.toArray(String[]::new));
        message.setSubject(String.format("%s %s 告警: %s", subjectPrefix, alert.getSeverity(), alert.getAlertType()));
        message.setText(buildBody(alert));
        mailSender.send(message);
    }

    static String buildBody(Alert alert) {
        return String.format(
                "系统告警%n%n"
                        + "告警类型: %s%n"
                        + "组件: %s%n"
                        + "级别: %s%n"
                        + "时间: %s%n"
                        + "告警 ID: %s%n%n"
                        + "详情: %s%n%n"
                        + "请尽快排查。此邮件由监控系统自动发送。%n",
                alert.getAlertType(),
                alert.getComponent(),
                alert.getSeverity(),
                TIMESTAMP_FORMAT.format(alert.getCreatedAt()),
                alert.getId(),
                alert.getMessage());
    }
}
