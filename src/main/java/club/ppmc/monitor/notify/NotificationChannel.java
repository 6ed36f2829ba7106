/**
 * NotificationChannel.java
 *
 * 一个外部通知渠道（邮件、Webhook 等）。每次 send 只尝试投递一次，不做重试。
 */
package club.ppmc.monitor.notify;

import club.ppmc.monitor.model.Alert;

public interface NotificationChannel {

    String name();

    /** 凭据与目标是否齐全；未配置的渠道会被跳过。 */
    boolean isConfigured();

    /**
     * 投递一条告警。
     *
     * @throws Exception 投递失败时抛出，由 NotificationDispatcher 记录。
     */
    void send(Alert alert) throws Exception;
}
