/**
 * PersistenceException.java
 *
 * 存储层操作失败时抛出的运行时异常。
 * 调用方（采集循环、告警处理循环、查询服务）负责记录日志并丢弃该异常，它从不终止监控管线。
 */
package club.ppmc.monitor.exception;

import lombok.Getter;

@Getter
public class PersistenceException extends RuntimeException {

    /** 失败的存储操作名称，例如 "appendAlert"。 */
    private final String operation;

    public PersistenceException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public PersistenceException(String operation, String message) {
        this(operation, message, null);
    }
}
