/**
 * DedupWindow.java
 *
 * 显式的过期映射：去重键 -> 过期时刻。
 * 该结构只由告警处理循环所在的单个线程访问，因此不做任何同步。
 */
package club.ppmc.monitor.alert;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public class DedupWindow {

    private final Duration window;
    private final Map<DedupKey, Instant> expiries = new HashMap<>();

    public DedupWindow(Duration window) {
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("去重窗口必须为正: " + window);
        }
        this.window = window;
    }

    /**
     * 尝试为给定键占用窗口。
     *
     * @return true 表示该键当前不在窗口内（已登记为 now + window 过期）；false 表示应被抑制。
     */
    public boolean tryAcquire(DedupKey key, Instant now) {
        Instant expiry = expiries.get(key);
        if (expiry != null && expiry.isAfter(now)) {
            return false;
        }
        expiries.put(key, now.plus(window));
        return true;
    }

    /**
     * 放弃一个已占用的键，使同一键的下一个告警不被抑制。
     */
    public void release(DedupKey key) {
        expiries.remove(key);
    }

    /**
     * 移除所有过期时刻 <= now 的条目。
     *
     * @return 被移除的条目数。
     */
    public int evictExpired(Instant now) {
        int before = expiries.size();
        expiries.values().removeIf(expiry -> !expiry.isAfter(now));
        return before - expiries.size();
    }

    public int size() {
        return expiries.size();
    }
}
