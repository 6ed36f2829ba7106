/**
 * LogFileErrorRateSource.java
 *
 * 从应用日志文件的尾部推算最近的错误率：
 * 包含请求标记的行计为一次请求，包含任一错误标记的行计为一次错误，
 * 错误率 = 错误数 / 请求数 * 100，上限 100。日志文件不存在或没有请求时返回 0。
 */
package club.ppmc.monitor.probe;

import club.ppmc.monitor.config.MonitorProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.input.ReversedLinesFileReader;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LogFileErrorRateSource implements ErrorRateSource {

    private final Path logFile;
    private final int maxLines;
    private final String requestMarker;
    private final List<String> errorMarkers;
    private final Duration timeout;

    public LogFileErrorRateSource(MonitorProperties properties) {
        MonitorProperties.Probes probes = properties.getProbes();
        this.logFile = Paths.get(probes.getErrorLogFile()).toAbsolutePath().normalize();
        this.maxLines = probes.getErrorLogLines();
        this.requestMarker = probes.getRequestMarker();
        this.errorMarkers = List.copyOf(probes.getErrorMarkers());
        this.timeout = probes.getErrorRateTimeout();
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public double recentErrorRatePercent() throws IOException {
        if (Files.notExists(logFile)) {
            log.debug("日志文件 {} 不存在，错误率按 0 计算。", logFile);
            return 0.0;
        }

        List<String> lines;
        try (var reader = ReversedLinesFileReader.builder()
                .setPath(logFile)
                .setCharset(StandardCharsets.UTF_8)
                .get()) {
            lines = reader.readLines(maxLines);
        }
        return errorRate(lines);
    }

    double errorRate(List<String> lines) {
        long requests = 0;
        long errors = 0;
        for (String line : lines) {
            if (line.contains(requestMarker)) {
                requests++;
            } else if (errorMarkers.stream().anyMatch(line::contains)) {
                errors++;
            }
        }
        if (requests == 0) {
            return 0.0;
        }
        return Math.min(100.0, errors * 100.0 / requests);
    }
}
