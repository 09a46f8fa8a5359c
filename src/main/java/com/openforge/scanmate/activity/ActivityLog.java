package com.openforge.scanmate.activity;

import com.openforge.scanmate.config.GatewayProperties;
import com.openforge.scanmate.store.UserIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Plain-text, append-only activity trail per user: {data-dir}/{user}.txt.
 *
 * Recording is best-effort; a failed write is logged and never reaches the
 * request that triggered it.
 */
@Slf4j
@Component
public class ActivityLog {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path  dataDir;
    private final Clock clock;

    public ActivityLog(GatewayProperties properties, Clock clock) {
        this.dataDir = Path.of(properties.dataDir());
        this.clock   = clock;
    }

    public void record(String user, String text) {
        String line = "[%s] %s%n".formatted(LocalDateTime.now(clock).format(TIMESTAMP), text);
        try {
            Path file = dataDir.resolve(UserIds.validate(user) + ".txt");
            Files.createDirectories(dataDir);
            synchronized (this) {
                Files.writeString(file, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("[Activity] Could not record entry for {}: {}", user, e.getMessage());
        }
    }
}
