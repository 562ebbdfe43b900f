package io.mnemo.cli;

import io.mnemo.core.config.ConfigService;
import io.mnemo.core.memory.MemoryService;
import java.nio.file.Path;

public record CliContext(
    MemoryService memoryService,
    ConfigService configService,
    Path configPath,
    DaemonRunner daemonRunner
) {
    public CliContext(MemoryService memoryService, ConfigService configService, Path configPath) {
        this(memoryService, configService, configPath, consolidateOnStart -> {
            throw new UnsupportedOperationException("daemon runner is not configured");
        });
    }
}
