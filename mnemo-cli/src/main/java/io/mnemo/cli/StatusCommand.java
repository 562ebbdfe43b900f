package io.mnemo.cli;

import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.consolidation.ConsolidationRun;
import io.mnemo.core.memory.MemoryService;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and memory store status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoConfig config = context.configService().load(context.configPath());
            MemoryService memory = context.memoryService();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Data directory: " + ConfigPaths.resolveDataDir(config.storage().dataDir()));
            System.out.println("Storage backend: " + config.storage().backend());
            System.out.println("Project: " + memory.getProjectId() + " (" + memory.getWorkingDir() + ")");
            System.out.println("Memories: " + memory.getAll().size());
            System.out.println("Groups: " + String.join(", ", memory.listGroups()));
            System.out.println("Periodic consolidation: " + (config.consolidation().enabled()
                ? "every " + config.consolidation().intervalMinutes() + " min"
                : "disabled"));
            List<ConsolidationRun> runs = memory.listConsolidationRuns(1);
            System.out.println("Last consolidation: " + (runs.isEmpty()
                ? "never"
                : runs.get(0).id() + " " + runs.get(0).status().wireValue()));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
