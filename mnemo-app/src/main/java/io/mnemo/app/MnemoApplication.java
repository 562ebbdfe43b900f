package io.mnemo.app;

import io.mnemo.cli.CliContext;
import io.mnemo.cli.ConsolidateCommand;
import io.mnemo.cli.DaemonCommand;
import io.mnemo.cli.FeedbackCommand;
import io.mnemo.cli.ForgetCommand;
import io.mnemo.cli.GroupsCommand;
import io.mnemo.cli.InitCommand;
import io.mnemo.cli.MnemoCliCommand;
import io.mnemo.cli.QueryCommand;
import io.mnemo.cli.RecallCommand;
import io.mnemo.cli.RememberCommand;
import io.mnemo.cli.StatusCommand;
import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.ConfigService;
import io.mnemo.core.config.model.ConsolidationConfig;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.memory.MemoryService;
import io.mnemo.core.memory.PeriodicConsolidationOptions;
import io.mnemo.core.store.MemoryStores;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class MnemoApplication {
    private static final Logger LOG = LoggerFactory.getLogger(MnemoApplication.class);
    private static final long SCHEDULER_TICK_SECONDS = 60;

    private MnemoApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        MnemoConfig config = loadConfig(configService, configPath);
        Clock clock = Clock.systemUTC();

        MemoryService memoryService = new MemoryService(
            Path.of("").toAbsolutePath(),
            buildStores(config, clock),
            clock
        );
        try {
            memoryService.initialize();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize memory engine", e);
        }

        CliContext context = new CliContext(
            memoryService,
            configService,
            configPath,
            consolidateOnStart -> runDaemon(configService, configPath, memoryService, consolidateOnStart)
        );

        CommandLine commandLine = new CommandLine(new MnemoCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("remember", new RememberCommand(context));
        commandLine.addSubcommand("recall", new RecallCommand(context));
        commandLine.addSubcommand("query", new QueryCommand(context));
        commandLine.addSubcommand("feedback", new FeedbackCommand(context));
        commandLine.addSubcommand("forget", new ForgetCommand(context));
        commandLine.addSubcommand("groups", new GroupsCommand(context));
        commandLine.addSubcommand("consolidate", new ConsolidateCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("daemon", new DaemonCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static MnemoConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (IOException e) {
            LOG.warn("Falling back to default config, {} is unreadable: {}", configPath, e.getMessage());
            return MnemoConfig.defaults();
        }
    }

    private static MemoryStores buildStores(MnemoConfig config, Clock clock) {
        if (config.storage().inMemory()) {
            return MemoryStores.inMemory();
        }
        Path dbPath = ConfigPaths.resolveDataDir(config.storage().dataDir()).resolve(ConfigPaths.DATABASE_FILE);
        try {
            return MemoryStores.sqlite(dbPath, clock);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize SQLite memory store at " + dbPath, e);
        }
    }

    private static int runDaemon(
        ConfigService configService,
        Path configPath,
        MemoryService memoryService,
        boolean consolidateOnStart
    ) throws Exception {
        ConsolidationConfig consolidation = configService.load(configPath).consolidation();
        if (consolidateOnStart) {
            runPeriodic(memoryService, consolidation.periodic(true));
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            scheduler.scheduleAtFixedRate(
                () -> runPeriodic(memoryService, consolidation.periodic(false)),
                SCHEDULER_TICK_SECONDS,
                SCHEDULER_TICK_SECONDS,
                TimeUnit.SECONDS
            );
            System.out.println("Memory daemon started for " + memoryService.getProjectId()
                + (consolidation.enabled()
                    ? ", consolidating every " + consolidation.intervalMinutes() + " min"
                    : ", periodic consolidation disabled"));
            shutdown.await();
        } finally {
            scheduler.shutdownNow();
        }
        return 0;
    }

    private static void runPeriodic(MemoryService memoryService, PeriodicConsolidationOptions options) {
        try {
            memoryService.maybeRunPeriodicConsolidation(options).ifPresent(result ->
                System.out.println("Consolidation " + result.runId() + ": merged " + result.mergedCount()
                    + ", decayed " + result.decayedCount())
            );
        } catch (Exception e) {
            LOG.warn("Periodic consolidation failed: {}", e.getMessage());
        }
    }
}
