package io.mnemo.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "daemon", description = "Run periodic consolidation until interrupted")
public final class DaemonCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--now", description = "Force a consolidation run at startup")
    boolean consolidateOnStart;

    public DaemonCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.daemonRunner().run(consolidateOnStart);
        } catch (Exception e) {
            System.err.println("Daemon command failed: " + e.getMessage());
            return 1;
        }
    }
}
