package io.mnemo.cli;

import io.mnemo.core.config.model.ConsolidationConfig;
import io.mnemo.core.consolidation.ConsolidationPolicy;
import io.mnemo.core.consolidation.ConsolidationResult;
import io.mnemo.core.consolidation.ConsolidationRun;
import io.mnemo.core.consolidation.ConsolidationStrategy;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "consolidate", description = "Merge near-duplicate memories and decay stale ones")
public final class ConsolidateCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--strategy", description = "aggressive, balanced or conservative")
    String strategy;

    @Option(names = "--threshold", description = "Similarity at which two memories merge")
    Double redundancyThreshold;

    @Option(names = "--decay", description = "Confidence multiplier for stale memories")
    Double decayFactor;

    @Option(names = "--min-confidence", description = "Floor for decayed confidence")
    Double minConfidence;

    @Option(names = "--stale-after-hours", description = "Age after which a memory decays")
    Double staleAfterHours;

    @Option(names = "--history", description = "Show recent runs instead of running")
    boolean history;

    @Option(names = {"-n", "--limit"}, description = "Runs to show with --history", defaultValue = "10")
    int limit;

    public ConsolidateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (history) {
                printHistory(context.memoryService().listConsolidationRuns(limit));
                return 0;
            }
            ConsolidationConfig config = context.configService().load(context.configPath()).consolidation();
            ConsolidationPolicy configured = config.policy();
            ConsolidationPolicy policy = ConsolidationPolicy.builder()
                .strategy(strategy == null ? configured.strategy() : ConsolidationStrategy.fromWire(strategy))
                .redundancyThreshold(redundancyThreshold == null ? configured.redundancyThreshold() : redundancyThreshold)
                .decayFactor(decayFactor == null ? configured.decayFactor() : decayFactor)
                .minConfidence(minConfidence == null ? configured.minConfidence() : minConfidence)
                .staleAfterHours(staleAfterHours == null ? configured.staleAfterHours() : staleAfterHours)
                .build();

            ConsolidationResult result = context.memoryService().consolidateMemory(policy, config.budget());
            System.out.println("Run " + result.runId() + " (" + result.strategy().wireValue() + ")");
            System.out.println("Atoms: " + result.beforeCount() + " -> " + result.afterCount());
            System.out.println("Merged: " + result.mergedCount() + ", removed: " + result.removedCount()
                + ", decayed: " + result.decayedCount() + ", pinned kept: " + result.preservedPinnedCount());
            System.out.println(String.format(
                Locale.ROOT,
                "Redundancy reduction: %.2f, recall retention: %.2f",
                result.redundancyReduction(),
                result.recallRetention()
            ));
            return 0;
        } catch (Exception e) {
            System.err.println("Consolidate failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printHistory(List<ConsolidationRun> runs) {
        if (runs.isEmpty()) {
            System.out.println("No consolidation runs yet.");
            return;
        }
        for (ConsolidationRun run : runs) {
            String detail = run.stats() != null
                ? "merged=" + run.stats().mergedCount() + " decayed=" + run.stats().decayedCount()
                : run.error() == null ? "" : run.error();
            System.out.println(run.id() + " " + run.status().wireValue() + " " + detail);
        }
    }
}
