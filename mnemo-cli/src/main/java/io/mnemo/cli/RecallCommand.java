package io.mnemo.cli;

import io.mnemo.core.memory.Memory;
import io.mnemo.core.memory.MemorySearchOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "recall", description = "List memories matching a substring and filters")
public final class RecallCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Substring to look for in title, content or tags")
    String query;

    @Option(names = {"-g", "--group"}, description = "Group filter, repeatable")
    List<String> groups = new ArrayList<>();

    @Option(names = "--tag", description = "Tag filter, repeatable")
    List<String> tags = new ArrayList<>();

    @Option(names = "--min-confidence", description = "Minimum confidence")
    Double minConfidence;

    @Option(names = {"-n", "--limit"}, description = "Maximum results")
    Integer limit;

    public RecallCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<Memory> memories = context.memoryService().search(
                new MemorySearchOptions(query, groups, null, minConfidence, tags, limit)
            );
            if (memories.isEmpty()) {
                System.out.println("No memories found.");
                return 0;
            }
            for (Memory memory : memories) {
                System.out.println(String.format(
                    Locale.ROOT,
                    "%s [%s] %s (confidence %.2f)",
                    memory.id(),
                    memory.group(),
                    memory.title(),
                    memory.confidence()
                ));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Recall failed: " + e.getMessage());
            return 1;
        }
    }
}
