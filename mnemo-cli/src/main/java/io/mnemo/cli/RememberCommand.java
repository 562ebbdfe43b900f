package io.mnemo.cli;

import io.mnemo.core.memory.CreateMemoryInput;
import io.mnemo.core.memory.Memory;
import io.mnemo.core.memory.MemoryGroups;
import io.mnemo.core.memory.MemorySource;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "remember", description = "Store a memory, merging it into a near-duplicate when one exists")
public final class RememberCommand implements Callable<Integer> {
    private static final int TITLE_LENGTH = 60;

    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Memory content")
    String content;

    @Option(names = {"-t", "--title"}, description = "Title, derived from the content when omitted")
    String title;

    @Option(names = {"-g", "--group"}, description = "Memory group", defaultValue = MemoryGroups.LEARNINGS)
    String group;

    @Option(names = "--tag", description = "Tag, repeatable")
    List<String> tags = new ArrayList<>();

    @Option(names = "--auto", description = "Mark as automatically extracted")
    boolean auto;

    @Option(names = "--confidence", description = "Confidence in [0,1]")
    Double confidence;

    public RememberCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CreateMemoryInput input = new CreateMemoryInput(
                title == null || title.isBlank() ? deriveTitle(content) : title,
                content,
                group,
                tags,
                auto ? MemorySource.AUTO : MemorySource.MANUAL,
                confidence,
                List.of()
            );
            Memory memory = context.memoryService().create(input);
            System.out.println("Stored memory " + memory.id() + " in " + memory.group());
            return 0;
        } catch (Exception e) {
            System.err.println("Remember failed: " + e.getMessage());
            return 1;
        }
    }

    private static String deriveTitle(String text) {
        String trimmed = text == null ? "" : text.trim().replaceAll("\\s+", " ");
        return trimmed.length() <= TITLE_LENGTH ? trimmed : trimmed.substring(0, TITLE_LENGTH).trim();
    }
}
