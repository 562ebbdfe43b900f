package io.mnemo.cli;

import io.mnemo.core.feedback.FeedbackRequest;
import io.mnemo.core.feedback.FeedbackType;
import io.mnemo.core.feedback.MemoryFeedback;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "feedback", description = "Record feedback on a memory (pin, unpin, hide, positive, negative, report_conflict)")
public final class FeedbackCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Memory id")
    String atomId;

    @Parameters(index = "1", arity = "1", description = "Feedback kind")
    String kind;

    @Option(names = {"-q", "--query"}, description = "Query id the memory was returned by")
    String queryId;

    @Option(names = {"-s", "--session"}, description = "Session id")
    String sessionId;

    @Option(names = "--note", description = "Free-text note")
    String note;

    public FeedbackCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MemoryFeedback feedback = context.memoryService().applyFeedback(
                new FeedbackRequest(sessionId, queryId, atomId, FeedbackType.fromWire(kind), note)
            );
            System.out.println("Recorded " + feedback.feedback().wireValue() + " feedback " + feedback.id());
            return 0;
        } catch (Exception e) {
            System.err.println("Feedback failed: " + e.getMessage());
            return 1;
        }
    }
}
