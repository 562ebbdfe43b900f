package io.mnemo.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "forget", description = "Delete a memory")
public final class ForgetCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Memory id")
    String id;

    public ForgetCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (!context.memoryService().delete(id)) {
                System.err.println("Forget failed: no memory " + id);
                return 1;
            }
            System.out.println("Deleted memory " + id);
            return 0;
        } catch (Exception e) {
            System.err.println("Forget failed: " + e.getMessage());
            return 1;
        }
    }
}
