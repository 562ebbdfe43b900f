package io.mnemo.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "groups", description = "List, create or delete memory groups")
public final class GroupsCommand implements Callable<Integer> {
    private final CliContext context;

    @ArgGroup(exclusive = true)
    Action action;

    static final class Action {
        @Option(names = "--create", description = "Register a custom group")
        String create;

        @Option(names = "--delete", description = "Delete a custom group and its memories")
        String delete;
    }

    public GroupsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (action != null && action.create != null) {
                context.memoryService().createGroup(action.create);
                System.out.println("Created group " + action.create.trim());
                return 0;
            }
            if (action != null && action.delete != null) {
                int deleted = context.memoryService().deleteGroup(action.delete);
                System.out.println("Deleted group " + action.delete + " and " + deleted + " memories");
                return 0;
            }
            for (String group : context.memoryService().listGroups()) {
                int count = context.memoryService().getMemoriesByGroup(group).size();
                System.out.println(group + " (" + count + ")");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Groups command failed: " + e.getMessage());
            return 1;
        }
    }
}
