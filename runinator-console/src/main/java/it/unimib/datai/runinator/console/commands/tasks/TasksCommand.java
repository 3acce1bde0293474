package it.unimib.datai.runinator.console.commands.tasks;

import it.unimib.datai.runinator.console.commands.RootCommand;
import it.unimib.datai.runinator.console.http.TaskOutcome;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
        name = "tasks",
        description = "Manage scheduled tasks.",
        subcommands = {
                TasksListCommand.class,
                TasksRunCommand.class,
                TasksApplyCommand.class,
                TasksDeleteCommand.class
        }
)
public class TasksCommand {

    @ParentCommand
    RootCommand root;

    static void printOutcome(TaskOutcome outcome) {
        System.out.printf("%s: %s%n", outcome.success() ? "OK" : "ERR", outcome.message());
    }
}
