package it.unimib.datai.runinator.console.commands.tasks;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "delete", description = "Delete a task by id.")
public class TasksDeleteCommand implements Runnable {

    @ParentCommand
    TasksCommand parent;

    @Parameters(index = "0", description = "Task id")
    long id;

    @Override
    public void run() {
        TasksCommand.printOutcome(parent.root.await(parent.root.session().deleteTask(id)));
    }
}
