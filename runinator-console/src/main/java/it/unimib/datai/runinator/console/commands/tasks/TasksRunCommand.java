package it.unimib.datai.runinator.console.commands.tasks;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "run", description = "Request an immediate run of a task.")
public class TasksRunCommand implements Runnable {

    @ParentCommand
    TasksCommand parent;

    @Parameters(index = "0", description = "Task id")
    long id;

    @Override
    public void run() {
        TasksCommand.printOutcome(parent.root.await(parent.root.session().requestRun(id)));
    }
}
