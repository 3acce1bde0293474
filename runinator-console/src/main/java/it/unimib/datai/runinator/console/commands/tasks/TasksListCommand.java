package it.unimib.datai.runinator.console.commands.tasks;

import it.unimib.datai.runinator.common.codec.TaskTimestamps;
import it.unimib.datai.runinator.common.model.ScheduledTask;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.List;

@Command(name = "list", description = "List scheduled tasks.")
public class TasksListCommand implements Runnable {

    @ParentCommand
    TasksCommand parent;

    @Override
    public void run() {
        List<ScheduledTask> tasks = parent.root.await(parent.root.session().refreshTasks());
        for (ScheduledTask t : tasks) {
            System.out.printf("%s\t%s\t%s\t%s\t%s%n",
                    t.id() == null ? "-" : t.id(),
                    t.name(),
                    t.cronSchedule(),
                    t.enabled() ? "enabled" : "disabled",
                    TaskTimestamps.display(t.nextExecution()));
        }
    }
}
