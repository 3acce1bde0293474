package it.unimib.datai.runinator.console.commands.tasks;

import it.unimib.datai.runinator.common.codec.TaskCodec;
import it.unimib.datai.runinator.common.model.ScheduledTask;
import it.unimib.datai.runinator.console.io.YamlIO;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;

@Command(name = "apply", description = "Create a task from a YAML/JSON file, or update it when the file carries an id.")
public class TasksApplyCommand implements Runnable {

    @ParentCommand
    TasksCommand parent;

    @Option(names = {"-f", "--file"}, required = true, description = "Path to task YAML or JSON (snake_case keys).")
    Path file;

    @Override
    public void run() {
        ScheduledTask task = TaskCodec.decode(YamlIO.readTree(file));
        TasksCommand.printOutcome(parent.root.await(parent.root.session().saveTask(task)));
    }
}
