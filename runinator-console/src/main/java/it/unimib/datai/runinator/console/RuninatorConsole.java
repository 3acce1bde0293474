package it.unimib.datai.runinator.console;

import it.unimib.datai.runinator.console.commands.RootCommand;
import picocli.CommandLine;

public final class RuninatorConsole {
    private RuninatorConsole() {}

    public static void main(String[] args) {
        RootCommand root = new RootCommand();
        CommandLine cli = new CommandLine(root);
        cli.setExpandAtFiles(false);
        int exitCode;
        try {
            exitCode = cli.execute(args);
        } finally {
            root.close();
        }
        System.exit(exitCode);
    }
}
