package it.unimib.datai.runinator.console.commands;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(name = "discover", description = "Wait for a web service announcement and print its base URL.")
public class DiscoverCommand implements Runnable {

    @ParentCommand
    RootCommand root;

    @Override
    public void run() {
        String url = root.await(root.session().awaitBackend());
        System.out.println(url);
    }
}
