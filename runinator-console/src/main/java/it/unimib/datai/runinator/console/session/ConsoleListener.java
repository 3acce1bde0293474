package it.unimib.datai.runinator.console.session;

import it.unimib.datai.runinator.common.model.ScheduledTask;
import it.unimib.datai.runinator.console.ConsoleException;

import java.util.List;

/**
 * Outcome events for the presentation layer, delivered on the event loop thread.
 */
public interface ConsoleListener {

    /** The full task set, replacing whatever was shown before. */
    default void tasksReplaced(List<ScheduledTask> tasks) {
    }

    default void operationFailed(ConsoleException failure) {
    }

    default void runResult(boolean ok, String message) {
    }

    default void saveResult(boolean ok, String message, boolean creation) {
    }

    default void deleteResult(boolean ok, String message) {
    }

    default void backendUrlChanged(String url) {
    }
}
