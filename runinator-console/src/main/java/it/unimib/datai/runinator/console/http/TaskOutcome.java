package it.unimib.datai.runinator.console.http;

/**
 * Decoded {@code {success, message}} acknowledgement of a run, create, update or delete request.
 *
 * @param creation whether the request created a new task; only meaningful for saves
 */
public record TaskOutcome(boolean success, String message, boolean creation) {

    static TaskOutcome of(ResponseEnvelope.Outcome outcome, boolean creation) {
        return new TaskOutcome(outcome.success(), outcome.message(), creation);
    }
}
