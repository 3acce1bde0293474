package it.unimib.datai.runinator.common.model;

import java.time.Instant;

/**
 * A schedulable unit of work as exchanged with the Runinator web service.
 *
 * <p>{@code id} is assigned by the backend and is {@code null} for a task that has not been created yet.
 * Text fields are never {@code null}; a missing value is the empty string.
 * Timestamps are UTC instants and may be {@code null}.</p>
 */
public record ScheduledTask(
        Long id,
        String name,
        String cronSchedule,
        String actionName,
        String actionFunction,
        String actionConfiguration,
        long timeout,
        Instant nextExecution,
        boolean enabled,
        boolean immediate,
        Instant blackoutStart,
        Instant blackoutEnd
) {
    public ScheduledTask {
        name = orEmpty(name);
        cronSchedule = orEmpty(cronSchedule);
        actionName = orEmpty(actionName);
        actionFunction = orEmpty(actionFunction);
        actionConfiguration = orEmpty(actionConfiguration);
    }

    public boolean isPendingCreation() {
        return id == null;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
