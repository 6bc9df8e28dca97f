package io.rileyhe1.tur.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one command sent to the engine. Failures are values, never thrown,
 * so the UI can render them inline.
 */
public class CommandResult
{
    private final EngineCommand command;
    private final List<String> targets;
    private final boolean success;
    private final Exception error;

    private CommandResult(EngineCommand command, List<String> targets, boolean success, Exception error)
    {
        this.command = command;
        this.targets = targets == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(targets));
        this.success = success;
        this.error = error;
    }

    public static CommandResult success(EngineCommand command, List<String> targets)
    {
        return new CommandResult(command, targets, true, null);
    }

    public static CommandResult failure(EngineCommand command, List<String> targets, Exception error)
    {
        if(error == null) throw new IllegalArgumentException("A failed command needs an error");
        return new CommandResult(command, targets, false, error);
    }

    public EngineCommand getCommand()
    {
        return command;
    }

    // urls for START, download ids for everything else
    public List<String> getTargets()
    {
        return targets;
    }

    public boolean isSuccessful()
    {
        return success;
    }

    public Exception getError()
    {
        return error;
    }

    public boolean hasError()
    {
        return this.error != null;
    }

    public String getErrorMessage()
    {
        return this.error != null ? error.getMessage() : null;
    }
}
