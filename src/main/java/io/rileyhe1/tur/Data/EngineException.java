package io.rileyhe1.tur.Data;

/**
 * Raised when the download engine rejects or fails a command.
 */
public class EngineException extends Exception
{
    private final EngineCommand command;
    private final String downloadId;

    // used when we don't know which command or download failed
    public EngineException(String message)
    {
        super(message);
        this.command = null;
        this.downloadId = null;
    }

    // used to wrap a lower level failure coming out of the engine transport
    public EngineException(String message, Throwable cause)
    {
        super(message, cause);
        this.command = null;
        this.downloadId = null;
    }

    // used when the failing command is known, downloadId may be null for multi-id commands
    public EngineException(String message, EngineCommand command, String downloadId)
    {
        super(message);
        this.command = command;
        this.downloadId = downloadId;
    }

    // full context + underlying cause
    public EngineException(String message, Throwable cause, EngineCommand command, String downloadId)
    {
        super(message, cause);
        this.command = command;
        this.downloadId = downloadId;
    }

    public EngineCommand getCommand()
    {
        return command;
    }

    public String getDownloadId()
    {
        return downloadId;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder("EngineException: ");
        sb.append(getMessage());

        if(command != null)
        {
            sb.append(" [command=").append(command).append("]");
        }

        if(downloadId != null)
        {
            sb.append(" [downloadId=").append(downloadId).append("]");
        }

        if(getCause() != null)
        {
            sb.append(" caused by ").append(getCause().getClass().getSimpleName());
            sb.append(": ").append(getCause().getMessage());
        }

        return sb.toString();
    }
}
