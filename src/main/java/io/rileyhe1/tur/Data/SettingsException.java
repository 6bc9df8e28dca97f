package io.rileyhe1.tur.Data;

/**
 * Raised when a settings change could not be persisted. The in-memory document is left untouched.
 */
public class SettingsException extends Exception
{
    private final String path;

    public SettingsException(String message, String path)
    {
        super(message);
        this.path = path;
    }

    public SettingsException(String message, Throwable cause, String path)
    {
        super(message, cause);
        this.path = path;
    }

    public String getPath()
    {
        return path;
    }
}
