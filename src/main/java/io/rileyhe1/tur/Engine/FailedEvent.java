package io.rileyhe1.tur.Engine;

public class FailedEvent extends EngineEvent
{
    private String error;

    // No arg constructor for gson deserialization
    private FailedEvent()
    {
    }

    public FailedEvent(String id, String error)
    {
        this(id, error, null);
    }

    public FailedEvent(String id, String error, Long sequence)
    {
        super(id, sequence);
        this.error = error;
    }

    public String getError()
    {
        return error;
    }

    @Override
    public Kind getKind()
    {
        return Kind.FAILED;
    }
}
