package io.rileyhe1.tur.Engine;

public class StartedEvent extends EngineEvent
{
    // No arg constructor for gson deserialization
    private StartedEvent()
    {
    }

    public StartedEvent(String id)
    {
        super(id, null);
    }

    public StartedEvent(String id, Long sequence)
    {
        super(id, sequence);
    }

    @Override
    public Kind getKind()
    {
        return Kind.STARTED;
    }
}
