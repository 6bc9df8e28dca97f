package io.rileyhe1.tur.Engine;

public class CompleteEvent extends EngineEvent
{
    // No arg constructor for gson deserialization
    private CompleteEvent()
    {
    }

    public CompleteEvent(String id)
    {
        super(id, null);
    }

    public CompleteEvent(String id, Long sequence)
    {
        super(id, sequence);
    }

    @Override
    public Kind getKind()
    {
        return Kind.COMPLETE;
    }
}
