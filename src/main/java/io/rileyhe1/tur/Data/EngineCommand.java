package io.rileyhe1.tur.Data;

public enum EngineCommand
{
    START,
    RESUME,
    PAUSE,
    CANCEL
}
