package io.rileyhe1.tur.Shell;

/**
 * A named channel on {@link ShellEvents} carrying payloads of one type.
 */
public final class ShellTopic<T>
{
    public static final ShellTopic<Boolean> HOME_EMPTY_STATE = new ShellTopic<>("home-empty-state", Boolean.class);
    public static final ShellTopic<ShellAction> ACTION = new ShellTopic<>("shell-action", ShellAction.class);

    private final String name;
    private final Class<T> payloadType;

    private ShellTopic(String name, Class<T> payloadType)
    {
        this.name = name;
        this.payloadType = payloadType;
    }

    public String getName()
    {
        return name;
    }

    public Class<T> getPayloadType()
    {
        return payloadType;
    }

    @Override
    public String toString()
    {
        return name;
    }
}
