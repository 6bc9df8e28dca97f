package io.rileyhe1.tur.Engine;

import java.util.function.Consumer;

import io.rileyhe1.tur.Util.Subscription;

/**
 * Push stream of engine notifications. Implementations deliver events for one engine in arrival
 * order and never run two callbacks for the same subscriber at once.
 */
public interface EventChannel
{
    Subscription subscribe(Consumer<EngineEvent> listener);
}
