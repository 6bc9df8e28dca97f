package io.rileyhe1.tur.Engine;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Request/response path to the download engine. Every call may fail on its own; a failed call
 * completes its future exceptionally, preferably with an {@link io.rileyhe1.tur.Data.EngineException}.
 * Timeouts are the implementation's concern.
 */
public interface CommandChannel
{
    CompletableFuture<Void> start(List<String> urls);

    CompletableFuture<Void> resume(List<String> ids);

    CompletableFuture<Void> pause(String id);

    CompletableFuture<Void> cancel(String id);
}
