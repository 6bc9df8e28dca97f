package io.rileyhe1.tur.Engine;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import io.rileyhe1.tur.Util.Subscription;

/**
 * In-process event channel fed by whatever transport talks to the engine.
 * All deliveries go through one serial executor, so a callback always runs to completion before
 * the next event is handed out and events keep their publish order.
 */
public class LocalEventChannel implements EventChannel, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(LocalEventChannel.class);

    private final List<Consumer<EngineEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Executor dispatcher;
    private final ExecutorService ownedDispatcher;
    private final EngineEventCodec codec;
    private volatile boolean closed = false;

    // creates a channel with its own single dispatcher thread
    public LocalEventChannel(String threadName)
    {
        if(threadName == null || threadName.trim().isEmpty()) throw new IllegalArgumentException("Thread name cannot be null or empty");
        this.ownedDispatcher = Executors.newSingleThreadExecutor(runnable ->
        {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
        this.dispatcher = ownedDispatcher;
        this.codec = new EngineEventCodec();
    }

    // the given executor must run tasks one at a time and in submission order
    public LocalEventChannel(Executor serialExecutor)
    {
        if(serialExecutor == null) throw new IllegalArgumentException("Executor cannot be null");
        this.ownedDispatcher = null;
        this.dispatcher = serialExecutor;
        this.codec = new EngineEventCodec();
    }

    @Override
    public Subscription subscribe(Consumer<EngineEvent> listener)
    {
        if(listener == null) throw new IllegalArgumentException("Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(EngineEvent event)
    {
        if(event == null) throw new IllegalArgumentException("Event cannot be null");
        if(closed) throw new IllegalStateException("Event channel is closed");
        dispatch(event);
    }

    /**
     * Decodes and publishes one raw engine message.
     *
     * @return false when the message could not be decoded or the channel was closing, the message is dropped either way
     */
    public boolean publishJson(String json)
    {
        EngineEvent event;
        try
        {
            event = codec.decode(json);
        }
        catch(JsonParseException | IllegalArgumentException | IllegalStateException e)
        {
            logger.warn("Dropping malformed engine event: {}", e.getMessage());
            return false;
        }
        if(closed)
        {
            logger.warn("Dropping {}, event channel is closed", event);
            return false;
        }
        return dispatch(event);
    }

    private boolean dispatch(EngineEvent event)
    {
        try
        {
            dispatcher.execute(() -> deliver(event));
            return true;
        }
        catch(RejectedExecutionException e)
        {
            // close() won the race against the closed check
            logger.warn("Dropping {}, dispatcher no longer accepts events", event);
            return false;
        }
    }

    public int getListenerCount()
    {
        return listeners.size();
    }

    private void deliver(EngineEvent event)
    {
        for(Consumer<EngineEvent> listener : listeners)
        {
            try
            {
                listener.accept(event);
            }
            catch(RuntimeException e)
            {
                // one broken subscriber must not starve the others
                logger.error("Listener failed while handling {}", event, e);
            }
        }
    }

    @Override
    public void close()
    {
        closed = true;
        listeners.clear();
        if(ownedDispatcher != null) ownedDispatcher.shutdown();
    }
}
