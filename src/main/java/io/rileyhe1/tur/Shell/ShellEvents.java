package io.rileyhe1.tur.Shell;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.tur.Util.Subscription;

/**
 * Typed publish/subscribe between shell components. Delivery is synchronous, on the publishing
 * thread, in subscription order. The last payload of each topic is kept so late subscribers can
 * catch up.
 */
public class ShellEvents
{
    private static final Logger logger = LoggerFactory.getLogger(ShellEvents.class);

    private final Map<ShellTopic<?>, List<Consumer<Object>>> listeners = new ConcurrentHashMap<>();
    private final Map<ShellTopic<?>, Object> lastPayloads = new ConcurrentHashMap<>();

    @SuppressWarnings("unchecked")
    public <T> Subscription subscribe(ShellTopic<T> topic, Consumer<? super T> listener)
    {
        if(topic == null) throw new IllegalArgumentException("Topic cannot be null");
        if(listener == null) throw new IllegalArgumentException("Listener cannot be null");

        Consumer<Object> registered = (Consumer<Object>) listener;
        List<Consumer<Object>> topicListeners = listeners.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>());
        topicListeners.add(registered);
        return () -> topicListeners.remove(registered);
    }

    public <T> void publish(ShellTopic<T> topic, T payload)
    {
        if(topic == null) throw new IllegalArgumentException("Topic cannot be null");
        if(payload == null) throw new IllegalArgumentException("Payload cannot be null");

        lastPayloads.put(topic, payload);
        List<Consumer<Object>> topicListeners = listeners.get(topic);
        if(topicListeners == null) return;

        for(Consumer<Object> listener : topicListeners)
        {
            try
            {
                listener.accept(payload);
            }
            catch(RuntimeException e)
            {
                logger.error("Listener on {} failed for {}", topic, payload, e);
            }
        }
    }

    public <T> Optional<T> lastPayload(ShellTopic<T> topic)
    {
        if(topic == null) throw new IllegalArgumentException("Topic cannot be null");
        return Optional.ofNullable(lastPayloads.get(topic)).map(topic.getPayloadType()::cast);
    }

    public boolean isHomeEmpty()
    {
        return lastPayload(ShellTopic.HOME_EMPTY_STATE).orElse(false);
    }
}
