package io.rileyhe1.tur.Engine;

/**
 * Base type of every notification pushed by the download engine.
 * The optional sequence number is stamped by the engine per download; unsequenced events are
 * applied in arrival order.
 */
public abstract class EngineEvent
{
    public enum Kind
    {
        QUEUE("queue_download"),
        STARTED("download_started"),
        PROGRESS("download_progress"),
        COMPLETE("download_complete"),
        FAILED("download_failed");

        private final String eventName;

        Kind(String eventName)
        {
            this.eventName = eventName;
        }

        public String getEventName()
        {
            return eventName;
        }

        public static Kind fromEventName(String eventName)
        {
            for(Kind kind : values())
            {
                if(kind.eventName.equals(eventName)) return kind;
            }
            throw new IllegalArgumentException("Unknown engine event: " + eventName);
        }
    }

    private String id;
    private Long sequence;

    protected EngineEvent()
    {
    }

    protected EngineEvent(String id, Long sequence)
    {
        if(id == null || id.trim().isEmpty()) throw new IllegalArgumentException("Event id cannot be null or empty");
        this.id = id;
        this.sequence = sequence;
    }

    public String getId()
    {
        return id;
    }

    public Long getSequence()
    {
        return sequence;
    }

    public boolean isSequenced()
    {
        return sequence != null;
    }

    public abstract Kind getKind();

    @Override
    public String toString()
    {
        return getKind().getEventName() + "{id=" + id + (sequence != null ? ", sequence=" + sequence : "") + "}";
    }
}
