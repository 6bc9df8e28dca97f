package io.rileyhe1.tur.Engine;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Converts engine notifications to and from their JSON envelope:
 * <pre>{"event": "download_progress", "payload": {"id": "...", "downloaded": 50, ...}}</pre>
 * Payload fields use snake_case, e.g. {@code resume_supported}.
 */
public class EngineEventCodec
{
    private static final String EVENT_FIELD = "event";
    private static final String PAYLOAD_FIELD = "payload";

    private final Gson gson;

    public EngineEventCodec()
    {
        this.gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();
    }

    public EngineEvent decode(String json)
    {
        if(json == null || json.trim().isEmpty()) throw new IllegalArgumentException("Event json cannot be null or empty");

        JsonElement parsed = JsonParser.parseString(json);
        if(!parsed.isJsonObject()) throw new JsonParseException("Engine event must be a JSON object: " + json);
        JsonObject envelope = parsed.getAsJsonObject();

        JsonElement name = envelope.get(EVENT_FIELD);
        JsonElement payload = envelope.get(PAYLOAD_FIELD);
        if(name == null || !name.isJsonPrimitive()) throw new JsonParseException("Engine event is missing its name");
        if(payload == null || !payload.isJsonObject()) throw new JsonParseException("Engine event " + name.getAsString() + " is missing its payload");

        EngineEvent.Kind kind = EngineEvent.Kind.fromEventName(name.getAsString());
        EngineEvent event = gson.fromJson(payload, typeOf(kind));

        // gson skips the constructor checks, so the id has to be verified here
        if(event.getId() == null || event.getId().trim().isEmpty())
        {
            throw new JsonParseException("Engine event " + kind.getEventName() + " has no download id");
        }
        return event;
    }

    public String encode(EngineEvent event)
    {
        if(event == null) throw new IllegalArgumentException("Event cannot be null");
        JsonObject envelope = new JsonObject();
        envelope.addProperty(EVENT_FIELD, event.getKind().getEventName());
        envelope.add(PAYLOAD_FIELD, gson.toJsonTree(event));
        return gson.toJson(envelope);
    }

    private static Class<? extends EngineEvent> typeOf(EngineEvent.Kind kind)
    {
        switch(kind)
        {
            case QUEUE:
                return QueueEvent.class;
            case STARTED:
                return StartedEvent.class;
            case PROGRESS:
                return ProgressEvent.class;
            case COMPLETE:
                return CompleteEvent.class;
            case FAILED:
                return FailedEvent.class;
            default:
                throw new IllegalArgumentException("Unhandled event kind: " + kind);
        }
    }
}
