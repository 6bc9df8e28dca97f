package io.rileyhe1.tur.Settings;

import java.util.Map;
import java.util.Optional;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Helpers for the nested JSON document settings are kept in. None of them mutate their inputs.
 */
public final class SettingsDocument
{
    private SettingsDocument()
    {
    }

    /**
     * Combines the defaults with what was persisted. Objects present on both sides are merged
     * recursively, anything else from the persisted side replaces the default at that path.
     * Keys only present in the persisted document are kept.
     */
    public static JsonObject deepMerge(JsonObject defaults, JsonObject persisted)
    {
        if(defaults == null) throw new IllegalArgumentException("Defaults cannot be null");
        JsonObject merged = defaults.deepCopy();
        if(persisted == null) return merged;

        for(Map.Entry<String, JsonElement> entry : persisted.entrySet())
        {
            JsonElement current = merged.get(entry.getKey());
            JsonElement incoming = entry.getValue();
            if(current != null && current.isJsonObject() && incoming != null && incoming.isJsonObject())
            {
                merged.add(entry.getKey(), deepMerge(current.getAsJsonObject(), incoming.getAsJsonObject()));
            }
            else
            {
                merged.add(entry.getKey(), incoming == null ? null : incoming.deepCopy());
            }
        }
        return merged;
    }

    // walks a dotted path, empty if any segment is missing or not an object
    public static Optional<JsonElement> resolve(JsonObject document, String path)
    {
        if(document == null || path == null || path.isEmpty()) return Optional.empty();

        JsonElement current = document;
        for(String segment : path.split("\\.", -1))
        {
            if(current == null || !current.isJsonObject()) return Optional.empty();
            current = current.getAsJsonObject().get(segment);
        }
        if(current == null || current.isJsonNull()) return Optional.empty();
        return Optional.of(current);
    }

    /**
     * Returns a copy of the document with the value written at the dotted path. Missing
     * intermediate objects are created.
     *
     * @throws IllegalArgumentException if an intermediate segment holds a non-object value
     */
    public static JsonObject withValue(JsonObject document, String path, JsonElement value)
    {
        if(document == null) throw new IllegalArgumentException("Document cannot be null");
        if(path == null || path.isEmpty()) throw new IllegalArgumentException("Path cannot be null or empty");
        if(value == null) throw new IllegalArgumentException("Value cannot be null");

        String[] segments = path.split("\\.", -1);
        for(String segment : segments)
        {
            if(segment.isEmpty()) throw new IllegalArgumentException("Path has an empty segment: " + path);
        }

        JsonObject copy = document.deepCopy();
        JsonObject current = copy;
        for(int i = 0; i < segments.length - 1; i++)
        {
            JsonElement child = current.get(segments[i]);
            if(child == null || child.isJsonNull())
            {
                JsonObject created = new JsonObject();
                current.add(segments[i], created);
                current = created;
            }
            else if(child.isJsonObject())
            {
                current = child.getAsJsonObject();
            }
            else
            {
                throw new IllegalArgumentException("Cannot write " + path + ", " + segments[i] + " is not an object");
            }
        }
        current.add(segments[segments.length - 1], value.deepCopy());
        return copy;
    }
}
