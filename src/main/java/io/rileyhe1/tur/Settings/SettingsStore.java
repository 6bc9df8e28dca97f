package io.rileyhe1.tur.Settings;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import io.rileyhe1.tur.Data.SettingsException;
import io.rileyhe1.tur.Util.Subscription;

/**
 * Holds the user's settings as a nested JSON document.
 * <p>
 * The document reference is swapped whole on every change, so readers never block and never see
 * a half applied write. Writes go to persistence first and only replace the in-memory document
 * once the save succeeded. Until {@link #load()} has run, reads see the compiled in defaults with
 * the last known fast-path values laid over them.
 */
public class SettingsStore
{
    private static final Logger logger = LoggerFactory.getLogger(SettingsStore.class);

    private final SettingsPersistence persistence;
    private final FastPathCache fastPathCache;
    private final List<SettingsChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Gson gson;

    private volatile JsonObject document;
    private volatile boolean ready = false;

    public SettingsStore(SettingsPersistence persistence, FastPathCache fastPathCache)
    {
        if(persistence == null) throw new IllegalArgumentException("Settings persistence cannot be null");
        if(fastPathCache == null) throw new IllegalArgumentException("Fast-path cache cannot be null");
        this.persistence = persistence;
        this.fastPathCache = fastPathCache;
        this.gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();
        this.document = overlayFastPath(SettingKey.defaultDocument(), readFastPath());
    }

    /**
     * Loads the persisted document and merges it over the defaults. Runs at most once; later
     * calls return immediately. A failed load is logged and the store still becomes ready with
     * whatever it already had.
     */
    public synchronized void load()
    {
        if(ready) return;

        try
        {
            JsonObject defaults = SettingKey.defaultDocument();
            JsonObject persisted = persistence.load();
            if(persisted == null)
            {
                logger.info("No saved settings found, using defaults");
                document = defaults;
                saveBestEffort(defaults);
            }
            else
            {
                JsonObject merged = repair(SettingsDocument.deepMerge(defaults, persisted));
                document = merged;
                // keys added since the file was written get filled in on disk as well
                if(!merged.equals(persisted)) saveBestEffort(merged);
                logger.info("Settings loaded");
            }
            writeFastPath(document);
        }
        catch(IOException e)
        {
            logger.error("Failed to load settings, continuing with defaults", e);
        }
        finally
        {
            ready = true;
        }

        for(SettingsChangeListener listener : listeners)
        {
            try
            {
                listener.onSettingsLoaded(this);
            }
            catch(RuntimeException e)
            {
                logger.error("Settings listener failed after load", e);
            }
        }
    }

    public CompletableFuture<Void> loadAsync(Executor executor)
    {
        if(executor == null) throw new IllegalArgumentException("Executor cannot be null");
        return CompletableFuture.runAsync(this::load, executor);
    }

    public boolean isReady()
    {
        return ready;
    }

    // Reads //

    /**
     * Resolves a dotted path such as {@code app.theme}. Never throws; any missing segment gives
     * an empty result.
     */
    public Optional<JsonElement> get(String path)
    {
        return SettingsDocument.resolve(document, path).map(JsonElement::deepCopy);
    }

    public String getString(SettingKey key)
    {
        return typedValue(key).getAsString();
    }

    public boolean getBoolean(SettingKey key)
    {
        return typedValue(key).getAsBoolean();
    }

    /**
     * @throws IllegalArgumentException if the setting can hold values outside the int range
     */
    public int getInt(SettingKey key)
    {
        if(key != null && !key.fitsInt()) throw new IllegalArgumentException("Setting " + key.getPath() + " does not fit an int, use getLong");
        return typedValue(key).getAsInt();
    }

    public long getLong(SettingKey key)
    {
        return typedValue(key).getAsLong();
    }

    public AppSettings getSettings()
    {
        return gson.fromJson(document, AppSettings.class);
    }

    // the groups the engine is configured from
    public JsonObject getEngineSettings()
    {
        JsonObject current = document;
        JsonObject engine = new JsonObject();
        for(String group : new String[] {"download", "thread", "session"})
        {
            JsonElement value = current.get(group);
            if(value != null) engine.add(group, value.deepCopy());
        }
        return engine;
    }

    // Writes //

    /**
     * Sets a single value by dotted path.
     *
     * @throws IllegalArgumentException if the path is not a known setting or the value does not fit it
     * @throws SettingsException if the new document could not be persisted; nothing changes in memory
     */
    public void set(String path, Object value) throws SettingsException
    {
        SettingKey key = SettingKey.fromPath(path)
            .orElseThrow(() -> new IllegalArgumentException("Unknown setting: " + path));
        set(key, value);
    }

    public void set(SettingKey key, Object value) throws SettingsException
    {
        if(key == null) throw new IllegalArgumentException("Setting key cannot be null");
        JsonPrimitive element = key.toJson(value);

        JsonObject updated;
        synchronized(this)
        {
            // a write before the first load would otherwise overwrite the saved file with defaults
            if(!ready) load();

            updated = SettingsDocument.withValue(document, key.getPath(), element);
            try
            {
                persistence.save(updated);
            }
            catch(IOException e)
            {
                throw new SettingsException("Failed to save setting " + key.getPath() + ": " + e.getMessage(), e, key.getPath());
            }
            document = updated;
            if(key.isFastPath()) writeFastPath(updated);
        }

        logger.debug("Setting {} changed to {}", key.getPath(), element);
        for(SettingsChangeListener listener : listeners)
        {
            try
            {
                listener.onSettingChanged(key, element);
            }
            catch(RuntimeException e)
            {
                logger.error("Settings listener failed for {}", key.getPath(), e);
            }
        }
    }

    public Subscription addListener(SettingsChangeListener listener)
    {
        if(listener == null) throw new IllegalArgumentException("Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private JsonPrimitive typedValue(SettingKey key)
    {
        if(key == null) throw new IllegalArgumentException("Setting key cannot be null");
        Optional<JsonElement> value = SettingsDocument.resolve(document, key.getPath());
        if(value.isPresent() && key.accepts(value.get())) return value.get().getAsJsonPrimitive();
        return key.getDefaultValue();
    }

    // values of the wrong type or outside their choices fall back to the default
    private static JsonObject repair(JsonObject merged)
    {
        JsonObject repaired = merged;
        for(SettingKey key : SettingKey.values())
        {
            Optional<JsonElement> value = SettingsDocument.resolve(repaired, key.getPath());
            if(value.isPresent() && key.accepts(value.get())) continue;
            logger.warn("Saved value for {} is invalid, using default {}", key.getPath(), key.getDefaultValue());
            try
            {
                repaired = SettingsDocument.withValue(repaired, key.getPath(), key.getDefaultValue());
            }
            catch(IllegalArgumentException e)
            {
                // a parent group was saved as a scalar, replace the whole group
                String group = key.getPath().substring(0, key.getPath().indexOf('.'));
                repaired.add(group, new JsonObject());
                repaired = SettingsDocument.withValue(repaired, key.getPath(), key.getDefaultValue());
            }
        }
        return repaired;
    }

    private void saveBestEffort(JsonObject merged)
    {
        try
        {
            persistence.save(merged);
        }
        catch(IOException e)
        {
            logger.warn("Could not write merged settings back: {}", e.getMessage());
        }
    }

    private Map<String, String> readFastPath()
    {
        try
        {
            return fastPathCache.read();
        }
        catch(IOException e)
        {
            logger.warn("Could not read fast-path cache: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private void writeFastPath(JsonObject source)
    {
        Map<String, String> values = new LinkedHashMap<>();
        for(SettingKey key : SettingKey.values())
        {
            if(!key.isFastPath()) continue;
            SettingsDocument.resolve(source, key.getPath())
                .ifPresent(value -> values.put(key.getPath(), value.getAsString()));
        }
        try
        {
            fastPathCache.write(values);
        }
        catch(IOException e)
        {
            logger.warn("Could not update fast-path cache: {}", e.getMessage());
        }
    }

    private static JsonObject overlayFastPath(JsonObject defaults, Map<String, String> cached)
    {
        JsonObject overlaid = defaults;
        for(Map.Entry<String, String> entry : cached.entrySet())
        {
            Optional<SettingKey> key = SettingKey.fromPath(entry.getKey());
            JsonPrimitive value = entry.getValue() == null ? null : new JsonPrimitive(entry.getValue());
            if(!key.isPresent() || !key.get().isFastPath() || !key.get().accepts(value))
            {
                logger.warn("Ignoring fast-path entry {}={}", entry.getKey(), entry.getValue());
                continue;
            }
            overlaid = SettingsDocument.withValue(overlaid, entry.getKey(), value);
        }
        return overlaid;
    }
}
