package io.rileyhe1.tur.Settings;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

/**
 * Fast-path cache backed by a tiny flat JSON file, read synchronously at startup.
 */
public class JsonFileFastPathCache implements FastPathCache
{
    private static final Type VALUES_TYPE = new TypeToken<LinkedHashMap<String, String>>(){}.getType();

    private final Path cacheFile;
    private final Gson gson;

    public JsonFileFastPathCache(Path cacheFile)
    {
        if(cacheFile == null) throw new IllegalArgumentException("Cache file cannot be null");
        this.cacheFile = cacheFile;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    @Override
    public Map<String, String> read() throws IOException
    {
        if(!Files.exists(cacheFile)) return new LinkedHashMap<>();

        Map<String, String> values;
        try(Reader reader = Files.newBufferedReader(cacheFile, StandardCharsets.UTF_8))
        {
            values = gson.fromJson(reader, VALUES_TYPE);
        }
        catch(JsonParseException e)
        {
            throw new IOException("Fast-path cache is corrupted: " + cacheFile, e);
        }
        return values == null ? new LinkedHashMap<>() : values;
    }

    @Override
    public void write(Map<String, String> values) throws IOException
    {
        if(values == null) throw new IllegalArgumentException("Values cannot be null");

        Path parent = cacheFile.toAbsolutePath().getParent();
        if(parent != null) Files.createDirectories(parent);

        Path tempFile = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
        try(Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8))
        {
            gson.toJson(values, VALUES_TYPE, writer);
        }
        Files.move(tempFile, cacheFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public Path getCacheFile()
    {
        return cacheFile;
    }
}
