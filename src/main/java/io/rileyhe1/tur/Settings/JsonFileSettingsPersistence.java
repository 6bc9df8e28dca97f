package io.rileyhe1.tur.Settings;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Stores the settings document in a JSON file of the form {@code {"settings": {...}}}.
 */
public class JsonFileSettingsPersistence implements SettingsPersistence
{
    private static final Logger logger = LoggerFactory.getLogger(JsonFileSettingsPersistence.class);
    static final String ROOT_KEY = "settings";

    private final Path settingsFile;
    private final Gson gson;

    public JsonFileSettingsPersistence(Path settingsFile)
    {
        if(settingsFile == null) throw new IllegalArgumentException("Settings file cannot be null");
        this.settingsFile = settingsFile;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    @Override
    public JsonObject load() throws IOException
    {
        if(!Files.exists(settingsFile))
        {
            return null; // first run
        }

        JsonElement root;
        try(Reader reader = Files.newBufferedReader(settingsFile, StandardCharsets.UTF_8))
        {
            root = JsonParser.parseReader(reader);
        }
        catch(JsonParseException e)
        {
            throw new IOException("Settings file is corrupted: " + settingsFile, e);
        }

        if(root == null || root.isJsonNull()) return null;
        if(!root.isJsonObject()) throw new IOException("Settings file does not hold a JSON object: " + settingsFile);

        JsonElement settings = root.getAsJsonObject().get(ROOT_KEY);
        if(settings == null || settings.isJsonNull())
        {
            logger.warn("Settings file {} has no '{}' section", settingsFile, ROOT_KEY);
            return null;
        }
        if(!settings.isJsonObject()) throw new IOException("Settings section is not a JSON object: " + settingsFile);
        return settings.getAsJsonObject();
    }

    @Override
    public void save(JsonObject document) throws IOException
    {
        if(document == null) throw new IllegalArgumentException("Document cannot be null");

        Path parent = settingsFile.toAbsolutePath().getParent();
        if(parent != null) Files.createDirectories(parent);

        JsonObject root = new JsonObject();
        root.add(ROOT_KEY, document.deepCopy());

        Path tempFile = settingsFile.resolveSibling(settingsFile.getFileName() + ".tmp");
        try(Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8))
        {
            gson.toJson(root, writer);
        }
        Files.move(tempFile, settingsFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug("Saved settings to {}", settingsFile);
    }

    public Path getSettingsFile()
    {
        return settingsFile;
    }
}
