package io.rileyhe1.tur.Util;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import io.rileyhe1.tur.Data.DownloadSnapshot;

/**
 * Keeps the registry's rows on disk between sessions when history is enabled.
 */
public class HistoryStore
{
    private static final Logger logger = LoggerFactory.getLogger(HistoryStore.class);
    private static final Type SNAPSHOT_LIST_TYPE = new TypeToken<List<DownloadSnapshot>>(){}.getType();

    private final Path historyFile;
    private final Gson gson;

    public HistoryStore(Path historyFile)
    {
        if(historyFile == null) throw new IllegalArgumentException("History file cannot be null");
        this.historyFile = historyFile;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public void save(List<DownloadSnapshot> snapshots) throws IOException
    {
        if(snapshots == null) throw new IllegalArgumentException("Snapshots cannot be null");

        Path parent = historyFile.toAbsolutePath().getParent();
        if(parent != null) Files.createDirectories(parent);

        // write next to the target first so a crash never leaves half a file behind
        Path tempFile = historyFile.resolveSibling(historyFile.getFileName() + ".tmp");
        try(Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8))
        {
            gson.toJson(snapshots, SNAPSHOT_LIST_TYPE, writer);
        }
        Files.move(tempFile, historyFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("Saved {} download(s) to history file {}", snapshots.size(), historyFile);
    }

    public List<DownloadSnapshot> load() throws IOException
    {
        // Check if file exists
        if(!Files.exists(historyFile))
        {
            return new ArrayList<>(); // No saved history
        }

        List<DownloadSnapshot> snapshots;
        try(Reader reader = Files.newBufferedReader(historyFile, StandardCharsets.UTF_8))
        {
            snapshots = gson.fromJson(reader, SNAPSHOT_LIST_TYPE);
        }
        catch(JsonParseException e)
        {
            throw new IOException("History file is corrupted: " + historyFile, e);
        }

        if(snapshots == null) return new ArrayList<>();

        List<DownloadSnapshot> valid = new ArrayList<>();
        for(DownloadSnapshot snapshot : snapshots)
        {
            if(snapshot == null || snapshot.getId() == null || snapshot.getStatus() == null)
            {
                logger.warn("Skipping incomplete history entry in {}", historyFile);
                continue;
            }
            valid.add(snapshot);
        }
        return valid;
    }

    public Path getHistoryFile()
    {
        return historyFile;
    }
}
