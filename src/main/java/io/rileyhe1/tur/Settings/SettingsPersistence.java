package io.rileyhe1.tur.Settings;

import java.io.IOException;

import com.google.gson.JsonObject;

/**
 * Durable storage for the full settings document.
 */
public interface SettingsPersistence
{
    /**
     * @return the persisted document, or null when nothing has been saved yet
     * @throws IOException if the stored document cannot be read or is corrupted
     */
    JsonObject load() throws IOException;

    /**
     * Replaces the stored document. Readers never observe a partially written document.
     */
    void save(JsonObject document) throws IOException;
}
