package io.rileyhe1.tur.Settings;

import com.google.gson.JsonElement;

public interface SettingsChangeListener
{
    void onSettingChanged(SettingKey key, JsonElement value);

    // called once, after the first load attempt finished, whether or not it succeeded
    default void onSettingsLoaded(SettingsStore store)
    {
    }
}
