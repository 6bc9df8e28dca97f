import io.rileyhe1.tur.Data.SettingsException;
import io.rileyhe1.tur.Settings.AppSettings;
import io.rileyhe1.tur.Settings.FastPathCache;
import io.rileyhe1.tur.Settings.JsonFileFastPathCache;
import io.rileyhe1.tur.Settings.JsonFileSettingsPersistence;
import io.rileyhe1.tur.Settings.SettingKey;
import io.rileyhe1.tur.Settings.SettingsChangeListener;
import io.rileyhe1.tur.Settings.SettingsPersistence;
import io.rileyhe1.tur.Settings.SettingsStore;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for SettingsStore.
 * Tests loading and merging, write-through updates, the fast-path cache and change notification.
 */
class SettingsStoreTest
{
    @TempDir
    Path tempDir;

    private Path settingsFile;
    private Path cacheFile;
    private JsonFileSettingsPersistence persistence;
    private JsonFileFastPathCache cache;

    @BeforeEach
    void setUp()
    {
        settingsFile = tempDir.resolve("settings.json");
        cacheFile = tempDir.resolve("fast-path.json");
        persistence = new JsonFileSettingsPersistence(settingsFile);
        cache = new JsonFileFastPathCache(cacheFile);
    }

    private void writeSettings(String settingsJson) throws IOException
    {
        Files.write(settingsFile, ("{\"settings\": " + settingsJson + "}").getBytes(StandardCharsets.UTF_8));
    }

    private JsonObject readSettingsFile() throws IOException
    {
        String content = new String(Files.readAllBytes(settingsFile), StandardCharsets.UTF_8);
        return JsonParser.parseString(content).getAsJsonObject().getAsJsonObject("settings");
    }

    /**
     * In-memory persistence that counts calls and can be told to fail.
     */
    private static class MemoryPersistence implements SettingsPersistence
    {
        JsonObject stored;
        int loads = 0;
        int saves = 0;
        boolean failLoad = false;
        boolean failSave = false;

        @Override
        public JsonObject load() throws IOException
        {
            loads++;
            if(failLoad) throw new IOException("disk unreadable");
            return stored == null ? null : stored.deepCopy();
        }

        @Override
        public void save(JsonObject document) throws IOException
        {
            if(failSave) throw new IOException("disk full");
            saves++;
            stored = document.deepCopy();
        }
    }

    /**
     * Cache whose every operation fails.
     */
    private static class BrokenCache implements FastPathCache
    {
        @Override
        public Map<String, String> read() throws IOException
        {
            throw new IOException("cache unreadable");
        }

        @Override
        public void write(Map<String, String> values) throws IOException
        {
            throw new IOException("cache unwritable");
        }
    }

    // ============================================================
    // STARTUP AND FAST PATH TESTS
    // ============================================================

    @Test
    void testNotReadyBeforeLoad()
    {
        SettingsStore store = new SettingsStore(persistence, cache);

        assertFalse(store.isReady());
        assertEquals("system", store.getString(SettingKey.APP_THEME), "Defaults are readable before loading");
    }

    @Test
    void testFastPathValuesUsedBeforeLoad() throws IOException
    {
        Map<String, String> cached = new HashMap<>();
        cached.put("app.theme", "dark");
        cached.put("app.sidebar", "right");
        cached.put("app.button_label", "icon");
        cache.write(cached);

        SettingsStore store = new SettingsStore(persistence, cache);

        assertEquals("dark", store.getString(SettingKey.APP_THEME));
        assertEquals("right", store.getString(SettingKey.APP_SIDEBAR));
        assertEquals("both", store.getString(SettingKey.APP_BUTTON_LABEL), "Only fast-path fields come from the cache");
    }

    @Test
    void testInvalidFastPathValueIgnored() throws IOException
    {
        Map<String, String> cached = new HashMap<>();
        cached.put("app.theme", "neon");
        cache.write(cached);

        SettingsStore store = new SettingsStore(persistence, cache);

        assertEquals("system", store.getString(SettingKey.APP_THEME));
    }

    @Test
    void testLoadSupersedesFastPath() throws IOException
    {
        Map<String, String> cached = new HashMap<>();
        cached.put("app.theme", "dark");
        cache.write(cached);
        writeSettings("{\"app\":{\"theme\":\"light\"}}");

        SettingsStore store = new SettingsStore(persistence, cache);
        store.load();

        assertEquals("light", store.getString(SettingKey.APP_THEME));
        assertEquals("light", cache.read().get("app.theme"), "Cache follows the loaded settings");
    }

    @Test
    void testBrokenCacheDoesNotBreakStore() throws SettingsException
    {
        SettingsStore store = new SettingsStore(persistence, new BrokenCache());
        store.load();

        store.set("app.theme", "dark");

        assertEquals("dark", store.getString(SettingKey.APP_THEME));
    }

    // ============================================================
    // LOAD TESTS
    // ============================================================

    @Test
    void testFirstLoadWritesDefaults() throws IOException
    {
        SettingsStore store = new SettingsStore(persistence, cache);

        store.load();

        assertTrue(store.isReady());
        assertTrue(Files.exists(settingsFile));
        assertEquals(SettingKey.defaultDocument(), readSettingsFile());
    }

    @Test
    void testLoadFillsMissingKeysWithDefaults() throws IOException
    {
        writeSettings("{\"app\":{\"theme\":\"dark\"},\"download\":{\"num_threads\":4}}");
        SettingsStore store = new SettingsStore(persistence, cache);

        store.load();

        assertEquals("dark", store.getString(SettingKey.APP_THEME));
        assertEquals(4, store.getInt(SettingKey.DOWNLOAD_NUM_THREADS));
        assertEquals("left", store.getString(SettingKey.APP_SIDEBAR), "Missing key falls back to default");
        assertEquals("Ctrl+K", store.getString(SettingKey.SHORTCUT_GO_HOME));

        JsonObject saved = readSettingsFile();
        assertEquals("left", saved.getAsJsonObject("app").get("sidebar").getAsString(), "Merged document is written back");
        assertEquals(4, saved.getAsJsonObject("download").get("num_threads").getAsInt());
    }

    @Test
    void testCompleteDocumentIsNotRewritten()
    {
        MemoryPersistence memory = new MemoryPersistence();
        memory.stored = SettingKey.defaultDocument();
        SettingsStore store = new SettingsStore(memory, cache);

        store.load();

        assertEquals(0, memory.saves, "Nothing to fill, nothing to write");
    }

    @Test
    void testLoadRunsOnce()
    {
        MemoryPersistence memory = new MemoryPersistence();
        SettingsStore store = new SettingsStore(memory, cache);

        store.load();
        store.load();

        assertEquals(1, memory.loads);
    }

    @Test
    void testLoadFailureStillBecomesReady()
    {
        MemoryPersistence memory = new MemoryPersistence();
        memory.failLoad = true;
        SettingsStore store = new SettingsStore(memory, cache);

        store.load();

        assertTrue(store.isReady());
        assertEquals("system", store.getString(SettingKey.APP_THEME));
    }

    @Test
    void testCorruptedFileStillBecomesReady() throws IOException
    {
        Files.write(settingsFile, "{\"settings\": {".getBytes(StandardCharsets.UTF_8));
        SettingsStore store = new SettingsStore(persistence, cache);

        store.load();

        assertTrue(store.isReady());
        assertEquals(8, store.getInt(SettingKey.DOWNLOAD_NUM_THREADS));
    }

    @Test
    void testInvalidSavedValuesFallBackToDefaults() throws IOException
    {
        writeSettings("{\"app\":{\"theme\":\"neon\",\"autostart\":\"yes\"},\"thread\":7}");
        SettingsStore store = new SettingsStore(persistence, cache);

        store.load();

        assertEquals("system", store.getString(SettingKey.APP_THEME));
        assertFalse(store.getBoolean(SettingKey.APP_AUTOSTART));
        assertEquals(1, store.getInt(SettingKey.THREAD_TOTAL_CONNECTIONS));
    }

    @Test
    @Timeout(5)
    void testLoadAsync() throws Exception
    {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try
        {
            SettingsStore store = new SettingsStore(persistence, cache);

            store.loadAsync(executor).get(5, TimeUnit.SECONDS);

            assertTrue(store.isReady());
        }
        finally
        {
            executor.shutdownNow();
        }
    }

    // ============================================================
    // GET TESTS
    // ============================================================

    @Test
    void testGetResolvesDottedPaths()
    {
        SettingsStore store = new SettingsStore(persistence, cache);
        store.load();

        assertEquals("Ctrl+N", store.get("shortcuts.add_download").get().getAsString());
        assertTrue(store.get("download").get().isJsonObject());
        assertFalse(store.get("download.nope").isPresent());
        assertFalse(store.get("app.theme.deeper").isPresent());
        assertFalse(store.get(null).isPresent());
    }

    @Test
    void testGetReturnsDetachedCopies()
    {
        SettingsStore store = new SettingsStore(persistence, cache);
        store.load();

        store.get("app").get().getAsJsonObject().addProperty("theme", "dark");

        assertEquals("system", store.getString(SettingKey.APP_THEME));
    }

    @Test
    void testTypedView()
    {
        SettingsStore store = new SettingsStore(persistence, cache);
        store.load();

        AppSettings settings = store.getSettings();

        assertEquals("system", settings.getApp().getTheme());
        assertTrue(settings.getApp().isShowSegmentProgress());
        assertEquals("Ctrl+L", settings.getShortcuts().getToggleSidebar());
        assertEquals(8, settings.getDownload().getNumThreads());
        assertEquals(0, settings.getDownload().getSpeedLimit());
        assertEquals(1, settings.getThread().getTotalConnections());
        assertFalse(settings.getSession().isHistory());
        assertTrue(settings.isShowNotifications());
    }

    @Test
    void testEngineSettings()
    {
        SettingsStore store = new SettingsStore(persistence, cache);
        store.load();

        JsonObject engine = store.getEngineSettings();

        assertTrue(engine.has("download"));
        assertTrue(engine.has("thread"));
        assertTrue(engine.has("session"));
        assertFalse(engine.has("app"), "UI settings are not sent to the engine");
    }

    // ============================================================
    // SET TESTS
    // ============================================================

    @Test
    void testSetThenGet() throws Exception
    {
        SettingsStore store = new SettingsStore(persistence, cache);
        store.load();

        store.set("app.theme", "dark");

        assertEquals("dark", store.get("app.theme").get().getAsString());
        assertEquals("dark", readSettingsFile().getAsJsonObject("app").get("theme").getAsString(), "Write-through to disk");
        assertEquals("dark", cache.read().get("app.theme"), "Fast-path cache mirrors the change");
    }

    @Test
    void testNewStoreSeesCachedThemeImmediately() throws Exception
    {
        SettingsStore first = new SettingsStore(persistence, cache);
        first.load();
        first.set(SettingKey.APP_SIDEBAR, "right");

        SettingsStore second = new SettingsStore(persistence, cache);

        assertEquals("right", second.getString(SettingKey.APP_SIDEBAR), "No load needed for fast-path fields");
    }

    @Test
    void testNonFastPathSetLeavesCacheAlone() throws Exception
    {
        SettingsStore store = new SettingsStore(persistence, cache);
        store.load();
        Map<String, String> before = cache.read();

        store.set(SettingKey.DOWNLOAD_NUM_THREADS, 12);

        assertEquals(before, cache.read());
        assertEquals(12L, store.getLong(SettingKey.DOWNLOAD_NUM_THREADS));
    }

    @Test
    void testGetIntRejectsSettingsBeyondIntRange() throws Exception
    {
        SettingsStore store = new SettingsStore(persistence, cache);
        store.load();

        store.set(SettingKey.DOWNLOAD_SPEED_LIMIT, 5_000_000_000L);

        assertThrows(IllegalArgumentException.class, () -> store.getInt(SettingKey.DOWNLOAD_SPEED_LIMIT));
        assertEquals(5_000_000_000L, store.getLong(SettingKey.DOWNLOAD_SPEED_LIMIT), "Wide values read back whole through getLong");
        assertEquals(8, store.getInt(SettingKey.DOWNLOAD_NUM_THREADS));
    }

    @Test
    void testFailedSetKeepsOldValue()
    {
        MemoryPersistence memory = new MemoryPersistence();
        SettingsStore store = new SettingsStore(memory, cache);
        store.load();
        memory.failSave = true;

        SettingsException ex = assertThrows(SettingsException.class, () -> store.set("app.theme", "dark"));

        assertEquals("app.theme", ex.getPath());
        assertTrue(ex.getCause() instanceof IOException);
        assertEquals("system", store.getString(SettingKey.APP_THEME), "In-memory state must be unchanged");
    }

    @Test
    void testSetRejectsUnknownPathAndBadValues()
    {
        MemoryPersistence memory = new MemoryPersistence();
        SettingsStore store = new SettingsStore(memory, cache);
        store.load();
        int savesBefore = memory.saves;

        assertThrows(IllegalArgumentException.class, () -> store.set("app.colour", "red"));
        assertThrows(IllegalArgumentException.class, () -> store.set("app.theme", "purple"));
        assertThrows(IllegalArgumentException.class, () -> store.set("download.num_threads", "eight"));
        assertThrows(IllegalArgumentException.class, () -> store.set((SettingKey) null, "x"));

        assertEquals(savesBefore, memory.saves, "Nothing should reach persistence");
    }

    @Test
    void testSetBeforeLoadLoadsFirst() throws Exception
    {
        writeSettings("{\"app\":{\"sidebar\":\"right\"}}");
        SettingsStore store = new SettingsStore(persistence, cache);

        store.set("app.theme", "dark");

        assertTrue(store.isReady());
        assertEquals("right", store.getString(SettingKey.APP_SIDEBAR), "Saved values must survive an early write");
        assertEquals("right", readSettingsFile().getAsJsonObject("app").get("sidebar").getAsString());
    }

    // ============================================================
    // LISTENER TESTS
    // ============================================================

    @Test
    void testListenersNotified() throws Exception
    {
        SettingsStore store = new SettingsStore(persistence, cache);
        List<String> seen = new ArrayList<>();
        store.addListener(new SettingsChangeListener()
        {
            @Override
            public void onSettingChanged(SettingKey key, JsonElement value)
            {
                seen.add(key.getPath() + "=" + value.getAsString());
            }

            @Override
            public void onSettingsLoaded(SettingsStore loaded)
            {
                seen.add("loaded");
            }
        });

        store.load();
        store.set(SettingKey.SESSION_HISTORY, true);

        assertEquals(List.of("loaded", "session.history=true"), seen);
    }

    @Test
    void testFailingListenerDoesNotBlockSet() throws Exception
    {
        SettingsStore store = new SettingsStore(persistence, cache);
        store.load();
        store.addListener((key, value) -> { throw new IllegalStateException("listener bug"); });

        store.set("show_notifications", false);

        assertFalse(store.getBoolean(SettingKey.SHOW_NOTIFICATIONS));
    }
}
