import io.rileyhe1.tur.Settings.SettingKey;

import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for SettingKey.
 * Tests path lookup, value validation and the default document.
 */
class SettingKeyTest
{
    @Test
    void testFromPath()
    {
        assertEquals(SettingKey.APP_THEME, SettingKey.fromPath("app.theme").get());
        assertEquals(SettingKey.SHOW_NOTIFICATIONS, SettingKey.fromPath("show_notifications").get());
        assertFalse(SettingKey.fromPath("app.colour").isPresent());
        assertFalse(SettingKey.fromPath(null).isPresent());
    }

    @Test
    void testFastPathFields()
    {
        assertTrue(SettingKey.APP_THEME.isFastPath());
        assertTrue(SettingKey.APP_SIDEBAR.isFastPath());
        assertFalse(SettingKey.APP_BUTTON_LABEL.isFastPath());
    }

    @Test
    void testToJsonAcceptsMatchingValues()
    {
        assertEquals(new JsonPrimitive("dark"), SettingKey.APP_THEME.toJson("dark"));
        assertEquals(new JsonPrimitive(true), SettingKey.APP_AUTOSTART.toJson(true));
        assertEquals(new JsonPrimitive(16L), SettingKey.DOWNLOAD_NUM_THREADS.toJson(16));
        assertEquals(new JsonPrimitive(4L), SettingKey.THREAD_TOTAL_CONNECTIONS.toJson(4.0), "Whole doubles are accepted");
        assertEquals(new JsonPrimitive("Ctrl+Shift+X"), SettingKey.SHORTCUT_GO_HOME.toJson("Ctrl+Shift+X"));
    }

    @Test
    void testToJsonRejectsMismatchedValues()
    {
        assertThrows(IllegalArgumentException.class, () -> SettingKey.APP_THEME.toJson("purple"));
        assertThrows(IllegalArgumentException.class, () -> SettingKey.APP_THEME.toJson(1));
        assertThrows(IllegalArgumentException.class, () -> SettingKey.APP_AUTOSTART.toJson("true"));
        assertThrows(IllegalArgumentException.class, () -> SettingKey.DOWNLOAD_NUM_THREADS.toJson(0));
        assertThrows(IllegalArgumentException.class, () -> SettingKey.DOWNLOAD_NUM_THREADS.toJson(2.5));
        assertThrows(IllegalArgumentException.class, () -> SettingKey.DOWNLOAD_SPEED_LIMIT.toJson(-1));
        assertThrows(IllegalArgumentException.class, () -> SettingKey.APP_SIDEBAR.toJson(null));
        assertThrows(IllegalArgumentException.class, () -> SettingKey.APP_SIDEBAR.toJson(new Object()));
    }

    @Test
    void testDefaultDocument()
    {
        JsonObject defaults = SettingKey.defaultDocument();

        JsonObject app = defaults.getAsJsonObject("app");
        assertEquals("system", app.get("theme").getAsString());
        assertEquals("left", app.get("sidebar").getAsString());
        assertEquals("both", app.get("button_label").getAsString());
        assertTrue(app.get("show_tray_icon").getAsBoolean());
        assertEquals("Ctrl+K", defaults.getAsJsonObject("shortcuts").get("go_home").getAsString());
        assertEquals("Ctrl+Q", defaults.getAsJsonObject("shortcuts").get("quit_app").getAsString());
        assertEquals(8, defaults.getAsJsonObject("download").get("num_threads").getAsInt());
        assertEquals(16, defaults.getAsJsonObject("download").get("chunk_size").getAsInt());
        assertEquals(Paths.get(System.getProperty("user.home"), "Downloads").toString(),
            defaults.getAsJsonObject("download").get("download_location").getAsString());
        assertEquals(1, defaults.getAsJsonObject("thread").get("per_task_connections").getAsInt());
        assertFalse(defaults.getAsJsonObject("session").get("history").getAsBoolean());
        assertFalse(defaults.get("send_anonymous_metrics").getAsBoolean());
        assertTrue(defaults.get("show_notifications").getAsBoolean());
    }

    @Test
    void testEveryDefaultIsAccepted()
    {
        for(SettingKey key : SettingKey.values())
        {
            assertTrue(key.accepts(key.getDefaultValue()), "Default of " + key.getPath() + " should validate");
        }
    }
}
