package io.rileyhe1.tur.Settings;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Every setting the client knows about, with its dotted path, type and default.
 * Writes are only accepted for these paths, which keeps typos in path strings from silently
 * creating new keys.
 */
public enum SettingKey
{
    APP_SHOW_TRAY_ICON("app.show_tray_icon", true),
    APP_QUIT_ON_CLOSE("app.quit_on_close", false),
    APP_SIDEBAR("app.sidebar", "left", "left", "right"),
    APP_THEME("app.theme", "system", "light", "dark", "system"),
    APP_BUTTON_LABEL("app.button_label", "both", "text", "icon", "both"),
    APP_SHOW_DOWNLOAD_PROGRESS("app.show_download_progress", true),
    APP_SHOW_SEGMENT_PROGRESS("app.show_segment_progress", true),
    APP_AUTOSTART("app.autostart", false),

    SHORTCUT_GO_HOME("shortcuts.go_home", "Ctrl+K"),
    SHORTCUT_OPEN_SETTINGS("shortcuts.open_settings", "Ctrl+P"),
    SHORTCUT_ADD_DOWNLOAD("shortcuts.add_download", "Ctrl+N"),
    SHORTCUT_OPEN_DETAILS("shortcuts.open_details", "Ctrl+D"),
    SHORTCUT_OPEN_HISTORY("shortcuts.open_history", "Ctrl+H"),
    SHORTCUT_TOGGLE_SIDEBAR("shortcuts.toggle_sidebar", "Ctrl+L"),
    SHORTCUT_CANCEL_DOWNLOAD("shortcuts.cancel_download", "Ctrl+C"),
    SHORTCUT_QUIT_APP("shortcuts.quit_app", "Ctrl+Q"),

    DOWNLOAD_LOCATION("download.download_location", defaultDownloadDirectory()),
    DOWNLOAD_NUM_THREADS("download.num_threads", 8, 1, 255),
    DOWNLOAD_CHUNK_SIZE("download.chunk_size", 16, 1, Integer.MAX_VALUE),
    DOWNLOAD_SOCKET_BUFFER_SIZE("download.socket_buffer_size", 0, 0, Integer.MAX_VALUE),
    DOWNLOAD_SPEED_LIMIT("download.speed_limit", 0, 0, Long.MAX_VALUE),

    THREAD_TOTAL_CONNECTIONS("thread.total_connections", 1, 1, 255),
    THREAD_PER_TASK_CONNECTIONS("thread.per_task_connections", 1, 1, 255),

    SESSION_HISTORY("session.history", false),
    SESSION_METADATA("session.metadata", false),

    SEND_ANONYMOUS_METRICS("send_anonymous_metrics", false),
    SHOW_NOTIFICATIONS("show_notifications", true);

    public enum ValueType
    {
        BOOLEAN,
        STRING,
        INTEGER
    }

    private final String path;
    private final ValueType type;
    private final JsonPrimitive defaultValue;
    private final List<String> choices;
    private final long min;
    private final long max;

    SettingKey(String path, boolean defaultValue)
    {
        this(path, ValueType.BOOLEAN, new JsonPrimitive(defaultValue), Collections.emptyList(), 0, 0);
    }

    // an empty choice list means any non-null string
    SettingKey(String path, String defaultValue, String... choices)
    {
        this(path, ValueType.STRING, new JsonPrimitive(defaultValue), Arrays.asList(choices), 0, 0);
    }

    SettingKey(String path, long defaultValue, long min, long max)
    {
        this(path, ValueType.INTEGER, new JsonPrimitive(defaultValue), Collections.emptyList(), min, max);
    }

    SettingKey(String path, ValueType type, JsonPrimitive defaultValue, List<String> choices, long min, long max)
    {
        this.path = path;
        this.type = type;
        this.defaultValue = defaultValue;
        this.choices = Collections.unmodifiableList(choices);
        this.min = min;
        this.max = max;
    }

    public String getPath()
    {
        return path;
    }

    public ValueType getType()
    {
        return type;
    }

    public JsonPrimitive getDefaultValue()
    {
        return defaultValue;
    }

    public List<String> getChoices()
    {
        return choices;
    }

    // false for integer settings whose range does not fit an int, read those with getLong
    public boolean fitsInt()
    {
        return type == ValueType.INTEGER && min >= Integer.MIN_VALUE && max <= Integer.MAX_VALUE;
    }

    // fields the first frame needs before the real settings are loaded
    public boolean isFastPath()
    {
        return this == APP_THEME || this == APP_SIDEBAR;
    }

    public boolean isShortcut()
    {
        return path.startsWith("shortcuts.");
    }

    public boolean accepts(JsonElement value)
    {
        if(value == null || !value.isJsonPrimitive()) return false;
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        switch(type)
        {
            case BOOLEAN:
                return primitive.isBoolean();
            case STRING:
                return primitive.isString() && (choices.isEmpty() || choices.contains(primitive.getAsString()));
            case INTEGER:
                if(!primitive.isNumber()) return false;
                double number = primitive.getAsDouble();
                return number == Math.rint(number) && number >= min && number <= max;
            default:
                return false;
        }
    }

    /**
     * Converts a caller supplied value into its JSON form.
     *
     * @throws IllegalArgumentException if the value has the wrong type or is out of range
     */
    public JsonPrimitive toJson(Object value)
    {
        if(value == null) throw new IllegalArgumentException("Setting " + path + " cannot be set to null");

        JsonPrimitive converted;
        if(value instanceof JsonPrimitive) converted = (JsonPrimitive) value;
        else if(value instanceof Boolean) converted = new JsonPrimitive((Boolean) value);
        else if(value instanceof Number) converted = new JsonPrimitive(normalize((Number) value));
        else if(value instanceof String) converted = new JsonPrimitive((String) value);
        else throw new IllegalArgumentException("Setting " + path + " cannot hold a " + value.getClass().getSimpleName());

        if(!accepts(converted))
        {
            String expected = type == ValueType.STRING && !choices.isEmpty() ? "one of " + choices
                : type == ValueType.INTEGER ? "an integer within " + min + ".." + max
                : "a " + type.name().toLowerCase();
            throw new IllegalArgumentException("Setting " + path + " expects " + expected + ", got: " + value);
        }
        return converted;
    }

    public static Optional<SettingKey> fromPath(String path)
    {
        if(path == null) return Optional.empty();
        for(SettingKey key : values())
        {
            if(key.path.equals(path)) return Optional.of(key);
        }
        return Optional.empty();
    }

    // a fresh copy of the compiled in defaults
    public static JsonObject defaultDocument()
    {
        JsonObject document = new JsonObject();
        for(SettingKey key : values())
        {
            document = SettingsDocument.withValue(document, key.path, key.defaultValue);
        }
        return document;
    }

    private static Number normalize(Number number)
    {
        // whole doubles from json or the UI are stored as longs so they compare equal to the defaults
        if((number instanceof Double || number instanceof Float) && number.doubleValue() == Math.rint(number.doubleValue()))
        {
            return number.longValue();
        }
        if(number instanceof Integer || number instanceof Short || number instanceof Byte) return number.longValue();
        return number;
    }

    private static String defaultDownloadDirectory()
    {
        return Paths.get(System.getProperty("user.home"), "Downloads").toString();
    }
}
