package io.rileyhe1.tur.Shell;

/**
 * A key press as reported by the window toolkit: modifier flags plus the key's name.
 */
public class KeyPress
{
    private final boolean ctrl;
    private final boolean shift;
    private final boolean alt;
    private final boolean meta;
    private final String key;

    public KeyPress(boolean ctrl, boolean shift, boolean alt, boolean meta, String key)
    {
        if(key == null || key.isEmpty()) throw new IllegalArgumentException("Key cannot be null or empty");
        this.ctrl = ctrl;
        this.shift = shift;
        this.alt = alt;
        this.meta = meta;
        this.key = key;
    }

    public boolean isCtrl()
    {
        return ctrl;
    }

    public boolean isShift()
    {
        return shift;
    }

    public boolean isAlt()
    {
        return alt;
    }

    public boolean isMeta()
    {
        return meta;
    }

    public String getKey()
    {
        return key;
    }

    // true when the press is only a modifier key going down
    public boolean isModifierOnly()
    {
        return Shortcut.isModifierName(key) || "Control".equalsIgnoreCase(key);
    }

    @Override
    public String toString()
    {
        return "KeyPress{ctrl=" + ctrl + ", shift=" + shift + ", alt=" + alt + ", meta=" + meta + ", key='" + key + "'}";
    }
}
