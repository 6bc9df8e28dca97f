package io.rileyhe1.tur.Shell;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A key binding such as {@code Ctrl+Shift+K}. The last segment is the key, every segment before
 * it names a modifier. Keys compare case-insensitively; modifiers must match exactly, so
 * {@code Ctrl+K} does not fire for Ctrl+Shift+K.
 */
public final class Shortcut
{
    private final boolean ctrl;
    private final boolean shift;
    private final boolean alt;
    private final boolean meta;
    private final String key;

    private Shortcut(boolean ctrl, boolean shift, boolean alt, boolean meta, String key)
    {
        this.ctrl = ctrl;
        this.shift = shift;
        this.alt = alt;
        this.meta = meta;
        this.key = key;
    }

    public static Shortcut parse(String binding)
    {
        if(binding == null || binding.trim().isEmpty()) throw new IllegalArgumentException("Shortcut cannot be null or empty");

        String[] parts = binding.trim().split("\\+");
        if(parts.length == 0) throw new IllegalArgumentException("Shortcut has no key: " + binding);

        boolean ctrl = false, shift = false, alt = false, meta = false;
        for(int i = 0; i < parts.length - 1; i++)
        {
            String part = parts[i].trim();
            if("Ctrl".equalsIgnoreCase(part)) ctrl = true;
            else if("Shift".equalsIgnoreCase(part)) shift = true;
            else if("Alt".equalsIgnoreCase(part)) alt = true;
            else if("Meta".equalsIgnoreCase(part)) meta = true;
            else throw new IllegalArgumentException("Unknown modifier '" + part + "' in shortcut: " + binding);
        }

        String key = parts[parts.length - 1].trim();
        if(key.isEmpty() || isModifierName(key)) throw new IllegalArgumentException("Shortcut has no key: " + binding);
        return new Shortcut(ctrl, shift, alt, meta, key.toLowerCase(Locale.ROOT));
    }

    // records a binding from a key press, empty while only modifiers are held
    public static Optional<Shortcut> fromKeyPress(KeyPress press)
    {
        if(press == null || press.isModifierOnly()) return Optional.empty();
        return Optional.of(new Shortcut(press.isCtrl(), press.isShift(), press.isAlt(), press.isMeta(),
            press.getKey().toLowerCase(Locale.ROOT)));
    }

    public boolean matches(KeyPress press)
    {
        if(press == null) return false;
        return press.isCtrl() == ctrl
            && press.isShift() == shift
            && press.isAlt() == alt
            && press.isMeta() == meta
            && press.getKey().toLowerCase(Locale.ROOT).equals(key);
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

    static boolean isModifierName(String name)
    {
        return "Ctrl".equalsIgnoreCase(name) || "Shift".equalsIgnoreCase(name)
            || "Alt".equalsIgnoreCase(name) || "Meta".equalsIgnoreCase(name);
    }

    @Override
    public boolean equals(Object o)
    {
        if(this == o) return true;
        if(!(o instanceof Shortcut)) return false;
        Shortcut other = (Shortcut) o;
        return ctrl == other.ctrl && shift == other.shift && alt == other.alt && meta == other.meta && key.equals(other.key);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(ctrl, shift, alt, meta, key);
    }

    // the form stored in settings, e.g. Ctrl+Shift+K
    @Override
    public String toString()
    {
        List<String> parts = new ArrayList<>();
        if(ctrl) parts.add("Ctrl");
        if(shift) parts.add("Shift");
        if(alt) parts.add("Alt");
        if(meta) parts.add("Meta");
        parts.add(key.length() == 1 ? key.toUpperCase(Locale.ROOT) : key);
        return String.join("+", parts);
    }
}
