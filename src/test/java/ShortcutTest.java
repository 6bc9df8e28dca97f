import io.rileyhe1.tur.Shell.KeyPress;
import io.rileyhe1.tur.Shell.Shortcut;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for Shortcut parsing and matching.
 */
class ShortcutTest
{
    @Test
    void testParseModifiersAndKey()
    {
        Shortcut shortcut = Shortcut.parse("Ctrl+Shift+K");

        assertTrue(shortcut.isCtrl());
        assertTrue(shortcut.isShift());
        assertFalse(shortcut.isAlt());
        assertFalse(shortcut.isMeta());
        assertEquals("k", shortcut.getKey());
    }

    @Test
    void testMatchesIgnoresKeyCase()
    {
        Shortcut shortcut = Shortcut.parse("Ctrl+K");

        assertTrue(shortcut.matches(new KeyPress(true, false, false, false, "k")));
        assertTrue(shortcut.matches(new KeyPress(true, false, false, false, "K")));
    }

    @Test
    void testModifiersMustMatchExactly()
    {
        Shortcut shortcut = Shortcut.parse("Ctrl+K");

        assertFalse(shortcut.matches(new KeyPress(true, true, false, false, "k")), "Extra Shift must not match");
        assertFalse(shortcut.matches(new KeyPress(false, false, false, false, "k")), "Missing Ctrl must not match");
        assertFalse(shortcut.matches(new KeyPress(true, false, false, false, "j")));
        assertFalse(shortcut.matches(null));
    }

    @Test
    void testParseRejectsBadBindings()
    {
        assertThrows(IllegalArgumentException.class, () -> Shortcut.parse(null));
        assertThrows(IllegalArgumentException.class, () -> Shortcut.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Shortcut.parse("Ctrl+"));
        assertThrows(IllegalArgumentException.class, () -> Shortcut.parse("Ctrl+Shift"));
        assertThrows(IllegalArgumentException.class, () -> Shortcut.parse("Hyper+K"));
    }

    @Test
    void testRecordFromKeyPress()
    {
        Shortcut recorded = Shortcut.fromKeyPress(new KeyPress(true, false, true, false, "x")).get();

        assertEquals("Ctrl+Alt+X", recorded.toString());
        assertEquals(Shortcut.parse("Ctrl+Alt+X"), recorded);
        assertFalse(Shortcut.fromKeyPress(new KeyPress(true, false, false, false, "Control")).isPresent(),
            "A lone modifier is not a binding yet");
    }

    @Test
    void testNamedKeys()
    {
        Shortcut shortcut = Shortcut.parse("Alt+Escape");

        assertTrue(shortcut.matches(new KeyPress(false, false, true, false, "Escape")));
        assertEquals("Alt+escape", shortcut.toString());
    }
}
