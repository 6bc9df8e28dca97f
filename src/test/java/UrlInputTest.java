import io.rileyhe1.tur.Util.UrlInput;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for UrlInput.
 */
class UrlInputTest
{
    @Test
    void testSplitsOnCommasAndNewlines()
    {
        assertEquals(Arrays.asList("https://a", "https://b", "https://c"),
            UrlInput.parse("https://a, https://b\r\nhttps://c"));
    }

    @Test
    void testDropsBlankEntries()
    {
        assertEquals(Arrays.asList("https://a"), UrlInput.parse(" ,\n\nhttps://a ,, "));
    }

    @Test
    void testNullOrEmptyInput()
    {
        assertTrue(UrlInput.parse(null).isEmpty());
        assertTrue(UrlInput.parse("").isEmpty());
    }
}
