package io.rileyhe1.tur.Settings;

import java.io.IOException;
import java.util.Map;

/**
 * Small synchronous key/value store holding the few settings needed to paint the first frame,
 * keyed by dotted setting path.
 */
public interface FastPathCache
{
    Map<String, String> read() throws IOException;

    void write(Map<String, String> values) throws IOException;
}
