package io.rileyhe1.tur.Util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits pasted or dropped text into the urls to hand to the engine.
 */
public final class UrlInput
{
    private UrlInput()
    {
    }

    public static List<String> parse(String text)
    {
        List<String> urls = new ArrayList<>();
        if(text == null) return urls;
        for(String part : text.split("[,\\r\\n]"))
        {
            String url = part.trim();
            if(!url.isEmpty()) urls.add(url);
        }
        return urls;
    }
}
