package io.rileyhe1.tur.Util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.rileyhe1.tur.Data.DownloadSnapshot;

/**
 * Set of selected download ids held by a page. The registry only ever reads it through
 * {@link #snapshot()}.
 */
public class Selection
{
    private final Set<String> selectedIds = new LinkedHashSet<>();

    public synchronized void toggle(String id)
    {
        if(id == null || id.trim().isEmpty()) throw new IllegalArgumentException("download id cannot be null/empty");
        if(!selectedIds.remove(id)) selectedIds.add(id);
    }

    /**
     * Clears the selection when it is as large as the given view, otherwise selects exactly the
     * view's ids. Two calls in a row therefore toggle back to an empty selection.
     */
    public synchronized void toggleAll(List<DownloadSnapshot> view)
    {
        if(view == null) throw new IllegalArgumentException("View cannot be null");
        if(selectedIds.size() == view.size())
        {
            selectedIds.clear();
            return;
        }
        selectedIds.clear();
        for(DownloadSnapshot download : view)
        {
            selectedIds.add(download.getId());
        }
    }

    public synchronized void clear()
    {
        selectedIds.clear();
    }

    public synchronized boolean contains(String id)
    {
        return selectedIds.contains(id);
    }

    public synchronized int size()
    {
        return selectedIds.size();
    }

    public synchronized boolean isEmpty()
    {
        return selectedIds.isEmpty();
    }

    // copy of the ids in selection order
    public synchronized List<String> snapshot()
    {
        return Collections.unmodifiableList(new ArrayList<>(selectedIds));
    }
}
