package io.rileyhe1.tur.Util;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import io.rileyhe1.tur.Data.DownloadSnapshot;
import io.rileyhe1.tur.Data.DownloadStatus;
import io.rileyhe1.tur.Data.HistoryFilter;

/**
 * Pure read views over a list of rows given in insertion order. None of these modify their input.
 */
public final class DownloadViews
{
    // active rows first, then highest progress first
    private static final Comparator<DownloadSnapshot> OVERVIEW_ORDER =
        Comparator.comparing((DownloadSnapshot download) -> download.isActive() ? 0 : 1)
            .thenComparing(DownloadSnapshot::getProgress, Comparator.reverseOrder());

    private DownloadViews()
    {
    }

    // rows the engine is currently working on or holding paused
    public static List<DownloadSnapshot> active(List<DownloadSnapshot> downloads)
    {
        List<DownloadSnapshot> active = new ArrayList<>();
        for(DownloadSnapshot download : downloads)
        {
            DownloadStatus status = download.getStatus();
            if(status == DownloadStatus.DOWNLOADING || status == DownloadStatus.PAUSED) active.add(download);
        }
        return active;
    }

    /**
     * Orders rows for the overview page. List.sort is stable, so rows with the same activity and
     * progress keep their insertion order.
     */
    public static List<DownloadSnapshot> overview(List<DownloadSnapshot> downloads)
    {
        List<DownloadSnapshot> sorted = new ArrayList<>(downloads);
        sorted.sort(OVERVIEW_ORDER);
        return sorted;
    }

    public static List<DownloadSnapshot> history(List<DownloadSnapshot> downloads, HistoryFilter filter)
    {
        if(filter == null) throw new IllegalArgumentException("Filter cannot be null");
        List<DownloadSnapshot> matching = new ArrayList<>();
        for(DownloadSnapshot download : downloads)
        {
            if(filter.matches(download)) matching.add(download);
        }
        return matching;
    }

    // the row to show next when the current one is closed
    public static Optional<DownloadSnapshot> nextActive(List<DownloadSnapshot> downloads, String excludedId)
    {
        for(DownloadSnapshot download : downloads)
        {
            if(download.getStatus() == DownloadStatus.COMPLETED) continue;
            if(download.getProgress() >= 100) continue;
            if(download.getId().equals(excludedId)) continue;
            return Optional.of(download);
        }
        return Optional.empty();
    }
}
