package io.rileyhe1.tur;

import io.rileyhe1.tur.Data.DownloadSnapshot;

/**
 * Notified by {@link DownloadRegistry} after every change to its table.
 * Callbacks run while the registry is locked, so they should only hand the change on (for
 * example to the UI thread) and return.
 */
public interface DownloadsChangeListener
{
    /**
     * notified when a queue notification creates a row, or when history is restored
     *
     * @param download the new row
     */
    void onDownloadAdded(DownloadSnapshot download);

    /**
     * notified when an event, an optimistic update or a rollback changes a row
     *
     * @param download the row after the change
     */
    void onDownloadUpdated(DownloadSnapshot download);

    /**
     * notified when a row is cancelled or removed from history
     *
     * @param id the id of the removed row
     */
    void onDownloadRemoved(String id);
}
