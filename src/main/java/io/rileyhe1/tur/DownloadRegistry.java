package io.rileyhe1.tur;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.tur.Data.CommandResult;
import io.rileyhe1.tur.Data.DownloadSnapshot;
import io.rileyhe1.tur.Data.DownloadStatus;
import io.rileyhe1.tur.Data.EngineCommand;
import io.rileyhe1.tur.Data.EngineException;
import io.rileyhe1.tur.Data.HistoryFilter;
import io.rileyhe1.tur.Engine.CommandChannel;
import io.rileyhe1.tur.Engine.EngineEvent;
import io.rileyhe1.tur.Engine.EventChannel;
import io.rileyhe1.tur.Engine.FailedEvent;
import io.rileyhe1.tur.Engine.ProgressEvent;
import io.rileyhe1.tur.Engine.QueueEvent;
import io.rileyhe1.tur.Util.Download;
import io.rileyhe1.tur.Util.DownloadViews;
import io.rileyhe1.tur.Util.Selection;
import io.rileyhe1.tur.Util.Subscription;

/**
 * Client side table of every download the engine has told us about.
 * <p>
 * Engine events and command bookkeeping both mutate the table while holding this object's lock,
 * so each change runs to completion before the next one starts. Commands go out through the
 * {@link CommandChannel}; pause and resume update the row before the engine answers and are rolled
 * back if it refuses, cancel removes the row immediately and is never rolled back.
 */
public class DownloadRegistry
{
    private static final Logger logger = LoggerFactory.getLogger(DownloadRegistry.class);

    private final Map<String, Download> downloads = new LinkedHashMap<>();
    private final List<DownloadsChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final CommandChannel commandChannel;
    private String lastError;

    public DownloadRegistry(CommandChannel commandChannel)
    {
        if(commandChannel == null)
        {
            throw new IllegalArgumentException("Command channel cannot be null");
        }
        this.commandChannel = commandChannel;
    }

    public Subscription attach(EventChannel eventChannel)
    {
        if(eventChannel == null) throw new IllegalArgumentException("Event channel cannot be null");
        return eventChannel.subscribe(this::handleEvent);
    }

    public Subscription addListener(DownloadsChangeListener listener)
    {
        if(listener == null) throw new IllegalArgumentException("Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // Event ingestion //

    /**
     * Applies one engine notification. Never throws: unknown ids, stale sequences and events for
     * finished downloads are ignored.
     */
    public synchronized void handleEvent(EngineEvent event)
    {
        if(event == null)
        {
            logger.warn("Ignoring null engine event");
            return;
        }
        try
        {
            if(event.getKind() == EngineEvent.Kind.QUEUE)
            {
                handleQueue((QueueEvent) event);
            }
            else
            {
                handleRowEvent(event);
            }
        }
        catch(RuntimeException e)
        {
            // a malformed event must not take the event loop or the other rows down with it
            logger.error("Failed to apply engine event {}", event, e);
        }
    }

    private void handleQueue(QueueEvent event)
    {
        Download existing = downloads.get(event.getId());
        if(existing != null && existing.isStale(event.getSequence()))
        {
            logger.debug("Discarding stale {}", event);
            return;
        }

        if(existing == null)
        {
            Download row = new Download(event);
            downloads.put(row.getId(), row);
            notifyAdded(row.toSnapshot());
            return;
        }

        boolean changed = existing.applyRequeue(event);
        existing.recordSequence(event.getSequence());
        if(changed) notifyUpdated(existing.toSnapshot());
        else logger.debug("Ignoring {} for download in state {}", event, existing.getStatus());
    }

    private void handleRowEvent(EngineEvent event)
    {
        Download row = downloads.get(event.getId());
        if(row == null)
        {
            logger.debug("Ignoring {} for unknown download", event);
            return;
        }
        if(row.isStale(event.getSequence()))
        {
            logger.debug("Discarding stale {}, last applied sequence was {}", event, row.getLastSequence());
            return;
        }

        boolean changed;
        switch(event.getKind())
        {
            case STARTED:
                changed = row.applyStarted();
                break;
            case PROGRESS:
                changed = row.applyProgress((ProgressEvent) event);
                break;
            case COMPLETE:
                changed = row.applyComplete();
                break;
            case FAILED:
                changed = row.applyFailed(((FailedEvent) event).getError());
                break;
            default:
                throw new IllegalStateException("Unhandled event kind: " + event.getKind());
        }
        row.recordSequence(event.getSequence());

        if(changed) notifyUpdated(row.toSnapshot());
        else logger.debug("Ignoring {} for download in state {}", event, row.getStatus());
    }

    // Commands //

    public CompletableFuture<CommandResult> startDownloads(List<String> urls)
    {
        List<String> targets = requireTargets(urls, "url");
        clearError();
        return issue(EngineCommand.START, targets, () -> commandChannel.start(targets), Collections.emptyMap(), null);
    }

    public CompletableFuture<CommandResult> resumeDownloads(List<String> ids)
    {
        List<String> targets = requireTargets(ids, "download id");
        clearError();

        Map<String, Long> tokens = new LinkedHashMap<>();
        synchronized(this)
        {
            for(String id : targets)
            {
                Download row = downloads.get(id);
                if(row != null && row.getStatus() == DownloadStatus.PAUSED)
                {
                    tokens.put(id, row.markOptimistic(DownloadStatus.DOWNLOADING));
                    notifyUpdated(row.toSnapshot());
                }
            }
        }
        return issue(EngineCommand.RESUME, targets, () -> commandChannel.resume(targets), tokens, DownloadStatus.DOWNLOADING);
    }

    public CompletableFuture<CommandResult> pauseDownload(String id)
    {
        requireId(id);

        Map<String, Long> tokens = new LinkedHashMap<>();
        synchronized(this)
        {
            Download row = downloads.get(id);
            if(row != null && (row.getStatus() == DownloadStatus.DOWNLOADING || row.getStatus() == DownloadStatus.PAUSED))
            {
                tokens.put(id, row.markOptimistic(DownloadStatus.PAUSED));
                notifyUpdated(row.toSnapshot());
            }
        }
        return issue(EngineCommand.PAUSE, Collections.singletonList(id), () -> commandChannel.pause(id), tokens, DownloadStatus.PAUSED);
    }

    // the row disappears right away whatever the engine answers
    public CompletableFuture<CommandResult> cancelDownload(String id)
    {
        requireId(id);
        synchronized(this)
        {
            if(downloads.remove(id) != null) notifyRemoved(id);
        }
        return issue(EngineCommand.CANCEL, Collections.singletonList(id), () -> commandChannel.cancel(id), Collections.emptyMap(), null);
    }

    // Bulk helpers, each reads the selection exactly once //

    public CompletableFuture<List<CommandResult>> pauseSelected(Selection selection)
    {
        List<String> ids = requireSelection(selection);
        List<CompletableFuture<CommandResult>> results = new ArrayList<>();
        for(String id : ids)
        {
            if(getStatus(id) == DownloadStatus.DOWNLOADING) results.add(pauseDownload(id));
        }
        return collect(results);
    }

    public CompletableFuture<CommandResult> resumeSelected(Selection selection)
    {
        List<String> ids = requireSelection(selection);
        List<String> resumable = new ArrayList<>();
        for(String id : ids)
        {
            DownloadStatus status = getStatus(id);
            if(status != null && status != DownloadStatus.COMPLETED && status != DownloadStatus.DOWNLOADING) resumable.add(id);
        }
        if(resumable.isEmpty())
        {
            return CompletableFuture.completedFuture(CommandResult.success(EngineCommand.RESUME, Collections.emptyList()));
        }
        return resumeDownloads(resumable);
    }

    public CompletableFuture<List<CommandResult>> cancelSelected(Selection selection)
    {
        List<String> ids = requireSelection(selection);
        List<CompletableFuture<CommandResult>> results = new ArrayList<>();
        for(String id : ids)
        {
            results.add(cancelDownload(id));
        }
        return collect(results);
    }

    public int removeSelectedFromHistory(Selection selection)
    {
        return removeFromHistory(requireSelection(selection));
    }

    // History //

    /**
     * Adds rows saved by an earlier session. Ids already in the table are left alone.
     *
     * @return number of rows added
     */
    public synchronized int restoreHistory(List<DownloadSnapshot> snapshots)
    {
        if(snapshots == null) throw new IllegalArgumentException("Snapshots cannot be null");
        int restored = 0;
        for(DownloadSnapshot snapshot : snapshots)
        {
            if(snapshot == null || snapshot.getId() == null || downloads.containsKey(snapshot.getId())) continue;
            Download row;
            try
            {
                row = new Download(snapshot);
            }
            catch(IllegalArgumentException e)
            {
                logger.warn("Skipping unusable history entry {}: {}", snapshot.getId(), e.getMessage());
                continue;
            }
            downloads.put(row.getId(), row);
            notifyAdded(row.toSnapshot());
            restored++;
        }
        return restored;
    }

    // removes finished rows locally, active rows have to be cancelled instead
    public synchronized int removeFromHistory(Collection<String> ids)
    {
        if(ids == null) throw new IllegalArgumentException("Ids cannot be null");
        int removed = 0;
        for(String id : ids)
        {
            Download row = downloads.get(id);
            if(row != null && row.getStatus().isTerminal())
            {
                downloads.remove(id);
                notifyRemoved(id);
                removed++;
            }
        }
        return removed;
    }

    public synchronized int purgeHistory()
    {
        List<String> terminal = new ArrayList<>();
        for(Download row : downloads.values())
        {
            if(row.getStatus().isTerminal()) terminal.add(row.getId());
        }
        return removeFromHistory(terminal);
    }

    // Read views //

    // every row in insertion order
    public synchronized List<DownloadSnapshot> getDownloads()
    {
        List<DownloadSnapshot> snapshots = new ArrayList<>(downloads.size());
        for(Download row : downloads.values())
        {
            snapshots.add(row.toSnapshot());
        }
        return snapshots;
    }

    public synchronized Optional<DownloadSnapshot> getDownload(String id)
    {
        if(id == null) return Optional.empty();
        Download row = downloads.get(id);
        return row == null ? Optional.empty() : Optional.of(row.toSnapshot());
    }

    public List<DownloadSnapshot> getActiveDownloads()
    {
        return DownloadViews.active(getDownloads());
    }

    public List<DownloadSnapshot> getOverview()
    {
        return DownloadViews.overview(getDownloads());
    }

    public List<DownloadSnapshot> getHistory(HistoryFilter filter)
    {
        return DownloadViews.history(getDownloads(), filter);
    }

    public Optional<DownloadSnapshot> findNextActive(String excludedId)
    {
        return DownloadViews.nextActive(getDownloads(), excludedId);
    }

    public synchronized int size()
    {
        return downloads.size();
    }

    public synchronized boolean isEmpty()
    {
        return downloads.isEmpty();
    }

    public synchronized Optional<String> getLastError()
    {
        return Optional.ofNullable(lastError);
    }

    public synchronized void clearError()
    {
        lastError = null;
    }

    // Command plumbing //

    private CompletableFuture<CommandResult> issue(EngineCommand command, List<String> targets,
                                                   Supplier<CompletableFuture<Void>> call,
                                                   Map<String, Long> tokens, DownloadStatus target)
    {
        CompletableFuture<Void> response;
        try
        {
            response = call.get();
            if(response == null)
            {
                response = CompletableFuture.failedFuture(new EngineException("Command channel returned no response", command, singleTarget(command, targets)));
            }
        }
        catch(RuntimeException e)
        {
            response = CompletableFuture.failedFuture(e);
        }

        return response.handle((ignored, failure) ->
        {
            if(failure == null)
            {
                onCommandSucceeded(tokens, target);
                return CommandResult.success(command, targets);
            }
            Exception error = unwrap(failure, command, targets);
            onCommandFailed(command, error, tokens);
            return CommandResult.failure(command, targets, error);
        });
    }

    private synchronized void onCommandSucceeded(Map<String, Long> tokens, DownloadStatus target)
    {
        for(Map.Entry<String, Long> entry : tokens.entrySet())
        {
            Download row = downloads.get(entry.getKey());
            if(row != null && row.confirm(entry.getValue(), target)) notifyUpdated(row.toSnapshot());
        }
    }

    private synchronized void onCommandFailed(EngineCommand command, Exception error, Map<String, Long> tokens)
    {
        lastError = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        logger.warn("Engine rejected {} command: {}", command, lastError);

        for(Map.Entry<String, Long> entry : tokens.entrySet())
        {
            Download row = downloads.get(entry.getKey());
            if(row != null && row.rollback(entry.getValue()))
            {
                logger.info("Rolled download {} back to {} after failed {}", row.getId(), row.getStatus(), command);
                notifyUpdated(row.toSnapshot());
            }
        }
    }

    private static Exception unwrap(Throwable failure, EngineCommand command, List<String> targets)
    {
        Throwable cause = failure;
        while((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null)
        {
            cause = cause.getCause();
        }
        if(cause instanceof Exception) return (Exception) cause;
        return new EngineException("Engine command failed: " + cause, cause, command, singleTarget(command, targets));
    }

    private static String singleTarget(EngineCommand command, List<String> targets)
    {
        if(command == EngineCommand.START || targets.size() != 1) return null;
        return targets.get(0);
    }

    private static CompletableFuture<List<CommandResult>> collect(List<CompletableFuture<CommandResult>> results)
    {
        // issue() never completes exceptionally, so join() cannot throw here
        return CompletableFuture.allOf(results.toArray(new CompletableFuture[0]))
            .thenApply(done ->
            {
                List<CommandResult> collected = new ArrayList<>(results.size());
                for(CompletableFuture<CommandResult> result : results)
                {
                    collected.add(result.join());
                }
                return collected;
            });
    }

    private synchronized DownloadStatus getStatus(String id)
    {
        Download row = downloads.get(id);
        return row == null ? null : row.getStatus();
    }

    private static List<String> requireTargets(List<String> values, String what)
    {
        if(values == null || values.isEmpty()) throw new IllegalArgumentException(what + " list cannot be null/empty");
        List<String> targets = new ArrayList<>(values.size());
        for(String value : values)
        {
            if(value == null || value.trim().isEmpty()) throw new IllegalArgumentException(what + " cannot be null/empty");
            targets.add(value.trim());
        }
        return Collections.unmodifiableList(targets);
    }

    private static void requireId(String id)
    {
        if(id == null || id.trim().isEmpty()) throw new IllegalArgumentException("download id cannot be null/empty");
    }

    private static List<String> requireSelection(Selection selection)
    {
        if(selection == null) throw new IllegalArgumentException("Selection cannot be null");
        return selection.snapshot();
    }

    // Listener dispatch //

    private void notifyAdded(DownloadSnapshot download)
    {
        for(DownloadsChangeListener listener : listeners)
        {
            try
            {
                listener.onDownloadAdded(download);
            }
            catch(RuntimeException e)
            {
                logger.error("Listener failed on added download {}", download.getId(), e);
            }
        }
    }

    private void notifyUpdated(DownloadSnapshot download)
    {
        for(DownloadsChangeListener listener : listeners)
        {
            try
            {
                listener.onDownloadUpdated(download);
            }
            catch(RuntimeException e)
            {
                logger.error("Listener failed on updated download {}", download.getId(), e);
            }
        }
    }

    private void notifyRemoved(String id)
    {
        for(DownloadsChangeListener listener : listeners)
        {
            try
            {
                listener.onDownloadRemoved(id);
            }
            catch(RuntimeException e)
            {
                logger.error("Listener failed on removed download {}", id, e);
            }
        }
    }
}
