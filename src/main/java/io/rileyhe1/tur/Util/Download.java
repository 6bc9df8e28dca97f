package io.rileyhe1.tur.Util;

import java.util.ArrayList;
import java.util.List;

import io.rileyhe1.tur.Data.DownloadSnapshot;
import io.rileyhe1.tur.Data.DownloadStatus;
import io.rileyhe1.tur.Data.Segment;
import io.rileyhe1.tur.Engine.ProgressEvent;
import io.rileyhe1.tur.Engine.QueueEvent;

/**
 * One mutable row of the registry table. Only the registry touches it, always while holding the
 * registry's lock, so nothing in here is synchronized.
 * <p>
 * Every mutation bumps {@link #getRevision()}. Optimistic status changes are tagged with the
 * revision they were made at, which doubles as the token the issuing command uses to confirm or
 * roll back its change later.
 */
public class Download
{
    private static final long NO_PENDING = -1L;

    private final String id;
    private final String url;
    private final String filename;
    private final String destination;
    private final boolean resumeSupported;

    private Long size;
    private long downloaded;
    private double speed;
    private int progress;
    private DownloadStatus status;
    private List<Segment> segments;
    private String error;

    private long revision;
    private Long lastSequence;
    private long pendingToken = NO_PENDING;
    private DownloadStatus confirmedStatus;

    // creates a row from the first queue notification for an id
    public Download(QueueEvent event)
    {
        if(event == null) throw new IllegalArgumentException("Queue event cannot be null!");
        if(event.getSize() != null && event.getSize() < 0) throw new IllegalArgumentException("Size cannot be negative!");
        this.id = event.getId();
        this.url = nullToEmpty(event.getUrl());
        this.filename = nullToEmpty(event.getFilename());
        this.destination = nullToEmpty(event.getDestination());
        this.resumeSupported = event.isResumeSupported();
        this.size = event.getSize();
        this.status = DownloadStatus.QUEUED;
        this.lastSequence = event.getSequence();
    }

    // restores a row from the history file; nothing is transferring after a restart so active rows come back paused
    public Download(DownloadSnapshot snapshot)
    {
        if(snapshot == null) throw new IllegalArgumentException("Snapshot cannot be null!");
        if(snapshot.getId() == null || snapshot.getId().trim().isEmpty()) throw new IllegalArgumentException("Snapshot has no id!");
        if(snapshot.getStatus() == null) throw new IllegalArgumentException("Snapshot has no status!");
        this.id = snapshot.getId();
        this.url = nullToEmpty(snapshot.getUrl());
        this.filename = nullToEmpty(snapshot.getFilename());
        this.destination = nullToEmpty(snapshot.getDestination());
        this.resumeSupported = snapshot.isResumeSupported();
        this.size = snapshot.getSize();
        this.downloaded = Math.max(0, snapshot.getDownloaded());
        this.speed = 0;
        this.segments = snapshot.getSegments().isEmpty() ? null : new ArrayList<>(snapshot.getSegments());
        this.revision = snapshot.getRevision();

        switch(snapshot.getStatus())
        {
            case COMPLETED:
                this.status = DownloadStatus.COMPLETED;
                this.progress = 100;
                break;
            case FAILED:
                this.status = DownloadStatus.FAILED;
                this.progress = clampProgress(snapshot.getProgress());
                this.error = snapshot.getError();
                break;
            default:
                this.status = DownloadStatus.PAUSED;
                this.progress = clampProgress(snapshot.getProgress());
                break;
        }
    }

    // Event driven transitions, each returns false when the event does not apply to the row //

    /**
     * Applies a repeated queue notification for this id. The engine sends one when a transfer is
     * restarted, so the metrics start over while the row keeps its url, filename, destination
     * and resume capability.
     */
    public boolean applyRequeue(QueueEvent event)
    {
        if(status.isTerminal()) return false;
        if(event.getSize() != null)
        {
            if(event.getSize() < 0) throw new IllegalArgumentException("Size cannot be negative!");
            size = event.getSize();
        }
        status = DownloadStatus.QUEUED;
        downloaded = 0;
        speed = 0;
        progress = 0;
        segments = null;
        error = null;
        clearPending();
        touch();
        return true;
    }

    public boolean applyStarted()
    {
        if(status.isTerminal()) return false;
        status = DownloadStatus.DOWNLOADING;
        clearPending();
        touch();
        return true;
    }

    public boolean applyProgress(ProgressEvent event)
    {
        if(status.isTerminal()) return false;
        // the engine does not always announce a start, the first progress report counts as one
        if(status == DownloadStatus.QUEUED)
        {
            status = DownloadStatus.DOWNLOADING;
            clearPending();
        }

        long reported = Math.max(0, event.getDownloaded());
        // bytes only move forward while the engine is transferring
        downloaded = status == DownloadStatus.DOWNLOADING ? Math.max(downloaded, reported) : reported;
        speed = status == DownloadStatus.DOWNLOADING ? Math.max(0, event.getSpeed()) : 0;
        progress = clampProgress(event.getProgress());
        if(event.getTotal() > 0) size = event.getTotal();
        if(event.hasSegments()) segments = validSegments(event.getSegments());
        touch();
        return true;
    }

    public boolean applyComplete()
    {
        if(status.isTerminal()) return false;
        status = DownloadStatus.COMPLETED;
        progress = 100;
        speed = 0;
        error = null;
        clearPending();
        touch();
        return true;
    }

    public boolean applyFailed(String message)
    {
        if(status.isTerminal()) return false;
        status = DownloadStatus.FAILED;
        speed = 0;
        error = message == null || message.trim().isEmpty() ? "Download failed" : message;
        clearPending();
        touch();
        return true;
    }

    // Sequence bookkeeping //

    public boolean isStale(Long sequence)
    {
        return sequence != null && lastSequence != null && sequence <= lastSequence;
    }

    public void recordSequence(Long sequence)
    {
        if(sequence != null && (lastSequence == null || sequence > lastSequence)) lastSequence = sequence;
    }

    // Optimistic updates //

    /**
     * Moves the row to the given status ahead of the engine's confirmation.
     *
     * @return token identifying this optimistic change
     */
    public long markOptimistic(DownloadStatus target)
    {
        if(target == null) throw new IllegalArgumentException("Target status cannot be null!");
        if(status.isTerminal()) throw new IllegalStateException("Cannot change a terminal download optimistically, current state: " + status);
        // keep the oldest confirmed status when optimistic changes stack up
        if(pendingToken == NO_PENDING) confirmedStatus = status;
        status = target;
        if(target != DownloadStatus.DOWNLOADING) speed = 0;
        touch();
        pendingToken = revision;
        return pendingToken;
    }

    /**
     * Records the engine's acceptance of the optimistic change made with the given token.
     * An older, superseded change only updates the status a later rollback would return to.
     */
    public boolean confirm(long token, DownloadStatus target)
    {
        if(pendingToken == token)
        {
            clearPending();
            touch();
            return true;
        }
        if(isPending() && token < pendingToken && target != null) confirmedStatus = target;
        return false;
    }

    public boolean rollback(long token)
    {
        if(pendingToken != token) return false;
        status = confirmedStatus;
        if(status != DownloadStatus.DOWNLOADING) speed = 0;
        clearPending();
        touch();
        return true;
    }

    public boolean isPending()
    {
        return pendingToken != NO_PENDING;
    }

    public DownloadSnapshot toSnapshot()
    {
        return DownloadSnapshot.builder(id)
            .url(url)
            .filename(filename)
            .destination(destination)
            .size(size)
            .downloaded(downloaded)
            .speed(speed)
            .progress(progress)
            .status(status)
            .resumeSupported(resumeSupported)
            .segments(segments)
            .error(error)
            .revision(revision)
            .pending(isPending())
            .build();
    }

    public String getId()
    {
        return id;
    }

    public DownloadStatus getStatus()
    {
        return status;
    }

    public long getRevision()
    {
        return revision;
    }

    public Long getLastSequence()
    {
        return lastSequence;
    }

    private void clearPending()
    {
        pendingToken = NO_PENDING;
        confirmedStatus = null;
    }

    private void touch()
    {
        revision++;
    }

    private static int clampProgress(double value)
    {
        if(Double.isNaN(value)) return 0;
        return (int) Math.max(0, Math.min(100, Math.round(value)));
    }

    private static List<Segment> validSegments(List<Segment> reported)
    {
        List<Segment> valid = new ArrayList<>();
        for(Segment segment : reported)
        {
            // gson builds segments without running the constructor checks
            if(segment == null) continue;
            if(segment.getStart() < 0 || segment.getEnd() > 100 || segment.getStart() > segment.getEnd()) continue;
            valid.add(segment);
        }
        return valid;
    }

    private static String nullToEmpty(String value)
    {
        return value == null ? "" : value;
    }
}
