package io.rileyhe1.tur.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable read model of one download row.
 * This is what the registry hands to callers and what gets written to the history file,
 * so it only holds plain serializable data.
 */
public class DownloadSnapshot
{
    private String id;
    private String url;
    private String filename;
    private String destination;
    private Long size;
    private long downloaded;
    private double speed;
    private int progress;
    private DownloadStatus status;
    private boolean resumeSupported;
    private List<Segment> segments;
    private String error;
    private long revision;
    private boolean pending;

    // No arg constructor for gson deserialization
    private DownloadSnapshot()
    {
    }

    private DownloadSnapshot(Builder builder)
    {
        this.id = builder.id;
        this.url = builder.url;
        this.filename = builder.filename;
        this.destination = builder.destination;
        this.size = builder.size;
        this.downloaded = builder.downloaded;
        this.speed = builder.speed;
        this.progress = builder.progress;
        this.status = builder.status;
        this.resumeSupported = builder.resumeSupported;
        this.segments = builder.segments == null ? null : new ArrayList<>(builder.segments);
        this.error = builder.error;
        this.revision = builder.revision;
        this.pending = builder.pending;
    }

    public String getId()
    {
        return id;
    }

    public String getUrl()
    {
        return url;
    }

    public String getFilename()
    {
        return filename;
    }

    public String getDestination()
    {
        return destination;
    }

    // null until the engine reports a size
    public Long getSize()
    {
        return size;
    }

    public boolean hasKnownSize()
    {
        return size != null;
    }

    public long getDownloaded()
    {
        return downloaded;
    }

    public double getSpeed()
    {
        return speed;
    }

    public int getProgress()
    {
        return progress;
    }

    public DownloadStatus getStatus()
    {
        return status;
    }

    public boolean isResumeSupported()
    {
        return resumeSupported;
    }

    public List<Segment> getSegments()
    {
        if(segments == null) return Collections.emptyList();
        return Collections.unmodifiableList(segments);
    }

    public String getError()
    {
        return error;
    }

    public long getRevision()
    {
        return revision;
    }

    public boolean isPending()
    {
        return pending;
    }

    public boolean isActive()
    {
        return status != null && status.isActive();
    }

    public boolean isTerminal()
    {
        return status != null && status.isTerminal();
    }

    public Builder toBuilder()
    {
        Builder builder = new Builder(id)
            .url(url)
            .filename(filename)
            .destination(destination)
            .size(size)
            .downloaded(downloaded)
            .speed(speed)
            .progress(progress)
            .status(status)
            .resumeSupported(resumeSupported)
            .error(error)
            .revision(revision)
            .pending(pending);
        if(segments != null) builder.segments(segments);
        return builder;
    }

    @Override
    public String toString()
    {
        return "DownloadSnapshot[id=" + id + ", status=" + status + ", progress=" + progress + ", revision=" + revision + "]";
    }

    public static Builder builder(String id)
    {
        return new Builder(id);
    }

    public static class Builder
    {
        private final String id;
        private String url = "";
        private String filename = "";
        private String destination = "";
        private Long size;
        private long downloaded;
        private double speed;
        private int progress;
        private DownloadStatus status = DownloadStatus.QUEUED;
        private boolean resumeSupported;
        private List<Segment> segments;
        private String error;
        private long revision;
        private boolean pending;

        private Builder(String id)
        {
            if(id == null || id.trim().isEmpty()) throw new IllegalArgumentException("Download id cannot be null or empty");
            this.id = id;
        }

        public Builder url(String url)
        {
            this.url = url;
            return this;
        }

        public Builder filename(String filename)
        {
            this.filename = filename;
            return this;
        }

        public Builder destination(String destination)
        {
            this.destination = destination;
            return this;
        }

        public Builder size(Long size)
        {
            if(size != null && size < 0) throw new IllegalArgumentException("Size cannot be negative");
            this.size = size;
            return this;
        }

        public Builder downloaded(long downloaded)
        {
            if(downloaded < 0) throw new IllegalArgumentException("Downloaded bytes cannot be negative");
            this.downloaded = downloaded;
            return this;
        }

        public Builder speed(double speed)
        {
            if(speed < 0) throw new IllegalArgumentException("Speed cannot be negative");
            this.speed = speed;
            return this;
        }

        public Builder progress(int progress)
        {
            if(progress < 0 || progress > 100) throw new IllegalArgumentException("Progress must be within 0..100, was: " + progress);
            this.progress = progress;
            return this;
        }

        public Builder status(DownloadStatus status)
        {
            if(status == null) throw new IllegalArgumentException("Status cannot be null");
            this.status = status;
            return this;
        }

        public Builder resumeSupported(boolean resumeSupported)
        {
            this.resumeSupported = resumeSupported;
            return this;
        }

        public Builder segments(List<Segment> segments)
        {
            this.segments = segments;
            return this;
        }

        public Builder error(String error)
        {
            this.error = error;
            return this;
        }

        public Builder revision(long revision)
        {
            this.revision = revision;
            return this;
        }

        public Builder pending(boolean pending)
        {
            this.pending = pending;
            return this;
        }

        public DownloadSnapshot build()
        {
            return new DownloadSnapshot(this);
        }
    }
}
