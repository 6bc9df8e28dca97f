package io.rileyhe1.tur.Engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.rileyhe1.tur.Data.Segment;

public class ProgressEvent extends EngineEvent
{
    private long downloaded;
    private long total;
    private double speed;
    private double progress;
    private List<Segment> segments;

    // No arg constructor for gson deserialization
    private ProgressEvent()
    {
    }

    public ProgressEvent(String id, long downloaded, long total, double speed, double progress)
    {
        this(id, downloaded, total, speed, progress, null);
    }

    public ProgressEvent(String id, long downloaded, long total, double speed, double progress, Long sequence)
    {
        this(id, downloaded, total, speed, progress, null, sequence);
    }

    public ProgressEvent(String id, long downloaded, long total, double speed, double progress, List<Segment> segments, Long sequence)
    {
        super(id, sequence);
        this.downloaded = downloaded;
        this.total = total;
        this.speed = speed;
        this.progress = progress;
        this.segments = segments == null ? null : new ArrayList<>(segments);
    }

    public long getDownloaded()
    {
        return downloaded;
    }

    // zero when the engine does not know the size yet
    public long getTotal()
    {
        return total;
    }

    public double getSpeed()
    {
        return speed;
    }

    public double getProgress()
    {
        return progress;
    }

    public boolean hasSegments()
    {
        return segments != null;
    }

    // null when the engine did not report connection coverage with this tick
    public List<Segment> getSegments()
    {
        return segments == null ? null : Collections.unmodifiableList(segments);
    }

    @Override
    public Kind getKind()
    {
        return Kind.PROGRESS;
    }
}
