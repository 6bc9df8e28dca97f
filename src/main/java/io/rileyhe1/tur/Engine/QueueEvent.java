package io.rileyhe1.tur.Engine;

public class QueueEvent extends EngineEvent
{
    private String url;
    private String filename;
    private Long size;
    private String destination;
    private boolean resumeSupported;

    // No arg constructor for gson deserialization
    private QueueEvent()
    {
    }

    public QueueEvent(String id, String url, String filename, Long size, String destination, boolean resumeSupported)
    {
        this(id, url, filename, size, destination, resumeSupported, null);
    }

    public QueueEvent(String id, String url, String filename, Long size, String destination, boolean resumeSupported, Long sequence)
    {
        super(id, sequence);
        this.url = url;
        this.filename = filename;
        this.size = size;
        this.destination = destination;
        this.resumeSupported = resumeSupported;
    }

    public String getUrl()
    {
        return url;
    }

    public String getFilename()
    {
        return filename;
    }

    public Long getSize()
    {
        return size;
    }

    public String getDestination()
    {
        return destination;
    }

    public boolean isResumeSupported()
    {
        return resumeSupported;
    }

    @Override
    public Kind getKind()
    {
        return Kind.QUEUE;
    }
}
