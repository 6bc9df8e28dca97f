package io.rileyhe1.tur.Data;

import com.google.gson.annotations.SerializedName;

public enum DownloadStatus
{
    @SerializedName("queued") QUEUED("queued"),
    @SerializedName("downloading") DOWNLOADING("downloading"),
    @SerializedName("paused") PAUSED("paused"),
    @SerializedName("completed") COMPLETED("completed"),
    @SerializedName("failed") FAILED("failed");

    private final String wireName;

    DownloadStatus(String wireName)
    {
        this.wireName = wireName;
    }

    public String getWireName()
    {
        return wireName;
    }

    // queued, downloading and paused downloads are still owned by the engine
    public boolean isActive()
    {
        return this == QUEUED || this == DOWNLOADING || this == PAUSED;
    }

    public boolean isTerminal()
    {
        return this == COMPLETED || this == FAILED;
    }

    public static DownloadStatus fromWireName(String wireName)
    {
        if(wireName == null) throw new IllegalArgumentException("Status cannot be null");
        for(DownloadStatus status : values())
        {
            if(status.wireName.equalsIgnoreCase(wireName.trim())) return status;
        }
        throw new IllegalArgumentException("Unknown download status: " + wireName);
    }
}
