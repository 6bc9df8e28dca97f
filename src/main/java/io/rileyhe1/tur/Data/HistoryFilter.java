package io.rileyhe1.tur.Data;

public enum HistoryFilter
{
    ALL,
    COMPLETED,
    INCOMPLETE;

    public boolean matches(DownloadSnapshot download)
    {
        switch(this)
        {
            case COMPLETED:
                return download.getStatus() == DownloadStatus.COMPLETED;
            case INCOMPLETE:
                return download.getStatus() == DownloadStatus.PAUSED || download.getStatus() == DownloadStatus.DOWNLOADING;
            default:
                return true;
        }
    }
}
