package io.rileyhe1.tur.Util;

import java.util.Locale;

/**
 * Human readable sizes, speeds and remaining time for download rows.
 */
public final class DownloadFormat
{
    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    private DownloadFormat()
    {
    }

    public static String formatSize(double bytes)
    {
        if(bytes <= 0) return "0 B";
        int unit = (int) Math.floor(Math.log(bytes) / Math.log(1024));
        unit = Math.max(0, Math.min(unit, UNITS.length - 1));
        return String.format(Locale.ROOT, "%.2f %s", bytes / Math.pow(1024, unit), UNITS[unit]);
    }

    public static String formatSpeed(double bytesPerSecond)
    {
        return formatSize(bytesPerSecond) + "/s";
    }

    public static String formatTimeLeft(long downloaded, long total, double bytesPerSecond)
    {
        if(bytesPerSecond <= 0 || total <= 0) return "--:--";
        long remaining = Math.max(0, total - downloaded);
        long seconds = (long) Math.ceil(remaining / bytesPerSecond);
        long minutes = seconds / 60;
        long secs = seconds % 60;
        if(minutes > 60)
        {
            return (minutes / 60) + "h " + (minutes % 60) + "m";
        }
        return String.format(Locale.ROOT, "%d:%02d", minutes, secs);
    }
}
