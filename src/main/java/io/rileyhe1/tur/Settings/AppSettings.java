package io.rileyhe1.tur.Settings;

/**
 * Typed, read-only view of the settings document. Field names map onto the document's
 * snake_case keys. Instances are built by {@link SettingsStore#getSettings()} and never change.
 */
public class AppSettings
{
    private App app;
    private Shortcuts shortcuts;
    private Download download;
    private ThreadSettings thread;
    private Session session;
    private boolean sendAnonymousMetrics;
    private boolean showNotifications;

    // No arg constructor for gson deserialization
    private AppSettings()
    {
    }

    public App getApp()
    {
        return app;
    }

    public Shortcuts getShortcuts()
    {
        return shortcuts;
    }

    public Download getDownload()
    {
        return download;
    }

    public ThreadSettings getThread()
    {
        return thread;
    }

    public Session getSession()
    {
        return session;
    }

    public boolean isSendAnonymousMetrics()
    {
        return sendAnonymousMetrics;
    }

    public boolean isShowNotifications()
    {
        return showNotifications;
    }

    public static class App
    {
        private boolean showTrayIcon;
        private boolean quitOnClose;
        private String sidebar;
        private String theme;
        private String buttonLabel;
        private boolean showDownloadProgress;
        private boolean showSegmentProgress;
        private boolean autostart;

        private App()
        {
        }

        public boolean isShowTrayIcon()
        {
            return showTrayIcon;
        }

        public boolean isQuitOnClose()
        {
            return quitOnClose;
        }

        public String getSidebar()
        {
            return sidebar;
        }

        public String getTheme()
        {
            return theme;
        }

        public String getButtonLabel()
        {
            return buttonLabel;
        }

        public boolean isShowDownloadProgress()
        {
            return showDownloadProgress;
        }

        public boolean isShowSegmentProgress()
        {
            return showSegmentProgress;
        }

        public boolean isAutostart()
        {
            return autostart;
        }
    }

    public static class Shortcuts
    {
        private String goHome;
        private String openSettings;
        private String addDownload;
        private String openDetails;
        private String openHistory;
        private String toggleSidebar;
        private String cancelDownload;
        private String quitApp;

        private Shortcuts()
        {
        }

        public String getGoHome()
        {
            return goHome;
        }

        public String getOpenSettings()
        {
            return openSettings;
        }

        public String getAddDownload()
        {
            return addDownload;
        }

        public String getOpenDetails()
        {
            return openDetails;
        }

        public String getOpenHistory()
        {
            return openHistory;
        }

        public String getToggleSidebar()
        {
            return toggleSidebar;
        }

        public String getCancelDownload()
        {
            return cancelDownload;
        }

        public String getQuitApp()
        {
            return quitApp;
        }
    }

    public static class Download
    {
        private String downloadLocation;
        private int numThreads;
        private long chunkSize;
        private long socketBufferSize;
        private long speedLimit;

        private Download()
        {
        }

        public String getDownloadLocation()
        {
            return downloadLocation;
        }

        public int getNumThreads()
        {
            return numThreads;
        }

        public long getChunkSize()
        {
            return chunkSize;
        }

        public long getSocketBufferSize()
        {
            return socketBufferSize;
        }

        // bytes per second, 0 means unlimited
        public long getSpeedLimit()
        {
            return speedLimit;
        }
    }

    public static class ThreadSettings
    {
        private int totalConnections;
        private int perTaskConnections;

        private ThreadSettings()
        {
        }

        public int getTotalConnections()
        {
            return totalConnections;
        }

        public int getPerTaskConnections()
        {
            return perTaskConnections;
        }
    }

    public static class Session
    {
        private boolean history;
        private boolean metadata;

        private Session()
        {
        }

        public boolean isHistory()
        {
            return history;
        }

        public boolean isMetadata()
        {
            return metadata;
        }
    }
}
