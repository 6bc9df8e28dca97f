package io.rileyhe1.tur.Data;

import java.nio.file.Path;
import java.nio.file.Paths;

public class ClientConfig
{
    private final String configDirectory;
    private final String settingsFileName;
    private final String fastPathFileName;
    private final String historyFileName;
    private final String dispatcherThreadName;

    public ClientConfig(Builder builder)
    {
        this.configDirectory = builder.configDirectory;
        this.settingsFileName = builder.settingsFileName;
        this.fastPathFileName = builder.fastPathFileName;
        this.historyFileName = builder.historyFileName;
        this.dispatcherThreadName = builder.dispatcherThreadName;
    }

    public String getConfigDirectory()
    {
        return configDirectory;
    }

    public String getSettingsFileName()
    {
        return settingsFileName;
    }

    public String getFastPathFileName()
    {
        return fastPathFileName;
    }

    public String getHistoryFileName()
    {
        return historyFileName;
    }

    public String getDispatcherThreadName()
    {
        return dispatcherThreadName;
    }

    public Path getSettingsFile()
    {
        return Paths.get(configDirectory, settingsFileName);
    }

    public Path getFastPathFile()
    {
        return Paths.get(configDirectory, fastPathFileName);
    }

    public Path getHistoryFile()
    {
        return Paths.get(configDirectory, historyFileName);
    }

    /**
     * Creates a new builder with default values
     */
    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Creates a builder pre-populated with default values
     */
    public static Builder defaultConfig()
    {
        return new Builder();
    }

    public static class Builder
    {
        private String configDirectory = Paths.get(System.getProperty("user.home"), ".config", "tur").toString();
        private String settingsFileName = "settings.json";
        private String fastPathFileName = "fast-path.json";
        private String historyFileName = "history.json";
        private String dispatcherThreadName = "tur-events";

        public Builder configDirectory(String configDirectory)
        {
            if(configDirectory == null || configDirectory.trim().isEmpty())
            {
                throw new IllegalArgumentException("Config directory cannot be null or empty");
            }
            this.configDirectory = configDirectory;
            return this;
        }

        public Builder settingsFileName(String settingsFileName)
        {
            this.settingsFileName = requireFileName(settingsFileName, "Settings file name");
            return this;
        }

        public Builder fastPathFileName(String fastPathFileName)
        {
            this.fastPathFileName = requireFileName(fastPathFileName, "Fast path cache file name");
            return this;
        }

        public Builder historyFileName(String historyFileName)
        {
            this.historyFileName = requireFileName(historyFileName, "History file name");
            return this;
        }

        public Builder dispatcherThreadName(String dispatcherThreadName)
        {
            if(dispatcherThreadName == null || dispatcherThreadName.trim().isEmpty())
            {
                throw new IllegalArgumentException("Dispatcher thread name cannot be null or empty");
            }
            this.dispatcherThreadName = dispatcherThreadName;
            return this;
        }

        public ClientConfig build()
        {
            if(settingsFileName.equals(fastPathFileName) || settingsFileName.equals(historyFileName) || fastPathFileName.equals(historyFileName))
            {
                throw new IllegalStateException("Settings, fast path cache and history must use different files");
            }
            return new ClientConfig(this);
        }

        private static String requireFileName(String fileName, String what)
        {
            if(fileName == null || fileName.trim().isEmpty())
            {
                throw new IllegalArgumentException(what + " cannot be null or empty");
            }
            if(fileName.contains("/") || fileName.contains("\\"))
            {
                throw new IllegalArgumentException(what + " must be a bare file name: " + fileName);
            }
            return fileName;
        }
    }
}
