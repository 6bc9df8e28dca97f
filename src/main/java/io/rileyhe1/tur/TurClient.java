package io.rileyhe1.tur;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.tur.Data.ClientConfig;
import io.rileyhe1.tur.Data.DownloadSnapshot;
import io.rileyhe1.tur.Engine.CommandChannel;
import io.rileyhe1.tur.Engine.EventChannel;
import io.rileyhe1.tur.Engine.LocalEventChannel;
import io.rileyhe1.tur.Settings.JsonFileFastPathCache;
import io.rileyhe1.tur.Settings.JsonFileSettingsPersistence;
import io.rileyhe1.tur.Settings.SettingKey;
import io.rileyhe1.tur.Settings.SettingsStore;
import io.rileyhe1.tur.Shell.ShellEvents;
import io.rileyhe1.tur.Shell.ShellTopic;
import io.rileyhe1.tur.Shell.ShortcutDispatcher;
import io.rileyhe1.tur.Util.HistoryStore;
import io.rileyhe1.tur.Util.Selection;
import io.rileyhe1.tur.Util.Subscription;

/**
 * Wires the registry, settings and shell signals together for one client session.
 */
public class TurClient
{
    private static final Logger logger = LoggerFactory.getLogger(TurClient.class);

    private final ClientConfig config;
    private final EventChannel eventChannel;
    private final LocalEventChannel ownedEventChannel;
    private final DownloadRegistry registry;
    private final SettingsStore settings;
    private final HistoryStore historyStore;
    private final ShellEvents shellEvents;
    private final ShortcutDispatcher shortcutDispatcher;
    private final Selection selection;
    private final List<Subscription> subscriptions = new ArrayList<>();

    private boolean started = false;
    private boolean shutDown = false;

    public TurClient(ClientConfig config, CommandChannel commandChannel, EventChannel eventChannel)
    {
        this(config, commandChannel, eventChannel, null);
    }

    // creates a client that owns an in-process event channel, see getLocalEventChannel()
    public TurClient(ClientConfig config, CommandChannel commandChannel)
    {
        this(config, commandChannel, null, newLocalChannel(config));
    }

    private TurClient(ClientConfig config, CommandChannel commandChannel, EventChannel eventChannel, LocalEventChannel ownedEventChannel)
    {
        if(config == null) throw new IllegalArgumentException("Config cannot be null");
        if(commandChannel == null) throw new IllegalArgumentException("Command channel cannot be null");
        if(eventChannel == null && ownedEventChannel == null) throw new IllegalArgumentException("Event channel cannot be null");

        this.config = config;
        this.ownedEventChannel = ownedEventChannel;
        this.eventChannel = eventChannel != null ? eventChannel : ownedEventChannel;
        this.registry = new DownloadRegistry(commandChannel);
        this.settings = new SettingsStore(new JsonFileSettingsPersistence(config.getSettingsFile()),
            new JsonFileFastPathCache(config.getFastPathFile()));
        this.historyStore = new HistoryStore(config.getHistoryFile());
        this.shellEvents = new ShellEvents();
        this.shortcutDispatcher = new ShortcutDispatcher(settings, shellEvents);
        this.selection = new Selection();
    }

    /**
     * Loads settings, restores history when the user keeps it, and starts listening to the engine.
     */
    public synchronized void start()
    {
        if(started) throw new IllegalStateException("Client is already started");
        if(shutDown) throw new IllegalStateException("Client has been shut down");
        started = true;

        settings.load();

        if(settings.getBoolean(SettingKey.SESSION_HISTORY))
        {
            try
            {
                int restored = registry.restoreHistory(historyStore.load());
                logger.info("Restored {} download(s) from history", restored);
            }
            catch(IOException e)
            {
                logger.warn("Could not restore download history: {}", e.getMessage());
            }
        }

        subscriptions.add(registry.addListener(new HomeStateListener()));
        shellEvents.publish(ShellTopic.HOME_EMPTY_STATE, registry.isEmpty());
        subscriptions.add(registry.attach(eventChannel));
        logger.info("Client started with config directory {}", config.getConfigDirectory());
    }

    /**
     * Writes the current rows to the history file.
     *
     * @return false when history is disabled or the write failed
     */
    public boolean saveHistory()
    {
        if(!settings.getBoolean(SettingKey.SESSION_HISTORY)) return false;
        List<DownloadSnapshot> rows = registry.getDownloads();
        try
        {
            historyStore.save(rows);
            return true;
        }
        catch(IOException e)
        {
            logger.warn("Failed to save download history: {}", e.getMessage());
            return false;
        }
    }

    public synchronized void shutdown()
    {
        if(shutDown) return;
        shutDown = true;

        // Save state to disk before letting go of the engine
        if(started) saveHistory();

        for(Subscription subscription : subscriptions)
        {
            subscription.close();
        }
        subscriptions.clear();
        if(ownedEventChannel != null) ownedEventChannel.close();
        logger.info("Client shut down");
    }

    public DownloadRegistry getRegistry()
    {
        return registry;
    }

    public SettingsStore getSettings()
    {
        return settings;
    }

    public ShellEvents getShellEvents()
    {
        return shellEvents;
    }

    public ShortcutDispatcher getShortcutDispatcher()
    {
        return shortcutDispatcher;
    }

    public Selection getSelection()
    {
        return selection;
    }

    public HistoryStore getHistoryStore()
    {
        return historyStore;
    }

    // null unless the client created its own channel
    public LocalEventChannel getLocalEventChannel()
    {
        return ownedEventChannel;
    }

    public synchronized boolean isStarted()
    {
        return started && !shutDown;
    }

    private static LocalEventChannel newLocalChannel(ClientConfig config)
    {
        if(config == null) throw new IllegalArgumentException("Config cannot be null");
        return new LocalEventChannel(config.getDispatcherThreadName());
    }

    // keeps the home empty-state signal in step with the table
    private class HomeStateListener implements DownloadsChangeListener
    {
        private boolean lastEmpty = registry.isEmpty();

        @Override
        public void onDownloadAdded(DownloadSnapshot snapshot)
        {
            update();
        }

        @Override
        public void onDownloadUpdated(DownloadSnapshot snapshot)
        {
            // row count unchanged
        }

        @Override
        public void onDownloadRemoved(String id)
        {
            update();
        }

        private void update()
        {
            boolean empty = registry.isEmpty();
            if(empty == lastEmpty) return;
            lastEmpty = empty;
            shellEvents.publish(ShellTopic.HOME_EMPTY_STATE, empty);
        }
    }
}
