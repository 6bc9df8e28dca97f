package io.rileyhe1.tur.Shell;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.rileyhe1.tur.Settings.SettingsStore;

/**
 * Turns key presses into {@link ShellAction}s using the bindings from the settings store.
 */
public class ShortcutDispatcher
{
    private static final Logger logger = LoggerFactory.getLogger(ShortcutDispatcher.class);

    private final SettingsStore settings;
    private final ShellEvents events;

    public ShortcutDispatcher(SettingsStore settings, ShellEvents events)
    {
        if(settings == null) throw new IllegalArgumentException("Settings store cannot be null");
        if(events == null) throw new IllegalArgumentException("Shell events cannot be null");
        this.settings = settings;
        this.events = events;
    }

    /**
     * @return true when the press matched a binding and an action was published
     */
    public boolean handle(KeyPress press)
    {
        if(press == null) throw new IllegalArgumentException("Key press cannot be null");
        // bindings are only known once the real settings are in
        if(!settings.isReady()) return false;

        for(ShellAction action : ShellAction.values())
        {
            Shortcut shortcut;
            try
            {
                shortcut = Shortcut.parse(settings.getString(action.getShortcutKey()));
            }
            catch(IllegalArgumentException e)
            {
                logger.warn("Ignoring unusable binding for {}: {}", action, e.getMessage());
                continue;
            }
            if(!shortcut.matches(press)) continue;

            // the sidebar stays put while home shows its empty state
            if(action == ShellAction.TOGGLE_SIDEBAR && events.isHomeEmpty()) return false;

            events.publish(ShellTopic.ACTION, action);
            return true;
        }
        return false;
    }
}
