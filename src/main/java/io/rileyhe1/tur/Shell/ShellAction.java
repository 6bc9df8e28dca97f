package io.rileyhe1.tur.Shell;

import io.rileyhe1.tur.Settings.SettingKey;

/**
 * Requests the shell reacts to. Declaration order is the order key bindings are checked in.
 */
public enum ShellAction
{
    GO_HOME(SettingKey.SHORTCUT_GO_HOME),
    OPEN_SETTINGS(SettingKey.SHORTCUT_OPEN_SETTINGS),
    OPEN_ADD_DIALOG(SettingKey.SHORTCUT_ADD_DOWNLOAD),
    OPEN_DETAILS(SettingKey.SHORTCUT_OPEN_DETAILS),
    OPEN_HISTORY(SettingKey.SHORTCUT_OPEN_HISTORY),
    TOGGLE_SIDEBAR(SettingKey.SHORTCUT_TOGGLE_SIDEBAR),
    CANCEL_DOWNLOAD(SettingKey.SHORTCUT_CANCEL_DOWNLOAD),
    QUIT_APP(SettingKey.SHORTCUT_QUIT_APP);

    private final SettingKey shortcutKey;

    ShellAction(SettingKey shortcutKey)
    {
        this.shortcutKey = shortcutKey;
    }

    public SettingKey getShortcutKey()
    {
        return shortcutKey;
    }
}
