package org.storagelayout.compiler.internal.i18n;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Internal facade for the texts of layout diagnostics.
 * Texts come from the "compiler_messages" bundle and are formatted locale-independently,
 * so diagnostics read the same on every host.
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "compiler_messages";
    private static final ResourceBundle BUNDLE = ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.ROOT);

    private Messages() {}

    /**
     * Gets a message for the given key.
     * @param key The key of the message.
     * @return The message, or "!key!" if not found.
     */
    public static String get(String key) {
        try {
            return BUNDLE.getString(key);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
    }

    /**
     * Gets a formatted message for the given key.
     * @param key The key of the message.
     * @param args The arguments for the message format.
     * @return The formatted message.
     */
    public static String get(String key, Object... args) {
        String pattern = get(key);
        return new MessageFormat(pattern, Locale.ROOT).format(args);
    }
}
