package org.kwindex.runtime;

import com.typesafe.config.Config;
import org.kwindex.runtime.usage.BraceListElementQuoter;
import org.kwindex.runtime.usage.WrongArgsFormatter;

/**
 * Typed view of the {@code kwindex} configuration block.
 *
 * @param quoteLeadingWord Whether usage errors may quote their first word.
 * @param defaultLabel     Word used in lookup errors when the caller names none.
 */
public record RuntimeSettings(boolean quoteLeadingWord, String defaultLabel) {

    /**
     * Settings matching {@code reference.conf}.
     */
    public static final RuntimeSettings DEFAULTS = new RuntimeSettings(true, "option");

    /**
     * Reads the settings from a resolved configuration.
     *
     * @param config The root configuration containing a {@code kwindex} block.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException If a setting is missing or has the wrong type.
     */
    public static RuntimeSettings fromConfig(Config config) {
        Config kwindex = config.getConfig("kwindex");
        return new RuntimeSettings(
                kwindex.getBoolean("usage.quote-leading-word"),
                kwindex.getString("lookup.default-label"));
    }

    /**
     * Creates a usage formatter honoring these settings.
     *
     * @return A new formatter using the default list-element quoting.
     */
    public WrongArgsFormatter newFormatter() {
        return new WrongArgsFormatter(BraceListElementQuoter.INSTANCE, quoteLeadingWord);
    }
}
