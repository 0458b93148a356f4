package io.slwhitelist.roster;

import java.util.Locale;

/**
 * Normalizes the squad lock flag, which hosts report either as a boolean or as a string.
 */
public final class LockFlag {

    private LockFlag() {
    }

    /**
     * A squad counts as unlocked only when the raw value reads {@code false} in any letter case.
     * Anything else, including a missing value, is treated as locked.
     */
    public static boolean parse(Object raw) {
        if (raw instanceof Boolean value) {
            return value;
        }
        if (raw == null) {
            return true;
        }
        return !"false".equals(String.valueOf(raw).trim().toLowerCase(Locale.ROOT));
    }
}
