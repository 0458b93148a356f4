package io.slwhitelist.notify;

import io.slwhitelist.common.util.FormatUtils;

/** Text of every message the plugin sends to players. */
public final class WhitelistMessages {

    public static final String HEADER = "═════ SL WHITELIST ═════";
    public static final String FOOTER = "══════════════════════";

    private WhitelistMessages() {
    }

    public static String nowWhitelisted() {
        return banner("You are now on the whitelist!");
    }

    public static String progressUpdate(double score, int threshold) {
        return banner("Progress Update: " + FormatUtils.percentOf(score, threshold) + "%");
    }

    public static String noProgress() {
        return banner("No whitelist progress found for your account.",
                "Start leading a squad to earn progress!");
    }

    public static String inProgress(long percent) {
        return banner("No whitelist yet. Keep leading squads to earn more progress!",
                "Progress: " + percent + "%");
    }

    public static String whitelisted(long percent, int rank, int total) {
        return banner("You are on the whitelist!",
                "Progress: " + percent + "%",
                "Rank: " + rank + " of " + total);
    }

    private static String banner(String... lines) {
        StringBuilder builder = new StringBuilder(HEADER);
        for (String line : lines) {
            builder.append('\n').append(line);
        }
        return builder.append('\n').append(FOOTER).toString();
    }
}
