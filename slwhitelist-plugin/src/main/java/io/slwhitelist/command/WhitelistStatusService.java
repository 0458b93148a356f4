package io.slwhitelist.command;

import io.slwhitelist.common.util.FormatUtils;
import io.slwhitelist.data.ProgressRecord;
import io.slwhitelist.data.ProgressStore;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Read-only lookup of a player's whitelist progress and rank. */
public class WhitelistStatusService {

    private final ProgressStore progressStore;
    private final int threshold;

    public WhitelistStatusService(ProgressStore progressStore, int threshold) {
        this.progressStore = progressStore;
        this.threshold = threshold;
    }

    public WhitelistStatus lookup(String playerId) throws SQLException {
        ProgressRecord record = progressStore.find(playerId);
        if (record == null) {
            return WhitelistStatus.noProgress();
        }
        long percent = FormatUtils.percentOf(record.getScore(), threshold);
        if (!record.isWhitelisted(threshold)) {
            return WhitelistStatus.inProgress(percent);
        }

        // Stable sort: equal scores keep the store's order.
        List<ProgressRecord> ranked = new ArrayList<>(progressStore.findQualified(threshold));
        ranked.sort(Comparator.comparingDouble(ProgressRecord::getScore).reversed());
        int rank = 0;
        for (int i = 0; i < ranked.size(); i++) {
            if (ranked.get(i).getPlayerId().equals(playerId)) {
                rank = i + 1;
                break;
            }
        }
        if (rank == 0) {
            // Decayed below the threshold between the two reads.
            return WhitelistStatus.inProgress(percent);
        }
        return WhitelistStatus.whitelisted(percent, rank, ranked.size());
    }
}
