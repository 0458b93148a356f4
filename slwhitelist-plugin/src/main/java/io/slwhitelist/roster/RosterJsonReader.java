package io.slwhitelist.roster;

import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts the host's JSON player list into a typed {@link RosterSnapshot}.
 * <p>
 * Expected shape per element: {@code {"steamID": "...", "name": "...", "isLeader": true,
 * "squadID": "3", "squad": {"squadID": "3", "squadName": "ARMOR", "locked": "False"}}}.
 * Squad membership needs a {@code squad} object; its {@code squadID} wins, and the player-level
 * {@code squadID} only fills in when the object lacks one. A player with a flat {@code squadID}
 * but no {@code squad} object is squadless, which makes it ineligible downstream.
 * Entries without a usable id are dropped.
 */
public final class RosterJsonReader {

    private static final FluentLogger LOGGER = FluentLogger.forEnclosingClass();
    private static final String[] ID_KEYS = {"steamID", "eosID", "id"};

    private RosterJsonReader() {
    }

    public static RosterSnapshot read(String json) {
        if (json == null || json.isBlank()) {
            return RosterSnapshot.empty();
        }
        try {
            JsonElement root = JsonParser.parseString(json);
            if (!root.isJsonArray()) {
                LOGGER.atWarning().log("Roster payload is not a JSON array, ignoring it");
                return RosterSnapshot.empty();
            }
            return read(root.getAsJsonArray());
        } catch (JsonParseException e) {
            LOGGER.atWarning().withCause(e).log("Unreadable roster payload");
            return RosterSnapshot.empty();
        }
    }

    public static RosterSnapshot read(JsonArray players) {
        List<RosterEntry> entries = new ArrayList<>(players.size());
        int dropped = 0;
        for (JsonElement element : players) {
            RosterEntry entry = element != null && element.isJsonObject() ? toEntry(element.getAsJsonObject()) : null;
            if (entry == null) {
                dropped++;
                continue;
            }
            entries.add(entry);
        }
        if (dropped > 0) {
            LOGGER.atFine().log("Dropped " + dropped + " malformed roster entries");
        }
        return new RosterSnapshot(entries);
    }

    @Nullable
    private static RosterEntry toEntry(JsonObject player) {
        String playerId = null;
        for (String key : ID_KEYS) {
            playerId = readString(player, key);
            if (playerId != null) {
                break;
            }
        }
        if (playerId == null) {
            return null;
        }
        return new RosterEntry(playerId, readString(player, "name"), readSquad(player),
                readFlag(player.get("isLeader")));
    }

    @Nullable
    private static SquadRef readSquad(JsonObject player) {
        JsonElement squadElement = player.get("squad");
        if (squadElement == null || !squadElement.isJsonObject()) {
            return null;
        }
        JsonObject squad = squadElement.getAsJsonObject();
        String squadId = readString(squad, "squadID");
        if (squadId == null) {
            squadId = readString(player, "squadID");
        }
        if (squadId == null) {
            return null;
        }
        return new SquadRef(squadId, readString(squad, "squadName"), LockFlag.parse(readRaw(squad.get("locked"))));
    }

    @Nullable
    private static String readString(JsonObject object, String key) {
        JsonElement value = object.get(key);
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        String text = value.getAsString().trim();
        return text.isEmpty() ? null : text;
    }

    @Nullable
    private static Object readRaw(JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        return primitive.isBoolean() ? primitive.getAsBoolean() : primitive.getAsString();
    }

    private static boolean readFlag(JsonElement value) {
        Object raw = readRaw(value);
        if (raw instanceof Boolean flag) {
            return flag;
        }
        return raw != null && "true".equals(raw.toString().trim().toLowerCase(Locale.ROOT));
    }
}
