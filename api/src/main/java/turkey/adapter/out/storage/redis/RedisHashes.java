package turkey.adapter.out.storage.redis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Conversions between domain values and Redis hash fields.
 *
 * <p>Timestamps are stored as epoch milliseconds. Null values are not written,
 * so a missing field reads back as null.
 */
final class RedisHashes {

    private RedisHashes() {}

    static String millis(Instant instant) {
        return instant == null ? null : String.valueOf(instant.toEpochMilli());
    }

    static Instant instant(Map<String, String> fields, String name) {
        final var value = fields.get(name);
        return value == null || value.isEmpty() ? null : Instant.ofEpochMilli(Long.parseLong(value));
    }

    /**
     * Flatten non-null field pairs into the alternating name/value form Lua scripts take.
     */
    static List<String> pairs(String... namesAndValues) {
        final var result = new ArrayList<String>(namesAndValues.length);
        for (var i = 0; i + 1 < namesAndValues.length; i += 2) {
            if (namesAndValues[i + 1] != null) {
                result.add(namesAndValues[i]);
                result.add(namesAndValues[i + 1]);
            }
        }
        return result;
    }
}
