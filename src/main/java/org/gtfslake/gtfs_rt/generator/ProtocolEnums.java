package org.gtfslake.gtfs_rt.generator;

import org.gtfslake.gtfs_rt.exceptions.FeedSchemaException;

import com.google.protobuf.ProtocolMessageEnum;

/**
 * Resolves enumerated lake columns to GTFS-RT enum constants.
 *
 * <p>The lake stores enumerations either by value name ({@code "CONSTRUCTION"})
 * or by protocol number ({@code "10"}). Both forms are accepted; anything else
 * is a schema violation.</p>
 *
 * @since 1.0
 */
final class ProtocolEnums {

    private ProtocolEnums() {
    }

    /**
     * Resolves a column value to a constant of the given GTFS-RT enum.
     *
     * @param type   the generated enum class, e.g. {@code GtfsRealtime.Alert.Cause.class}
     * @param column the lake column the value was read from, used in error messages
     * @param value  the stored value, never {@code null}
     * @return the matching enum constant
     * @throws FeedSchemaException if the value names no constant of {@code type}
     */
    static <E extends Enum<E> & ProtocolMessageEnum> E resolve(Class<E> type, String column, String value) {
        String trimmed = value.trim();
        if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
            try {
                int number = Integer.parseInt(trimmed);
                for (E constant : type.getEnumConstants()) {
                    if (constant.getNumber() == number) {
                        return constant;
                    }
                }
            } catch (NumberFormatException e) {
                throw new FeedSchemaException("Value of " + column + " is out of range: " + value, e);
            }
        } else {
            try {
                return Enum.valueOf(type, trimmed);
            } catch (IllegalArgumentException e) {
                throw new FeedSchemaException(
                    "Unknown " + type.getSimpleName() + " in " + column + ": " + value, e);
            }
        }
        throw new FeedSchemaException("Unknown " + type.getSimpleName() + " in " + column + ": " + value);
    }
}
