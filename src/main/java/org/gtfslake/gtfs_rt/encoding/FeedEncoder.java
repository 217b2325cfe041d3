package org.gtfslake.gtfs_rt.encoding;

import java.nio.charset.StandardCharsets;

import org.gtfslake.gtfs_rt.exceptions.FeedSchemaException;
import org.springframework.stereotype.Component;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import com.google.transit.realtime.GtfsRealtime;

/**
 * Serializes feed messages in either wire format.
 *
 * <p>Both formats are rendered from the same built message. The binary form is the
 * standard protocol buffer encoding and is byte-for-byte reproducible. The JSON form
 * uses the protocol buffer JSON mapping with the schema's own field names
 * ({@code gtfs_realtime_version}, {@code stop_time_update}, ...), enum values by name,
 * 64-bit integers as strings, no insignificant whitespace, and keys in schema field
 * order, so it parses back into an equal message.</p>
 *
 * @since 1.0
 */
@Component
public class FeedEncoder {

    private final JsonFormat.Printer jsonPrinter = JsonFormat.printer()
        .preservingProtoFieldNames()
        .omittingInsignificantWhitespace();

    /**
     * Encodes a feed message.
     *
     * @param feedMessage the built feed message
     * @param format the target format
     * @return the encoded payload; UTF-8 text for {@link FeedFormat#JSON}
     * @throws FeedSchemaException if the message cannot be rendered as JSON
     */
    public byte[] encode(GtfsRealtime.FeedMessage feedMessage, FeedFormat format) {
        switch (format) {
            case JSON:
                try {
                    return jsonPrinter.print(feedMessage).getBytes(StandardCharsets.UTF_8);
                } catch (InvalidProtocolBufferException e) {
                    throw new FeedSchemaException("Feed message cannot be rendered as JSON", e);
                }
            case BINARY:
            default:
                return feedMessage.toByteArray();
        }
    }
}
