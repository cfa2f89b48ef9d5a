package work.lcod.meshdeploy.loader;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import java.io.IOException;
import java.time.Duration;
import work.lcod.meshdeploy.shared.DurationParser;

/**
 * Binds compose durations ({@code 10s}, {@code 1m30s}) and bare millisecond numbers to {@link Duration}.
 */
final class DurationDeserializer extends StdScalarDeserializer<Duration> {
    DurationDeserializer() {
        super(Duration.class);
    }

    @Override
    public Duration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken() == JsonToken.VALUE_NUMBER_INT) {
            return Duration.ofMillis(parser.getLongValue());
        }
        String raw = parser.getValueAsString();
        try {
            return DurationParser.parse(raw).orElse(null);
        } catch (IllegalArgumentException ex) {
            return (Duration) context.handleWeirdStringValue(Duration.class, raw, ex.getMessage());
        }
    }
}
