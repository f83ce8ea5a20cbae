package ch.so.arp.kbdb.search;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

/**
 * Binds {@code top_k} from a JSON integer only. Fractions, strings and
 * booleans are rejected instead of being coerced.
 */
class StrictIntegerDeserializer extends StdDeserializer<Integer> {

    StrictIntegerDeserializer() {
        super(Integer.class);
    }

    @Override
    public Integer deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken() == JsonToken.VALUE_NUMBER_INT) {
            return parser.getIntValue();
        }
        throw MismatchedInputException.from(parser, Integer.class,
                "top_k must be an integer but was " + parser.getText());
    }
}
