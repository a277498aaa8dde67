package com.jmau.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.jmau.value.Value;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads one JSON document into a {@link Value}. Object keys become string keys, integral numbers
 * that fit in a long become integers and every other number a float.
 */
public class JsonValueParser {
    private final JsonFactory factory = new JsonFactory();

    public Value parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseDocument(parser);
        }
    }

    public Value parse(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return parseDocument(parser);
        }
    }

    private Value parseDocument(JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();
        if (token == null) {
            throw new IOException("Empty JSON input");
        }
        Value value = parseValue(parser, token);
        JsonToken trailing = parser.nextToken();
        if (trailing != null) {
            throw new IOException("Unexpected trailing JSON token: " + trailing);
        }
        return value;
    }

    private Value parseValue(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> new Value.StringValue(parser.getText());
            case VALUE_NUMBER_INT -> parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER
                    ? Value.of(parser.getDoubleValue())
                    : Value.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> Value.of(parser.getDoubleValue());
            case VALUE_TRUE -> Value.TRUE;
            case VALUE_FALSE -> Value.FALSE;
            case VALUE_NULL -> Value.NULL;
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private Value.MapValue parseObject(JsonParser parser) throws IOException {
        var fields = Maps.mutable.<Value.Key, Value>empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            Value value = parseValue(parser, parser.nextToken());
            fields.put(new Value.StringValue(fieldName), value);
        }

        return new Value.MapValue(fields.toImmutable());
    }

    private Value.ListValue parseArray(JsonParser parser) throws IOException {
        var elements = Lists.mutable.<Value>empty();

        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                break;
            }
            elements.add(parseValue(parser, token));
        }

        return new Value.ListValue(elements.toImmutable());
    }
}
