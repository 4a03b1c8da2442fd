package com.qqsuccubus.beacon.node.http;

import com.qqsuccubus.beacon.core.error.DutyException;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Query string accessors; malformed values fail as {@code INVALID_REQUEST}.
 */
public final class QueryParams {

    private final Map<String, List<String>> parameters;

    private QueryParams(Map<String, List<String>> parameters) {
        this.parameters = parameters;
    }

    public static QueryParams of(String uri) {
        return new QueryParams(new QueryStringDecoder(uri).parameters());
    }

    public Optional<String> first(String name) {
        return Stream.ofNullable(parameters.get(name))
                .flatMap(Collection::stream)
                .filter(value -> !value.isBlank())
                .findFirst();
    }

    /**
     * Every value of a repeated or comma-separated parameter.
     */
    public List<String> all(String name) {
        List<String> values = new ArrayList<>();
        for (String raw : parameters.getOrDefault(name, List.of())) {
            for (String value : raw.split(",")) {
                if (!value.isBlank()) {
                    values.add(value.trim());
                }
            }
        }
        return values;
    }

    public Optional<Long> optionalLong(String name) {
        return first(name).map(value -> parseLong(name, value));
    }

    public boolean flag(String name) {
        return first(name).map(Boolean::parseBoolean).orElse(false);
    }

    public static long parseLong(String name, String value) {
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed < 0) {
                throw DutyException.invalidRequest(String.format("Invalid %s: %s is negative", name, value));
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw DutyException.invalidRequest(String.format("Invalid %s: %s is not a number", name, value));
        }
    }
}
