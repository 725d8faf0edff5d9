package io.paxbridge.tools.utils;

import com.fasterxml.jackson.databind.JsonNode;

public class Command {
    private final String name;
    private final JsonNode data;

    public Command(String name, JsonNode data) {
        this.name = name;
        this.data = data;
    }

    public String name() {
        return name;
    }

    public JsonNode data() {
        return data;
    }
}
