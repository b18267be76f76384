package at.sv.sihoa.mqtt;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface TopicHandler {
    void handle(JsonNode payload);
}
