package at.sv.sihoa.mqtt;

import com.fasterxml.jackson.databind.JsonNode;

public record Message(String topic, JsonNode payload) {
}
