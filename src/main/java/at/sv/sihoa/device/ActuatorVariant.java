package at.sv.sihoa.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * The device class specific part of an {@link Actuator}.
 */
public interface ActuatorVariant {

    ActuatorType getType();

    /**
     * @return the attributes to request once the device becomes available
     */
    List<String> getOnlineReadKeys();

    /**
     * Updates the class specific attributes present in the given report. Absent attributes keep their value.
     */
    void onReport(JsonNode report);

    /**
     * Adds class specific hints to a set command.
     */
    default void decorateCommand(ObjectNode command) {
    }
}
