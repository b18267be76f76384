package at.sv.sihoa.device;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActuatorTypeTest {

    @Test
    void parse_isCaseInsensitive() {
        assertThat(ActuatorType.parse("light")).isEqualTo(ActuatorType.LIGHT);
        assertThat(ActuatorType.parse(" Plug ")).isEqualTo(ActuatorType.PLUG);
    }

    @Test
    void parse_unknown_throws() {
        assertThatThrownBy(() -> ActuatorType.parse("thermostat"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("thermostat");
    }

    @Test
    void createVariant_returnsNewInstanceEachTime() {
        assertThat(ActuatorType.PLUG.createVariant()).isNotSameAs(ActuatorType.PLUG.createVariant());
        assertThat(ActuatorType.LIGHT.createVariant()).isInstanceOf(LightVariant.class);
    }

    @Test
    void deviceTopics_withoutBaseTopic_useFriendlyNameOnly() {
        DeviceTopics topics = DeviceTopics.of("", "Lamp");

        assertThat(topics.state()).isEqualTo("Lamp");
        assertThat(topics.get()).isEqualTo("Lamp/get");
        assertThat(topics.set()).isEqualTo("Lamp/set");
    }
}
