package at.sv.sihoa.mqtt;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;

class PahoMqttTransportTest {

    private PahoMqttTransport transport;

    @BeforeEach
    void setUp() {
        transport = new PahoMqttTransport(BrokerSettings.of("localhost", 1883, null, null, "test"), 100);
    }

    @Test
    void notConnected_subscriptionsFailWithNonZeroCode() {
        assertThat(transport.isConnected()).isFalse();
        assertThat(transport.subscribe("z2m/lamp")).isNotZero();
        assertThat(transport.unsubscribe("z2m/lamp")).isNotZero();
    }

    @Test
    void notConnected_publishAndDisconnect_doNotThrow() {
        assertThatNoException().isThrownBy(() -> {
            transport.publish("z2m/lamp/set", "{}".getBytes(StandardCharsets.UTF_8));
            transport.disconnect();
        });
    }
}
