package at.sv.sihoa;

import at.sv.sihoa.device.Actuator;
import at.sv.sihoa.device.ActuatorType;
import at.sv.sihoa.device.Device;
import at.sv.sihoa.mqtt.Message;
import at.sv.sihoa.mqtt.MessageQueue;
import at.sv.sihoa.schedule.ActuatorSchedule;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScheduledGroupTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ZonedDateTime now = ZonedDateTime.of(2024, 3, 10, 20, 0, 0, 0, ZoneId.of("Europe/Vienna"));
    private MessageQueue outboundQueue;
    private ActuatorSchedule schedule;
    private Actuator lamp;
    private Actuator plug;
    private ScheduledGroup group;

    @BeforeEach
    void setUp() {
        outboundQueue = new MessageQueue();
        schedule = mock(ActuatorSchedule.class);
        lamp = Actuator.create(ActuatorType.LIGHT, new Device("0x01", "Lamp"), "z2m", outboundQueue);
        plug = Actuator.create(ActuatorType.PLUG, new Device("0x02", "Plug"), "z2m", outboundQueue);
        group = new ScheduledGroup(schedule, List.of(lamp, plug));
    }

    private void online(Actuator actuator) throws Exception {
        actuator.onAvailability(objectMapper.readTree("{\"state\":\"online\"}"));
    }

    private void report(Actuator actuator, String state) throws Exception {
        actuator.onReport(objectMapper.readTree("{\"state\":\"" + state + "\"}"));
    }

    private List<Message> drainOutbound() {
        List<Message> messages = new ArrayList<>();
        outboundQueue.drainTo(messages);
        return messages;
    }

    @Test
    void evaluate_offlineActuators_areNotCommanded() {
        when(schedule.shouldBeOn(any())).thenReturn(true);

        assertThat(group.evaluate(now)).isZero();
        assertThat(outboundQueue.isEmpty()).isTrue();
    }

    @Test
    void evaluate_onlineWithUnknownState_isCommanded() throws Exception {
        when(schedule.shouldBeOn(any())).thenReturn(true);
        online(lamp);
        drainOutbound();

        assertThat(group.evaluate(now)).isEqualTo(1);

        assertThat(drainOutbound()).extracting(Message::topic).containsExactly("z2m/Lamp/set", "z2m/Lamp/get");
        assertThat(lamp.isPendingCommand()).isTrue();
        assertThat(plug.isPendingCommand()).isFalse();
    }

    @Test
    void evaluate_alreadyInDesiredState_isNotCommanded() throws Exception {
        when(schedule.shouldBeOn(any())).thenReturn(false);
        online(plug);
        report(plug, "OFF");
        drainOutbound();

        assertThat(group.evaluate(now)).isZero();
        assertThat(outboundQueue.isEmpty()).isTrue();
    }

    @Test
    void evaluate_repeatedWhilePending_commandsOnlyOnce() throws Exception {
        when(schedule.shouldBeOn(any())).thenReturn(true);
        online(plug);
        report(plug, "OFF");
        drainOutbound();

        group.evaluate(now);
        group.evaluate(now.plusSeconds(1));
        group.evaluate(now.plusSeconds(2));

        assertThat(drainOutbound()).hasSize(2);
    }

    @Test
    void evaluate_scheduleFlips_commandsNewStateAfterConfirmation() throws Exception {
        when(schedule.shouldBeOn(any())).thenReturn(true, false);
        online(plug);
        report(plug, "OFF");
        group.evaluate(now);
        report(plug, "ON");
        drainOutbound();

        group.evaluate(now.plusHours(8));

        List<Message> messages = drainOutbound();
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).payload().get("state").asText()).isEqualTo("OFF");
    }
}
