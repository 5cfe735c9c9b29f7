package io.github.drompincen.cronsync.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronJobTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void decodesGatewayJobWithUnknownFields() throws Exception {
        String json = """
                {"id":"j1","name":"nightly","enabled":true,"createdAtMs":1,"updatedAtMs":2,
                 "schedule":{"kind":"cron","expr":"0 9 * * 3","tz":"UTC"},
                 "sessionTarget":"isolated","wakeMode":"now",
                 "payload":{"kind":"agentTurn","message":"go","deliver":true,"channel":"last"},
                 "isolation":{"postToMain":true,"postToMainPrefix":"Cron"},
                 "state":{"nextRunAtMs":100,"lastStatus":"ok"},
                 "owner":"someone"}
                """;

        CronJob job = mapper.readValue(json, CronJob.class);

        assertThat(job.schedule()).isEqualTo(new CronSchedule.Cron("0 9 * * 3", "UTC"));
        assertThat(job.sessionTarget()).isEqualTo(SessionTarget.ISOLATED);
        assertThat(job.wakeMode()).isEqualTo(WakeMode.NOW);
        assertThat(job.payload()).isInstanceOf(CronPayload.AgentTurn.class);
        assertThat(((CronPayload.AgentTurn) job.payload()).deliver()).isTrue();
        assertThat(job.isolation().postToMain()).isTrue();
        assertThat(job.state().nextRunAtMs()).isEqualTo(100L);
    }

    @Test
    void displayNameFallsBackToId() {
        CronJob unnamed = new CronJob("j1", "  ", true, 0, 0, CronSchedule.Every.of(1000),
                SessionTarget.MAIN, WakeMode.NOW, new CronPayload.SystemEvent("x"), null, null);

        assertThat(unnamed.displayName()).isEqualTo("j1");
    }

    @Test
    void scheduleCarriesKindDiscriminator() {
        JsonNode every = mapper.valueToTree(CronSchedule.Every.of(60_000));
        JsonNode at = mapper.valueToTree(new CronSchedule.At(5L));

        assertThat(every.get("kind").asText()).isEqualTo("every");
        assertThat(every.get("everyMs").asLong()).isEqualTo(60_000);
        assertThat(every.has("anchorMs")).isFalse();
        assertThat(at.get("kind").asText()).isEqualTo("at");
    }

    @Test
    void jobInputOmitsUnsetFields() {
        JsonNode patch = mapper.valueToTree(CronJobInput.enabledOnly(false));

        assertThat(patch.size()).isEqualTo(1);
        assertThat(patch.get("enabled").asBoolean()).isFalse();
    }

    @Test
    void enumsUseWireNames() throws Exception {
        assertThat(mapper.writeValueAsString(WakeMode.NEXT_HEARTBEAT)).isEqualTo("\"next-heartbeat\"");
        assertThat(mapper.readValue("\"MAIN\"", SessionTarget.class)).isEqualTo(SessionTarget.MAIN);
        assertThatThrownBy(() -> SessionTarget.fromWire("elsewhere"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listResponseDefaultsToEmpty() throws Exception {
        assertThat(mapper.readValue("{}", CronListResponse.class).jobs()).isEmpty();
        assertThat(mapper.readValue("{}", CronRunsResponse.class).entries()).isEmpty();
    }
}
