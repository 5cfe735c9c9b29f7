package io.github.drompincen.cronsync.runtime.editor;

import io.github.drompincen.cronsync.protocol.api.CronIsolation;
import io.github.drompincen.cronsync.protocol.api.CronJobInput;
import io.github.drompincen.cronsync.protocol.api.CronPayload;
import io.github.drompincen.cronsync.protocol.api.CronSchedule;
import io.github.drompincen.cronsync.protocol.api.SessionTarget;
import io.github.drompincen.cronsync.protocol.api.WakeMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobPayloadBuilderTest {

    private JobEditorFields fields;

    @BeforeEach
    void setUp() {
        fields = new JobEditorFields();
        fields.setName("  nightly  ");
        fields.setSystemEventText("ping");
    }

    // ------------------------------------------------------------------
    // Schedule
    // ------------------------------------------------------------------

    @Test
    void everySchedule_parsesDuration() {
        fields.setEveryText("10m");

        CronJobInput input = JobPayloadBuilder.build(fields, false);

        assertThat(input.schedule()).isEqualTo(new CronSchedule.Every(600_000, null));
        assertThat(input.name()).isEqualTo("nightly");
        assertThat(input.enabled()).isTrue();
        assertThat(input.sessionTarget()).isEqualTo(SessionTarget.MAIN);
        assertThat(input.wakeMode()).isEqualTo(WakeMode.NEXT_HEARTBEAT);
    }

    @Test
    void everySchedule_rejectsBadDuration() {
        fields.setEveryText("often");

        assertThatThrownBy(() -> JobPayloadBuilder.build(fields, false))
                .isInstanceOf(JobValidationException.class)
                .hasMessage("Invalid every duration (use 10m, 1h, 1d).");
    }

    @Test
    void atSchedule_usesTimestamp() {
        fields.setScheduleKind(JobEditorFields.ScheduleKind.AT);
        fields.setAtMs(1_700_000_000_000L);

        assertThat(JobPayloadBuilder.build(fields, false).schedule())
                .isEqualTo(new CronSchedule.At(1_700_000_000_000L));
    }

    @Test
    void cronSchedule_trimsAndDropsEmptyZone() {
        fields.setScheduleKind(JobEditorFields.ScheduleKind.CRON);
        fields.setCronExpr("  0 9 * * 3 ");
        fields.setCronTz("  ");

        assertThat(JobPayloadBuilder.build(fields, false).schedule())
                .isEqualTo(new CronSchedule.Cron("0 9 * * 3", null));
    }

    @Test
    void cronSchedule_requiresExpression() {
        fields.setScheduleKind(JobEditorFields.ScheduleKind.CRON);
        fields.setCronExpr(" ");

        assertThatThrownBy(() -> JobPayloadBuilder.build(fields, false))
                .isInstanceOf(JobValidationException.class)
                .hasMessage("Cron expression is required.");
    }

    // ------------------------------------------------------------------
    // Payload
    // ------------------------------------------------------------------

    @Test
    void systemEvent_requiresText() {
        fields.setSystemEventText("   ");

        assertThatThrownBy(() -> JobPayloadBuilder.build(fields, false))
                .hasMessage("System event text is required.");
    }

    @Test
    void blankName_isOmitted() {
        fields.setName("  ");

        assertThat(JobPayloadBuilder.build(fields, false).name()).isNull();
    }

    @Test
    void systemEvent_hasNoIsolation() {
        fields.setPostToMain(true);

        CronJobInput input = JobPayloadBuilder.build(fields, true);

        assertThat(input.payload()).isEqualTo(new CronPayload.SystemEvent("ping"));
        assertThat(input.isolation()).isNull();
    }

    @Test
    void agentTurn_requiresMessage() {
        fields.setPayloadKind(JobEditorFields.PayloadKind.AGENT_TURN);

        assertThatThrownBy(() -> JobPayloadBuilder.build(fields, false))
                .hasMessage("Agent message is required.");
    }

    @Test
    void agentTurn_withoutDelivery_omitsDeliveryFields() {
        fields.setPayloadKind(JobEditorFields.PayloadKind.AGENT_TURN);
        fields.setAgentMessage("summarize inbox");
        fields.setChannel("slack");
        fields.setTo("#ops");
        fields.setBestEffortDeliver(true);

        CronPayload.AgentTurn turn = (CronPayload.AgentTurn) JobPayloadBuilder.build(fields, false).payload();

        assertThat(turn.message()).isEqualTo("summarize inbox");
        assertThat(turn.deliver()).isFalse();
        assertThat(turn.channel()).isNull();
        assertThat(turn.to()).isNull();
        assertThat(turn.bestEffortDeliver()).isNull();
        assertThat(turn.thinking()).isNull();
        assertThat(turn.timeoutSeconds()).isNull();
    }

    @Test
    void agentTurn_withDelivery_includesChannelAndDefaultsIt() {
        fields.setPayloadKind(JobEditorFields.PayloadKind.AGENT_TURN);
        fields.setAgentMessage("summarize inbox");
        fields.setDeliver(true);
        fields.setChannel(" ");
        fields.setTo("");
        fields.setThinking("low");
        fields.setTimeoutSeconds(" 90 ");

        CronPayload.AgentTurn turn = (CronPayload.AgentTurn) JobPayloadBuilder.build(fields, false).payload();

        assertThat(turn.deliver()).isTrue();
        assertThat(turn.channel()).isEqualTo("last");
        assertThat(turn.to()).isNull();
        assertThat(turn.bestEffortDeliver()).isFalse();
        assertThat(turn.thinking()).isEqualTo("low");
        assertThat(turn.timeoutSeconds()).isEqualTo(90);
    }

    @Test
    void agentTurn_ignoresNonPositiveOrNonNumericTimeout() {
        fields.setPayloadKind(JobEditorFields.PayloadKind.AGENT_TURN);
        fields.setAgentMessage("go");

        fields.setTimeoutSeconds("0");
        assertThat(((CronPayload.AgentTurn) JobPayloadBuilder.build(fields, false).payload()).timeoutSeconds()).isNull();
        fields.setTimeoutSeconds("-5");
        assertThat(((CronPayload.AgentTurn) JobPayloadBuilder.build(fields, false).payload()).timeoutSeconds()).isNull();
        fields.setTimeoutSeconds("1.5");
        assertThat(((CronPayload.AgentTurn) JobPayloadBuilder.build(fields, false).payload()).timeoutSeconds()).isNull();
    }

    @Test
    void isolatedTarget_forcesAgentTurn() {
        fields.setSessionTarget(SessionTarget.ISOLATED);
        fields.setPayloadKind(JobEditorFields.PayloadKind.SYSTEM_EVENT);
        fields.setAgentMessage("run checks");

        CronJobInput input = JobPayloadBuilder.build(fields, false);

        assertThat(input.payload()).isInstanceOf(CronPayload.AgentTurn.class);
        assertThat(input.sessionTarget()).isEqualTo(SessionTarget.ISOLATED);
    }

    // ------------------------------------------------------------------
    // Isolation
    // ------------------------------------------------------------------

    @Test
    void postToMain_defaultsPrefix() {
        fields.setPayloadKind(JobEditorFields.PayloadKind.AGENT_TURN);
        fields.setAgentMessage("go");
        fields.setPostToMain(true);
        fields.setPostToMainPrefix("  ");

        assertThat(JobPayloadBuilder.build(fields, false).isolation())
                .isEqualTo(new CronIsolation(true, "Cron"));
    }

    @Test
    void postToMain_keepsEnteredPrefixAsTyped() {
        fields.setPayloadKind(JobEditorFields.PayloadKind.AGENT_TURN);
        fields.setAgentMessage("go");
        fields.setPostToMain(true);
        fields.setPostToMainPrefix(" Nightly ");

        assertThat(JobPayloadBuilder.build(fields, false).isolation())
                .isEqualTo(new CronIsolation(true, " Nightly "));
    }

    @Test
    void postToMainOff_isExplicitOnlyWhenEditing() {
        fields.setPayloadKind(JobEditorFields.PayloadKind.AGENT_TURN);
        fields.setAgentMessage("go");
        fields.setPostToMain(false);

        assertThat(JobPayloadBuilder.build(fields, false).isolation()).isNull();
        assertThat(JobPayloadBuilder.build(fields, true).isolation()).isEqualTo(CronIsolation.disabled());
    }
}
