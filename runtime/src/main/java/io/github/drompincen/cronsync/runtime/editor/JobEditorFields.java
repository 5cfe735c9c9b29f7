package io.github.drompincen.cronsync.runtime.editor;

import io.github.drompincen.cronsync.protocol.api.CronIsolation;
import io.github.drompincen.cronsync.protocol.api.CronJob;
import io.github.drompincen.cronsync.protocol.api.CronPayload;
import io.github.drompincen.cronsync.protocol.api.CronSchedule;
import io.github.drompincen.cronsync.protocol.api.SessionTarget;
import io.github.drompincen.cronsync.protocol.api.WakeMode;
import io.github.drompincen.cronsync.runtime.schedule.ScheduleCodec;

/**
 * Raw, editable state of the job form. Values are kept as typed by the user; nothing here
 * is validated until {@link JobPayloadBuilder} turns it into a request body.
 */
public class JobEditorFields {

    public enum ScheduleKind { AT, EVERY, CRON }

    public enum PayloadKind { SYSTEM_EVENT, AGENT_TURN }

    static final String DEFAULT_CHANNEL = "last";
    static final String DEFAULT_POST_PREFIX = "Cron";
    private static final long DEFAULT_AT_OFFSET_MS = 5 * 60_000;

    private String name = "";
    private boolean enabled = true;
    private SessionTarget sessionTarget = SessionTarget.MAIN;
    private WakeMode wakeMode = WakeMode.NEXT_HEARTBEAT;

    private ScheduleKind scheduleKind = ScheduleKind.EVERY;
    private long atMs = System.currentTimeMillis() + DEFAULT_AT_OFFSET_MS;
    private String everyText = "1h";
    private String cronExpr = "0 9 * * 3";
    private String cronTz = "";

    private PayloadKind payloadKind = PayloadKind.SYSTEM_EVENT;
    private String systemEventText = "";
    private String agentMessage = "";
    private String thinking = "";
    private String timeoutSeconds = "";
    private boolean deliver;
    private String channel = DEFAULT_CHANNEL;
    private String to = "";
    private boolean bestEffortDeliver;

    private boolean postToMain;
    private String postToMainPrefix = DEFAULT_POST_PREFIX;

    /**
     * Fills a form from an existing job so it can be edited and saved back.
     */
    public static JobEditorFields fromJob(CronJob job) {
        JobEditorFields f = new JobEditorFields();
        f.name = job.name() != null ? job.name() : "";
        f.enabled = job.enabled();
        if (job.sessionTarget() != null) f.sessionTarget = job.sessionTarget();
        if (job.wakeMode() != null) f.wakeMode = job.wakeMode();

        if (job.schedule() instanceof CronSchedule.At at) {
            f.scheduleKind = ScheduleKind.AT;
            f.atMs = at.atMs();
        } else if (job.schedule() instanceof CronSchedule.Every every) {
            f.scheduleKind = ScheduleKind.EVERY;
            f.everyText = ScheduleCodec.formatDurationMs(every.everyMs());
        } else if (job.schedule() instanceof CronSchedule.Cron cron) {
            f.scheduleKind = ScheduleKind.CRON;
            f.cronExpr = cron.expr() != null ? cron.expr() : "";
            f.cronTz = cron.tz() != null ? cron.tz() : "";
        }

        if (job.payload() instanceof CronPayload.SystemEvent event) {
            f.payloadKind = PayloadKind.SYSTEM_EVENT;
            f.systemEventText = event.text() != null ? event.text() : "";
        } else if (job.payload() instanceof CronPayload.AgentTurn turn) {
            f.payloadKind = PayloadKind.AGENT_TURN;
            f.agentMessage = turn.message() != null ? turn.message() : "";
            f.thinking = turn.thinking() != null ? turn.thinking() : "";
            f.timeoutSeconds = turn.timeoutSeconds() != null ? String.valueOf(turn.timeoutSeconds()) : "";
            f.deliver = Boolean.TRUE.equals(turn.deliver());
            f.channel = turn.channel() != null ? turn.channel() : DEFAULT_CHANNEL;
            f.to = turn.to() != null ? turn.to() : "";
            f.bestEffortDeliver = Boolean.TRUE.equals(turn.bestEffortDeliver());
        }

        CronIsolation isolation = job.isolation();
        f.postToMain = isolation != null && Boolean.TRUE.equals(isolation.postToMain());
        f.postToMainPrefix = isolation != null && isolation.postToMainPrefix() != null
                ? isolation.postToMainPrefix() : DEFAULT_POST_PREFIX;
        return f;
    }

    /** Isolated jobs always run an agent turn, whatever kind is selected. */
    public PayloadKind effectivePayloadKind() {
        return sessionTarget == SessionTarget.ISOLATED ? PayloadKind.AGENT_TURN : payloadKind;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public SessionTarget getSessionTarget() { return sessionTarget; }
    public void setSessionTarget(SessionTarget sessionTarget) { this.sessionTarget = sessionTarget; }

    public WakeMode getWakeMode() { return wakeMode; }
    public void setWakeMode(WakeMode wakeMode) { this.wakeMode = wakeMode; }

    public ScheduleKind getScheduleKind() { return scheduleKind; }
    public void setScheduleKind(ScheduleKind scheduleKind) { this.scheduleKind = scheduleKind; }

    public long getAtMs() { return atMs; }
    public void setAtMs(long atMs) { this.atMs = atMs; }

    public String getEveryText() { return everyText; }
    public void setEveryText(String everyText) { this.everyText = everyText; }

    public String getCronExpr() { return cronExpr; }
    public void setCronExpr(String cronExpr) { this.cronExpr = cronExpr; }

    public String getCronTz() { return cronTz; }
    public void setCronTz(String cronTz) { this.cronTz = cronTz; }

    public PayloadKind getPayloadKind() { return payloadKind; }
    public void setPayloadKind(PayloadKind payloadKind) { this.payloadKind = payloadKind; }

    public String getSystemEventText() { return systemEventText; }
    public void setSystemEventText(String systemEventText) { this.systemEventText = systemEventText; }

    public String getAgentMessage() { return agentMessage; }
    public void setAgentMessage(String agentMessage) { this.agentMessage = agentMessage; }

    public String getThinking() { return thinking; }
    public void setThinking(String thinking) { this.thinking = thinking; }

    public String getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(String timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

    public boolean isDeliver() { return deliver; }
    public void setDeliver(boolean deliver) { this.deliver = deliver; }

    public String getChannel() { return channel; }
    public void setChannel(String channel) { this.channel = channel; }

    public String getTo() { return to; }
    public void setTo(String to) { this.to = to; }

    public boolean isBestEffortDeliver() { return bestEffortDeliver; }
    public void setBestEffortDeliver(boolean bestEffortDeliver) { this.bestEffortDeliver = bestEffortDeliver; }

    public boolean isPostToMain() { return postToMain; }
    public void setPostToMain(boolean postToMain) { this.postToMain = postToMain; }

    public String getPostToMainPrefix() { return postToMainPrefix; }
    public void setPostToMainPrefix(String postToMainPrefix) { this.postToMainPrefix = postToMainPrefix; }
}
