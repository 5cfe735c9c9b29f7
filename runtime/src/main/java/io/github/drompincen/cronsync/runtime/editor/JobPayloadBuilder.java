package io.github.drompincen.cronsync.runtime.editor;

import io.github.drompincen.cronsync.protocol.api.CronIsolation;
import io.github.drompincen.cronsync.protocol.api.CronJobInput;
import io.github.drompincen.cronsync.protocol.api.CronPayload;
import io.github.drompincen.cronsync.protocol.api.CronSchedule;
import io.github.drompincen.cronsync.runtime.schedule.ScheduleCodec;

import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Turns {@link JobEditorFields} into the body of a {@code cron.add} / {@code cron.update}
 * request, or rejects it with a {@link JobValidationException}.
 */
public final class JobPayloadBuilder {

    private static final Pattern TIMEOUT_SECONDS = Pattern.compile("\\d{1,9}");

    private JobPayloadBuilder() {}

    /**
     * @param editingExisting true when the body patches an existing job; an explicit
     *                        {@code postToMain: false} is then sent so the gateway can clear a
     *                        previously configured isolation
     */
    public static CronJobInput build(JobEditorFields fields, boolean editingExisting) {
        CronSchedule schedule = buildSchedule(fields);
        CronPayload payload = fields.effectivePayloadKind() == JobEditorFields.PayloadKind.AGENT_TURN
                ? buildAgentTurn(fields)
                : buildSystemEvent(fields);

        String name = trim(fields.getName());
        return new CronJobInput(
                name.isEmpty() ? null : name,
                fields.isEnabled(),
                schedule,
                fields.getSessionTarget(),
                fields.getWakeMode(),
                payload,
                buildIsolation(fields, payload, editingExisting));
    }

    static CronSchedule buildSchedule(JobEditorFields fields) {
        return switch (fields.getScheduleKind()) {
            case AT -> new CronSchedule.At(fields.getAtMs());
            case EVERY -> {
                OptionalLong everyMs = ScheduleCodec.parseDurationMs(fields.getEveryText());
                if (everyMs.isEmpty()) {
                    throw new JobValidationException("Invalid every duration (use 10m, 1h, 1d).");
                }
                yield CronSchedule.Every.of(everyMs.getAsLong());
            }
            case CRON -> {
                String expr = trim(fields.getCronExpr());
                if (expr.isEmpty()) {
                    throw new JobValidationException("Cron expression is required.");
                }
                String tz = trim(fields.getCronTz());
                yield new CronSchedule.Cron(expr, tz.isEmpty() ? null : tz);
            }
        };
    }

    private static CronPayload.SystemEvent buildSystemEvent(JobEditorFields fields) {
        String text = trim(fields.getSystemEventText());
        if (text.isEmpty()) {
            throw new JobValidationException("System event text is required.");
        }
        return new CronPayload.SystemEvent(text);
    }

    private static CronPayload.AgentTurn buildAgentTurn(JobEditorFields fields) {
        String message = trim(fields.getAgentMessage());
        if (message.isEmpty()) {
            throw new JobValidationException("Agent message is required.");
        }
        String thinking = trim(fields.getThinking());
        boolean deliver = fields.isDeliver();

        String channel = null;
        String to = null;
        Boolean bestEffort = null;
        if (deliver) {
            String c = trim(fields.getChannel());
            channel = c.isEmpty() ? JobEditorFields.DEFAULT_CHANNEL : c;
            String t = trim(fields.getTo());
            to = t.isEmpty() ? null : t;
            bestEffort = fields.isBestEffortDeliver();
        }

        return new CronPayload.AgentTurn(
                message,
                thinking.isEmpty() ? null : thinking,
                parseTimeoutSeconds(fields.getTimeoutSeconds()),
                deliver,
                channel,
                to,
                bestEffort);
    }

    private static CronIsolation buildIsolation(JobEditorFields fields, CronPayload payload,
                                                boolean editingExisting) {
        if (!(payload instanceof CronPayload.AgentTurn)) return null;
        if (fields.isPostToMain()) {
            // a non-blank prefix is sent as typed
            String prefix = fields.getPostToMainPrefix();
            return new CronIsolation(true, trim(prefix).isEmpty() ? JobEditorFields.DEFAULT_POST_PREFIX : prefix);
        }
        return editingExisting ? CronIsolation.disabled() : null;
    }

    private static Integer parseTimeoutSeconds(String raw) {
        String value = trim(raw);
        // anything that is not a positive integer is treated as unset
        if (!TIMEOUT_SECONDS.matcher(value).matches()) return null;
        int n = Integer.parseInt(value);
        return n > 0 ? n : null;
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
