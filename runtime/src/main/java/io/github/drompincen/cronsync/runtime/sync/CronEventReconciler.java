package io.github.drompincen.cronsync.runtime.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.cronsync.protocol.event.CronEvent;
import io.github.drompincen.cronsync.protocol.event.PushMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Maps gateway push messages onto debounced refreshes. Every cron event, and every sequence
 * gap, schedules a full job-list refresh; a {@code finished} event for the selected job also
 * refreshes its run log.
 */
public class CronEventReconciler {

    private static final Logger log = LoggerFactory.getLogger(CronEventReconciler.class);

    private final ObjectMapper objectMapper;
    private final DebouncedTrigger jobsTrigger;
    private final DebouncedTrigger runsTrigger;
    private final Supplier<String> selectedJobId;
    private final CronSyncSettings settings;

    public CronEventReconciler(ObjectMapper objectMapper,
                               DebouncedTrigger jobsTrigger,
                               DebouncedTrigger runsTrigger,
                               Supplier<String> selectedJobId,
                               CronSyncSettings settings) {
        this.objectMapper = objectMapper;
        this.jobsTrigger = jobsTrigger;
        this.runsTrigger = runsTrigger;
        this.selectedJobId = selectedJobId;
        this.settings = settings;
    }

    public void handle(PushMessage message) {
        if (message instanceof PushMessage.SequenceGap gap) {
            log.info("Push sequence gap (expected seq {}, received {}); scheduling full resync",
                    gap.expected(), gap.received());
            jobsTrigger.schedule(settings.gapDebounce());
        } else if (message instanceof PushMessage.GatewayEvent event
                && CronEvent.EVENT_NAME.equals(event.event())) {
            decode(event.payload()).ifPresent(this::onCronEvent);
        }
    }

    private void onCronEvent(CronEvent event) {
        jobsTrigger.schedule(settings.jobsDebounce());
        String selected = selectedJobId.get();
        if (event.isFinished() && selected != null && selected.equals(event.jobId())) {
            runsTrigger.schedule(settings.runsDebounce());
        }
    }

    private Optional<CronEvent> decode(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            log.debug("Dropping cron event without payload");
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.treeToValue(payload, CronEvent.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            // the next poll or a later well-formed event resynchronizes
            log.debug("Dropping malformed cron event: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
