package io.github.drompincen.cronsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What a job does when it fires.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CronPayload.SystemEvent.class, name = "systemEvent"),
        @JsonSubTypes.Type(value = CronPayload.AgentTurn.class, name = "agentTurn")
})
public interface CronPayload {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SystemEvent(String text) implements CronPayload {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AgentTurn(
            String message,
            String thinking,
            Integer timeoutSeconds,
            Boolean deliver,
            String channel,
            String to,
            Boolean bestEffortDeliver
    ) implements CronPayload {
        public static AgentTurn of(String message) {
            return new AgentTurn(message, null, null, null, null, null, null);
        }
    }
}
