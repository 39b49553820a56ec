package io.cronkit.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What a job does when it fires.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ShellPayload.class, name = "SHELL"),
        @JsonSubTypes.Type(value = AgentPayload.class, name = "AGENT")
})
public sealed interface JobPayload permits ShellPayload, AgentPayload {

    @JsonIgnore
    JobType kind();

    /**
     * Shell command or agent prompt, for display and logging.
     */
    @JsonIgnore
    String text();
}
