package com.fleetgate.gateway.agent;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.function.Consumer;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunOptions {
    /** {@code final}: only the final response is posted back. */
    @Builder.Default
    private String responseMode = "final";
    /** Coalesced input for this run. */
    private String input;
    private String sessionKey;
    private String dispatchId;
    /** Progress callback; may be invoked from the runner's thread. */
    private Consumer<AgentEvent> onEvent;
    /** Messages that arrive for the lane while this run is active. */
    private SteeringInbox steering;
}
