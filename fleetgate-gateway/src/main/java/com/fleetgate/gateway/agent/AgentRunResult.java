package com.fleetgate.gateway.agent;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunResult {
    /** Runner-side job id. */
    private String job;
    private String finalResponse;
    /** The run stopped at its iteration limit. */
    private boolean hitLimit;
}
