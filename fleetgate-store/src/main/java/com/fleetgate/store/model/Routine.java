package com.fleetgate.store.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Routine {
    public static final String TRIGGER_ONESHOT = "oneshot";
    public static final String TRIGGER_CRON = "cron";

    private String id;
    private String name;
    private String agentId;
    private String triggerKind;
    private boolean enabled;
    private Long nextRunAt;
    private Long lastFiredAt;
    private String lastStatus;
}
