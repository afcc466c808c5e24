package com.fleetgate.channel.adapter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostOptions {
    /** The run stopped at its iteration limit; handlers may append a notice. */
    private boolean hitLimit;
    /** Stable per dispatch so a retried post can be recognised by the provider. */
    private String idempotencyKey;
}
