package com.example.oncallrotation.scheduler;

import lombok.Builder;
import lombok.Value;

/**
 * A wake-up trigger as held by the external scheduler
 */
@Value
@Builder(toBuilder = true)
public class ExternalTrigger {

    String name;

    /**
     * Epoch seconds recovered from the name, null when the name does not carry one
     */
    Long nextTimestampUtc;

    String expression;
    String timezone;
    String targetArn;
    String description;
}
