package com.example.oncallrotation.scheduler;

import lombok.Builder;
import lombok.Value;

/**
 * What a trigger invokes, and the role it assumes to do so
 */
@Value
@Builder
public class TriggerTarget {
    String arn;
    String roleArn;
}
