package com.example.oncallrotation.scheduler;

import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * External service holding one-shot wake-up triggers.
 * <p>
 * Implementations raise {@link com.example.oncallrotation.exception.ReconciliationException} when
 * the service cannot be reached or refuses a change.
 */
public interface TriggerScheduler {

    /**
     * Names of all triggers starting with {@code namePrefix}
     */
    List<String> listTriggers(String namePrefix);

    /**
     * @return empty if the trigger disappeared since it was listed
     */
    Optional<ExternalTrigger> getTriggerDetail(String name);

    void createOneShotTrigger(String name, String expression, ZoneId zone, TriggerTarget target, String description);

    /**
     * Deleting a trigger that no longer exists is not an error.
     */
    void deleteTrigger(String name);
}
