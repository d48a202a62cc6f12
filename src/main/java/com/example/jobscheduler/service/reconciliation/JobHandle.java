package com.example.jobscheduler.service.reconciliation;

import com.example.jobscheduler.domain.model.ScheduledJobRecord;
import lombok.Value;

/**
 * A recurring job the controller has registered with the engine,
 * together with the snapshot it was last reconciled against.
 */
@Value
class JobHandle {

    String id;
    ScheduledJobRecord snapshot;
}
