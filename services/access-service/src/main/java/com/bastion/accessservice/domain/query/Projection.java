package com.bastion.accessservice.domain.query;

import com.bastion.eventmodel.EventEnvelope;

/**
 * A read view fed by the {@link QueryProjector}. Events it has no use for are ignored. The
 * projector hands each event to a view at most once, also when another view failed on it.
 */
public interface Projection {

    void apply(EventEnvelope<?> event);
}
