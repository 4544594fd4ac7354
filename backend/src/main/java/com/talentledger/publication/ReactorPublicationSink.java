package com.talentledger.publication;

import com.talentledger.domain.ActivityRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publishes to in-process Reactor channels served over SSE. Failures are logged and swallowed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReactorPublicationSink implements PublicationSink {

    private final PublicationEventMapper mapper;
    private final PartyChannelRegistry registry;

    @Override
    public void publish(ActivityRecord record) {
        try {
            int delivered = 0;
            for (PublicationEvent event : mapper.map(record)) {
                if (registry.emit(event)) {
                    delivered++;
                }
            }
            log.debug("Published {} to {} live channel(s)", record.getIdempotencyKey(), delivered);
        } catch (RuntimeException e) {
            log.warn("Publication of {} failed: {}", record.getIdempotencyKey(), e.getMessage());
        }
    }
}
