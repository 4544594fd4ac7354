package com.talentledger.publication;

import com.talentledger.domain.ActivityRecord;

/**
 * Best-effort fan-out of committed activity. Implementations must not block and must not throw.
 */
public interface PublicationSink {

    void publish(ActivityRecord record);
}
