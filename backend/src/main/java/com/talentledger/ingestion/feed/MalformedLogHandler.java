package com.talentledger.ingestion.feed;

/**
 * Durable destination for logs the decoder rejects. Must persist before returning: the feed moves past the log
 * once this call succeeds.
 */
public interface MalformedLogHandler {

    void onMalformedLog(MalformedLog malformedLog);
}
