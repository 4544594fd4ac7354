package com.talentledger.ingestion.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.talentledger.config.AsyncConfig;
import com.talentledger.ingestion.config.FeedProperties;
import com.talentledger.ingestion.config.LedgerProperties;
import com.talentledger.ingestion.feed.event.Notification;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.ingestion.ledger.UnreachableSourceException;
import com.talentledger.ingestion.ledger.rpc.JsonRpcExecutor;
import com.talentledger.ingestion.ledger.rpc.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link NotificationFeed} over eth_getLogs. Ranges are split into maxBlockRange chunks; live mode polls the
 * confirmed head on the feed executor. Logs that fail to decode are handed to the {@link MalformedLogHandler}
 * before the range is returned, so they are never skipped silently.
 */
@Slf4j
@Component
public class LogNotificationFeed implements NotificationFeed {

    private static final Comparator<Notification> LEDGER_ORDER = Comparator
            .comparingLong(Notification::sequencePosition)
            .thenComparingInt(n -> n.origin().logIndex());

    private final JsonRpcExecutor rpc;
    private final LedgerClient ledgerClient;
    private final ContractEventDecoder decoder;
    private final BlockTimestampResolver timestampResolver;
    private final MalformedLogHandler malformedLogHandler;
    private final FeedProperties feedProperties;
    private final LedgerProperties ledgerProperties;
    private final Executor feedExecutor;

    public LogNotificationFeed(
            JsonRpcExecutor rpc,
            LedgerClient ledgerClient,
            ContractEventDecoder decoder,
            BlockTimestampResolver timestampResolver,
            MalformedLogHandler malformedLogHandler,
            FeedProperties feedProperties,
            LedgerProperties ledgerProperties,
            @Qualifier(AsyncConfig.FEED_EXECUTOR) Executor feedExecutor
    ) {
        this.rpc = rpc;
        this.ledgerClient = ledgerClient;
        this.decoder = decoder;
        this.timestampResolver = timestampResolver;
        this.malformedLogHandler = malformedLogHandler;
        this.feedProperties = feedProperties;
        this.ledgerProperties = ledgerProperties;
        this.feedExecutor = feedExecutor;
    }

    @Override
    public List<Notification> listNotifications(long fromBlock, long toBlock) {
        if (fromBlock > toBlock) {
            return List.of();
        }
        int range = Math.max(1, feedProperties.getMaxBlockRange());
        List<Notification> all = new ArrayList<>();
        long start = Math.max(0L, fromBlock);
        while (start <= toBlock) {
            long end = Math.min(start + range - 1, toBlock);
            all.addAll(fetchChunk(start, end));
            start = end + 1;
        }
        all.sort(LEDGER_ORDER);
        return all;
    }

    @Override
    public long latestConfirmedBlock() {
        return Math.max(0L, ledgerClient.latestBlock() - feedProperties.getConfirmations());
    }

    @Override
    public FeedSubscription subscribe(long fromBlockExclusive, FeedListener listener) {
        PollingSubscription subscription = new PollingSubscription(fromBlockExclusive, listener);
        feedExecutor.execute(subscription::run);
        return subscription;
    }

    private List<Notification> fetchChunk(long fromBlock, long toBlock) {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("fromBlock", "0x" + Long.toHexString(fromBlock));
        filter.put("toBlock", "0x" + Long.toHexString(toBlock));
        filter.put("address", contractAddresses());
        filter.put("topics", List.of(decoder.topics()));
        JsonNode logs;
        try {
            logs = rpc.execute("eth_getLogs", List.of(filter));
        } catch (RpcException e) {
            throw new UnreachableSourceException(
                    "eth_getLogs [" + fromBlock + "-" + toBlock + "] failed: " + e.getMessage(), e);
        }
        if (!logs.isArray()) {
            throw new UnreachableSourceException("eth_getLogs returned a non-array result");
        }
        Map<Long, Instant> timestamps = new HashMap<>();
        List<Notification> result = new ArrayList<>(logs.size());
        for (JsonNode entry : logs) {
            String blockHex = entry.path("blockNumber").asText(null);
            if (blockHex == null) {
                continue;
            }
            Instant ts = timestamps.computeIfAbsent(ContractEventDecoder.hexToLong(blockHex), this::blockTimestamp);
            try {
                decoder.decode(entry, ts).ifPresent(result::add);
            } catch (MalformedLogException e) {
                log.warn("{}; handing to quarantine", e.getMessage());
                malformedLogHandler.onMalformedLog(e.getMalformedLog());
            }
        }
        log.debug("eth_getLogs [{}-{}]: {} logs, {} notifications", fromBlock, toBlock, logs.size(), result.size());
        return result;
    }

    private Instant blockTimestamp(long blockNumber) {
        try {
            return timestampResolver.getBlockTimestamp(blockNumber);
        } catch (RpcException e) {
            throw new UnreachableSourceException("Block timestamp for " + blockNumber + " unavailable", e);
        }
    }

    private List<String> contractAddresses() {
        List<String> addresses = new ArrayList<>(2);
        if (ledgerProperties.getEmploymentContract() != null) {
            addresses.add(ledgerProperties.getEmploymentContract());
        }
        if (ledgerProperties.getCredentialContract() != null) {
            addresses.add(ledgerProperties.getCredentialContract());
        }
        return addresses;
    }

    private final class PollingSubscription implements FeedSubscription {

        private final FeedListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private long cursor;

        private PollingSubscription(long fromBlockExclusive, FeedListener listener) {
            this.cursor = fromBlockExclusive;
            this.listener = Objects.requireNonNull(listener);
        }

        void run() {
            log.info("Live feed subscribed after block {}", cursor);
            try {
                while (active.get()) {
                    long head = latestConfirmedBlock();
                    while (active.get() && head > cursor) {
                        long end = Math.min(cursor + Math.max(1, feedProperties.getMaxBlockRange()), head);
                        List<Notification> batch = listNotifications(cursor + 1, end);
                        listener.onNotifications(batch, end);
                        cursor = end;
                    }
                    Thread.sleep(feedProperties.getPollIntervalMs());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                active.set(false);
            } catch (Exception e) {
                if (active.compareAndSet(true, false)) {
                    log.warn("Live feed stopped after block {}: {}", cursor, e.getMessage());
                    listener.onError(e);
                }
            }
        }

        @Override
        public void cancel() {
            active.set(false);
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
