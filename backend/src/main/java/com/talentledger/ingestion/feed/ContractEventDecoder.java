package com.talentledger.ingestion.feed;

import com.esaulpaugh.headlong.abi.Tuple;
import com.esaulpaugh.headlong.abi.TupleType;
import com.fasterxml.jackson.databind.JsonNode;
import com.talentledger.common.KeccakHash;
import com.talentledger.ingestion.feed.event.AgreementAccepted;
import com.talentledger.ingestion.feed.event.AgreementActivated;
import com.talentledger.ingestion.feed.event.AgreementCancelled;
import com.talentledger.ingestion.feed.event.AgreementCompleted;
import com.talentledger.ingestion.feed.event.AgreementCreated;
import com.talentledger.ingestion.feed.event.AgreementDisputed;
import com.talentledger.ingestion.feed.event.AgreementFinalized;
import com.talentledger.ingestion.feed.event.CredentialIssued;
import com.talentledger.ingestion.feed.event.MilestoneApproved;
import com.talentledger.ingestion.feed.event.MilestonePaid;
import com.talentledger.ingestion.feed.event.MilestoneSubmitted;
import com.talentledger.ingestion.feed.event.Notification;
import com.talentledger.ingestion.feed.event.NotificationOrigin;
import com.talentledger.ingestion.feed.event.NotificationType;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decodes raw eth_getLogs entries of the employment and credential contracts into {@link Notification}s.
 * Indexed parameters come from topics 1..3, the rest from ABI-encoded data.
 */
@Slf4j
@Component
public class ContractEventDecoder {

    public static final String CONTRACT_CREATED = "ContractCreated(uint256,address,address,uint256)";
    public static final String CONTRACT_ACCEPTED = "ContractAccepted(uint256,address)";
    public static final String CONTRACT_ACTIVATED = "ContractActivated(uint256)";
    public static final String MILESTONE_SUBMITTED = "MilestoneSubmitted(uint256,uint256)";
    public static final String MILESTONE_APPROVED = "MilestoneApproved(uint256,uint256)";
    public static final String MILESTONE_PAID = "MilestonePaid(uint256,uint256,uint256)";
    public static final String CONTRACT_DISPUTED = "ContractDisputed(uint256,address)";
    public static final String CONTRACT_COMPLETED = "ContractCompleted(uint256)";
    public static final String CONTRACT_FINALIZED = "ContractFinalized(uint256)";
    public static final String CONTRACT_CANCELLED = "ContractCancelled(uint256,string)";
    public static final String CREDENTIAL_ISSUED = "CredentialIssued(uint256,address,address,string)";

    private static final Pattern WORD = Pattern.compile("^0x[0-9a-f]{64}$");
    private static final TupleType<Tuple> UINT = TupleType.parse("(uint256)");
    private static final TupleType<Tuple> UINT_UINT = TupleType.parse("(uint256,uint256)");
    private static final TupleType<Tuple> STRING = TupleType.parse("(string)");

    private final Map<String, Registration> decodersByTopic = new LinkedHashMap<>();

    private record Registration(NotificationType type, LogDecoder decoder) {
    }

    @FunctionalInterface
    private interface LogDecoder {
        Notification decode(NotificationOrigin origin, List<String> topics, byte[] data);
    }

    public ContractEventDecoder() {
        register(CONTRACT_CREATED, NotificationType.AGREEMENT_CREATED, (o, t, d) ->
                new AgreementCreated(o, uint(t, 1), address(t, 2), address(t, 3), (BigInteger) UINT.decode(d).get(0)));
        register(CONTRACT_ACCEPTED, NotificationType.AGREEMENT_ACCEPTED, (o, t, d) ->
                new AgreementAccepted(o, uint(t, 1), address(t, 2)));
        register(CONTRACT_ACTIVATED, NotificationType.AGREEMENT_ACTIVATED, (o, t, d) ->
                new AgreementActivated(o, uint(t, 1)));
        register(MILESTONE_SUBMITTED, NotificationType.MILESTONE_SUBMITTED, (o, t, d) ->
                new MilestoneSubmitted(o, uint(t, 1), index(UINT.decode(d).get(0))));
        register(MILESTONE_APPROVED, NotificationType.MILESTONE_APPROVED, (o, t, d) ->
                new MilestoneApproved(o, uint(t, 1), index(UINT.decode(d).get(0))));
        register(MILESTONE_PAID, NotificationType.MILESTONE_PAID, (o, t, d) -> {
            Tuple values = UINT_UINT.decode(d);
            return new MilestonePaid(o, uint(t, 1), index(values.get(0)), (BigInteger) values.get(1));
        });
        register(CONTRACT_DISPUTED, NotificationType.AGREEMENT_DISPUTED, (o, t, d) ->
                new AgreementDisputed(o, uint(t, 1), address(t, 2)));
        register(CONTRACT_COMPLETED, NotificationType.AGREEMENT_COMPLETED, (o, t, d) ->
                new AgreementCompleted(o, uint(t, 1)));
        register(CONTRACT_FINALIZED, NotificationType.AGREEMENT_FINALIZED, (o, t, d) ->
                new AgreementFinalized(o, uint(t, 1)));
        register(CONTRACT_CANCELLED, NotificationType.AGREEMENT_CANCELLED, (o, t, d) ->
                new AgreementCancelled(o, uint(t, 1), (String) STRING.decode(d).get(0)));
        register(CREDENTIAL_ISSUED, NotificationType.CREDENTIAL_ISSUED, (o, t, d) ->
                new CredentialIssued(o, uint(t, 1), address(t, 2), address(t, 3), (String) STRING.decode(d).get(0)));
    }

    private void register(String signature, NotificationType type, LogDecoder decoder) {
        decodersByTopic.put(KeccakHash.hexDigest(signature), new Registration(type, decoder));
    }

    /** topic0 values of every supported event, for the eth_getLogs filter. */
    public List<String> topics() {
        return List.copyOf(decodersByTopic.keySet());
    }

    /**
     * @return empty for removed logs or unknown topics
     * @throws MalformedLogException when the topic is supported but the entry cannot be decoded
     */
    public Optional<Notification> decode(JsonNode logEntry, Instant blockTimestamp) {
        if (logEntry.path("removed").asBoolean(false)) {
            return Optional.empty();
        }
        JsonNode topicsNode = logEntry.path("topics");
        if (!topicsNode.isArray() || topicsNode.isEmpty()) {
            return Optional.empty();
        }
        List<String> topics = new ArrayList<>(topicsNode.size());
        topicsNode.forEach(t -> topics.add(t.asText().toLowerCase()));
        Registration registration = decodersByTopic.get(topics.get(0));
        if (registration == null) {
            log.debug("Ignoring log with unknown topic {}", topics.get(0));
            return Optional.empty();
        }
        try {
            NotificationOrigin origin = new NotificationOrigin(
                    logEntry.path("transactionHash").asText().toLowerCase(),
                    hexToLong(logEntry.path("blockNumber").asText()),
                    (int) hexToLong(logEntry.path("logIndex").asText()),
                    blockTimestamp);
            return Optional.of(registration.decoder().decode(origin, topics,
                    hexToBytes(logEntry.path("data").asText("0x"))));
        } catch (RuntimeException e) {
            throw new MalformedLogException(malformed(logEntry, topics, registration.type(), blockTimestamp, e), e);
        }
    }

    private static MalformedLog malformed(JsonNode logEntry, List<String> topics, NotificationType type,
                                          Instant blockTimestamp, RuntimeException cause) {
        Long subjectId = subjectId(topics);
        String partitionKey;
        if (subjectId == null) {
            partitionKey = MalformedLog.UNKNOWN_PARTITION;
        } else if (type == NotificationType.CREDENTIAL_ISSUED) {
            partitionKey = Notification.credentialPartition(subjectId);
        } else {
            partitionKey = Notification.agreementPartition(subjectId);
        }
        return new MalformedLog(
                logEntry.path("transactionHash").asText("").toLowerCase(),
                hexOrDefault(logEntry.path("blockNumber").asText(null), 0L),
                (int) hexOrDefault(logEntry.path("logIndex").asText(null), -1L),
                blockTimestamp,
                type,
                partitionKey,
                type == NotificationType.CREDENTIAL_ISSUED ? null : subjectId,
                logEntry.toString(),
                String.valueOf(cause.getMessage()));
    }

    /** topic1 as a long, or null when it is missing or not a 32-byte word that fits. */
    private static Long subjectId(List<String> topics) {
        if (topics.size() < 2 || !WORD.matcher(topics.get(1)).matches()) {
            return null;
        }
        BigInteger id = new BigInteger(topics.get(1).substring(2), 16);
        return id.bitLength() < Long.SIZE ? id.longValue() : null;
    }

    private static long hexOrDefault(String hex, long fallback) {
        try {
            return hexToLong(hex);
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    public static long hexToLong(String hex) {
        if (hex == null || !hex.startsWith("0x")) {
            throw new IllegalArgumentException("Not a hex quantity: " + hex);
        }
        return Long.parseLong(hex.substring(2), 16);
    }

    private static byte[] hexToBytes(String hex) {
        String body = hex.startsWith("0x") ? hex.substring(2) : hex;
        return body.isEmpty() ? new byte[0] : Hex.decode(body);
    }

    private static long uint(List<String> topics, int i) {
        return new BigInteger(1, hexToBytes(topic(topics, i))).longValueExact();
    }

    private static String address(List<String> topics, int i) {
        String topic = topic(topics, i);
        return "0x" + topic.substring(topic.length() - 40);
    }

    private static String topic(List<String> topics, int i) {
        if (topics.size() <= i) {
            throw new IllegalArgumentException("Missing indexed topic " + i);
        }
        return topics.get(i);
    }

    private static int index(Object value) {
        return ((BigInteger) value).intValueExact();
    }
}
