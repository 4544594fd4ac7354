package com.talentledger.ingestion.ledger;

import com.esaulpaugh.headlong.abi.Function;
import com.fasterxml.jackson.databind.JsonNode;
import com.talentledger.common.AddressFormat;
import com.talentledger.domain.PartyRole;
import com.talentledger.ingestion.config.LedgerProperties;
import com.talentledger.ingestion.ledger.rpc.JsonRpcExecutor;
import com.talentledger.ingestion.ledger.rpc.RpcException;
import com.talentledger.ingestion.ledger.rpc.RpcRevertException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link LedgerClient} over eth_call. Reverts and zero ids map to {@link InvalidReferenceException}; every other
 * RPC failure maps to {@link UnreachableSourceException} once retries are spent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonRpcLedgerClient implements LedgerClient {

    private static final String LATEST = "latest";

    private final JsonRpcExecutor rpc;
    private final LedgerProperties properties;

    /**
     * Reads the header and every milestone at one block, so a transaction landing between the calls cannot produce
     * a snapshot that never existed on the ledger.
     */
    @Override
    public LedgerAgreement fetchAgreement(long agreementId) {
        String blockTag = blockTag(latestBlock());
        byte[] data = ethCall(properties.getEmploymentContract(), EmploymentContractAbi.encodeGetContract(agreementId),
                blockTag, "agreement " + agreementId);
        EmploymentContractAbi.AgreementHeader header = decode(() -> EmploymentContractAbi.decodeContract(data),
                "agreement " + agreementId);
        if (header.id() == 0) {
            throw new InvalidReferenceException("Agreement " + agreementId + " does not exist");
        }
        List<LedgerMilestone> milestones = new ArrayList<>(header.milestoneCount());
        for (int i = 0; i < header.milestoneCount(); i++) {
            milestones.add(fetchMilestone(agreementId, i, blockTag));
        }
        log.debug("Fetched agreement {} with {} milestone(s) at block {}", agreementId, milestones.size(), blockTag);
        return header.withMilestones(milestones);
    }

    @Override
    public LedgerMilestone fetchMilestone(long agreementId, int index) {
        return fetchMilestone(agreementId, index, LATEST);
    }

    @Override
    public Set<Long> fetchPartyAgreements(String address, PartyRole role) {
        String normalized = AddressFormat.normalize(address);
        Set<Long> ids = new LinkedHashSet<>();
        if (role == null || role == PartyRole.COMPANY) {
            ids.addAll(partyIds(EmploymentContractAbi.GET_COMPANY_CONTRACTS, normalized));
        }
        if (role == null || role == PartyRole.TALENT) {
            ids.addAll(partyIds(EmploymentContractAbi.GET_TALENT_CONTRACTS, normalized));
        }
        return Collections.unmodifiableSet(ids);
    }

    @Override
    public LedgerCredential fetchCredential(long tokenId) {
        String what = "credential " + tokenId;
        byte[] data = ethCall(properties.getCredentialContract(), EmploymentContractAbi.encodeGetCredential(tokenId),
                LATEST, what);
        LedgerCredential credential = decode(() -> EmploymentContractAbi.decodeCredential(tokenId, data), what);
        if (AddressFormat.ZERO_ADDRESS.equals(credential.recipient())) {
            throw new InvalidReferenceException("Credential " + tokenId + " does not exist");
        }
        return credential;
    }

    @Override
    public long latestBlock() {
        try {
            String hex = rpc.execute("eth_blockNumber", List.of()).asText(null);
            if (hex == null || !hex.startsWith("0x")) {
                throw new UnreachableSourceException("eth_blockNumber invalid result: " + hex);
            }
            return Long.parseLong(hex.substring(2), 16);
        } catch (RpcException e) {
            throw new UnreachableSourceException("Ledger unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean verifySignedMessage(String message, String signature, String claimedAddress) {
        return SignatureVerifier.verify(message, signature, claimedAddress);
    }

    private LedgerMilestone fetchMilestone(long agreementId, int index, String blockTag) {
        if (index < 0) {
            throw new InvalidReferenceException("Milestone index " + index + " is negative");
        }
        String what = "milestone " + agreementId + "/" + index;
        byte[] data = ethCall(properties.getEmploymentContract(),
                EmploymentContractAbi.encodeGetMilestone(agreementId, index), blockTag, what);
        return decode(() -> EmploymentContractAbi.decodeMilestone(data), what);
    }

    private Set<Long> partyIds(Function function, String address) {
        byte[] data = ethCall(properties.getEmploymentContract(),
                EmploymentContractAbi.encodeGetPartyContracts(function, address), LATEST,
                function.getName() + " " + address);
        return decode(() -> EmploymentContractAbi.decodeIdList(function, data), function.getName());
    }

    private static String blockTag(long block) {
        return "0x" + Long.toHexString(block);
    }

    private byte[] ethCall(String contract, byte[] callData, String blockTag, String what) {
        Map<String, String> tx = Map.of("to", contract, "data", "0x" + Hex.toHexString(callData));
        JsonNode result;
        try {
            result = rpc.execute("eth_call", List.of(tx, blockTag));
        } catch (RpcRevertException e) {
            throw new InvalidReferenceException("Ledger rejected lookup of " + what, e);
        } catch (RpcException e) {
            throw new UnreachableSourceException("Ledger unreachable while fetching " + what + ": " + e.getMessage(), e);
        }
        String hex = result.asText("");
        if (hex.length() <= 2) {
            throw new InvalidReferenceException("Empty return for " + what);
        }
        return Hex.decode(hex.startsWith("0x") ? hex.substring(2) : hex);
    }

    private <T> T decode(Supplier<T> decoder, String what) {
        try {
            return decoder.get();
        } catch (IllegalArgumentException | ArithmeticException | ClassCastException e) {
            log.warn("Undecodable ledger return for {}: {}", what, e.getMessage());
            throw new InvalidReferenceException("Undecodable ledger return for " + what, e);
        }
    }
}
