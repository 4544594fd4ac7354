package com.talentledger.ingestion.ledger;

import com.esaulpaugh.headlong.abi.Address;
import com.esaulpaugh.headlong.abi.Tuple;
import com.esaulpaugh.headlong.abi.TupleType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentledger.common.RetryPolicy;
import com.talentledger.domain.AgreementStatus;
import com.talentledger.domain.MilestoneStatus;
import com.talentledger.domain.PartyRole;
import com.talentledger.ingestion.config.LedgerProperties;
import com.talentledger.ingestion.ledger.rpc.EvmRpcClient;
import com.talentledger.ingestion.ledger.rpc.JsonRpcExecutor;
import com.talentledger.ingestion.ledger.rpc.RpcEndpointRotator;
import com.talentledger.ingestion.ledger.rpc.RpcException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonRpcLedgerClientTest {

    private static final String EMPLOYMENT = "0x5fbdb2315678afecb367f032d93f642f64180aa3";
    private static final String CREDENTIALS = "0xe7f1725e7734ce288f8367e1bb143e90bb3f0512";
    private static final String COMPANY = "0x70997970c51812dc3a010c7d01b50e0d17dc79c8";
    private static final String TALENT = "0x3c44cdddb6a900fa2b585dd299e03d12fa4293bc";
    private static final BigInteger ONE_ETH = new BigInteger("1000000000000000000");

    @SuppressWarnings("rawtypes")
    private static final TupleType CONTRACT_RETURN = TupleType.parse(
            "((uint256,address,address,string,string,uint256,uint256,uint256,uint8,uint256,bool,bool))");
    @SuppressWarnings("rawtypes")
    private static final TupleType MILESTONE_RETURN = TupleType.parse("((string,uint256,uint256,uint8,string))");
    @SuppressWarnings("rawtypes")
    private static final TupleType IDS_RETURN = TupleType.parse("(uint256[])");
    @SuppressWarnings("rawtypes")
    private static final TupleType CREDENTIAL_RETURN = TupleType.parse("((address,address,string,string,uint256,bool))");

    private MockEvmRpcClient mockRpc;
    private JsonRpcLedgerClient client;

    @BeforeEach
    void setUp() {
        mockRpc = new MockEvmRpcClient();
        LedgerProperties properties = new LedgerProperties();
        properties.setEmploymentContract(EMPLOYMENT);
        properties.setCredentialContract(CREDENTIALS);
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("http://ledger.test"), new RetryPolicy(1, 1, 0.0, 2));
        RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitForPeriod(100_000)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        client = new JsonRpcLedgerClient(new JsonRpcExecutor(mockRpc, rotator, limiter, new ObjectMapper(), properties),
                properties);
    }

    @Test
    void fetchAgreementAssemblesHeaderAndMilestones() {
        mockRpc.onCall(EmploymentContractAbi.encodeGetContract(7), contractReturn(7, 2, 1));
        mockRpc.onCall(EmploymentContractAbi.encodeGetMilestone(7, 0), milestoneReturn("Design", ONE_ETH, 4, "ipfs://d"));
        mockRpc.onCall(EmploymentContractAbi.encodeGetMilestone(7, 1), milestoneReturn("Build", ONE_ETH.multiply(BigInteger.TWO), 0, ""));

        LedgerAgreement agreement = client.fetchAgreement(7);

        assertThat(agreement.id()).isEqualTo(7);
        assertThat(agreement.company()).isEqualTo(COMPANY);
        assertThat(agreement.talent()).isEqualTo(TALENT);
        assertThat(agreement.status()).isEqualTo(AgreementStatus.ACTIVE);
        assertThat(agreement.totalAmount()).isEqualTo(ONE_ETH.multiply(BigInteger.valueOf(3)));
        assertThat(agreement.startDate()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(agreement.milestones()).hasSize(2);
        assertThat(agreement.milestones().get(0).status()).isEqualTo(MilestoneStatus.PAID);
        assertThat(agreement.milestones().get(0).deliverableRef()).isEqualTo("ipfs://d");
        assertThat(agreement.milestones().get(1).deliverableRef()).isNull();
        assertThat(agreement.milestoneTotal()).isEqualTo(agreement.totalAmount());
    }

    @Test
    void agreementHeaderAndMilestonesAreReadAtOneBlock() {
        mockRpc.blockNumber = "0x1b4";
        mockRpc.onCall(EmploymentContractAbi.encodeGetContract(7), contractReturn(7, 2, 1));
        mockRpc.onCall(EmploymentContractAbi.encodeGetMilestone(7, 0), milestoneReturn("Design", ONE_ETH, 4, "ipfs://d"));
        mockRpc.onCall(EmploymentContractAbi.encodeGetMilestone(7, 1), milestoneReturn("Build", ONE_ETH.multiply(BigInteger.TWO), 0, ""));

        client.fetchAgreement(7);
        mockRpc.blockNumber = "0x1b5";
        client.fetchMilestone(7, 0);

        assertThat(mockRpc.blockTags).containsExactly("0x1b4", "0x1b4", "0x1b4", "latest");
    }

    @Test
    void zeroIdMeansUnknownAgreement() {
        mockRpc.onCall(EmploymentContractAbi.encodeGetContract(99), contractReturn(0, 0, 0));

        assertThatThrownBy(() -> client.fetchAgreement(99)).isInstanceOf(InvalidReferenceException.class);
    }

    @Test
    void revertMeansInvalidReference() {
        mockRpc.onCallRaw(EmploymentContractAbi.encodeGetMilestone(7, 5),
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":3,\"message\":\"execution reverted: Invalid milestone\"}}");

        assertThatThrownBy(() -> client.fetchMilestone(7, 5)).isInstanceOf(InvalidReferenceException.class);
        assertThat(mockRpc.calls.get()).isEqualTo(1);
    }

    @Test
    void transportFailureMeansUnreachableAfterRetries() {
        mockRpc.failAll = true;

        assertThatThrownBy(() -> client.fetchAgreement(7)).isInstanceOf(UnreachableSourceException.class);
        assertThat(mockRpc.calls.get()).isEqualTo(2);
    }

    @Test
    void partyAgreementsUnionBothRoles() {
        mockRpc.onCall(EmploymentContractAbi.encodeGetPartyContracts(EmploymentContractAbi.GET_COMPANY_CONTRACTS, COMPANY),
                IDS_RETURN.encode(Tuple.from((Object) new BigInteger[]{BigInteger.ONE, BigInteger.valueOf(3)})).array());
        mockRpc.onCall(EmploymentContractAbi.encodeGetPartyContracts(EmploymentContractAbi.GET_TALENT_CONTRACTS, COMPANY),
                IDS_RETURN.encode(Tuple.from((Object) new BigInteger[]{BigInteger.valueOf(3), BigInteger.valueOf(8)})).array());

        assertThat(client.fetchPartyAgreements(COMPANY, null)).containsExactlyInAnyOrder(1L, 3L, 8L);
        assertThat(client.fetchPartyAgreements(COMPANY.toUpperCase().replace("0X", "0x"), PartyRole.COMPANY))
                .containsExactlyInAnyOrder(1L, 3L);
    }

    @Test
    void credentialWithZeroRecipientDoesNotExist() {
        mockRpc.onCall(EmploymentContractAbi.encodeGetCredential(4), credentialReturn(COMPANY, "0x0000000000000000000000000000000000000000"));
        mockRpc.onCall(EmploymentContractAbi.encodeGetCredential(5), credentialReturn(COMPANY, TALENT));

        assertThatThrownBy(() -> client.fetchCredential(4)).isInstanceOf(InvalidReferenceException.class);
        LedgerCredential credential = client.fetchCredential(5);
        assertThat(credential.recipient()).isEqualTo(TALENT);
        assertThat(credential.issuer()).isEqualTo(COMPANY);
        assertThat(credential.skillName()).isEqualTo("Solidity");
    }

    @Test
    void latestBlockParsesHexQuantity() {
        mockRpc.blockNumber = "0x1b4";

        assertThat(client.latestBlock()).isEqualTo(436L);
    }

    private static byte[] contractReturn(long id, int milestoneCount, int status) {
        Tuple contract = Tuple.from(
                BigInteger.valueOf(id),
                abiAddress(COMPANY),
                abiAddress(TALENT),
                "Smart contract audit",
                "ipfs://meta",
                ONE_ETH.multiply(BigInteger.valueOf(3)),
                BigInteger.valueOf(1_700_000_000L),
                BigInteger.valueOf(1_710_000_000L),
                status,
                BigInteger.valueOf(milestoneCount),
                true,
                status > 0);
        return CONTRACT_RETURN.encode(Tuple.from(contract)).array();
    }

    private static byte[] milestoneReturn(String description, BigInteger amount, int status, String deliverable) {
        Tuple milestone = Tuple.of(description, amount, BigInteger.valueOf(1_705_000_000L), status, deliverable);
        return MILESTONE_RETURN.encode(Tuple.from(milestone)).array();
    }

    private static byte[] credentialReturn(String issuer, String recipient) {
        Tuple credential = Tuple.of(abiAddress(issuer), abiAddress(recipient), "Solidity", "SKILL",
                BigInteger.valueOf(1_705_000_000L), false);
        return CREDENTIAL_RETURN.encode(Tuple.from(credential)).array();
    }

    private static Address abiAddress(String address) {
        return Address.wrap(Address.toChecksumAddress(address));
    }

    private static class MockEvmRpcClient implements EvmRpcClient {
        private final Map<String, String> responses = new HashMap<>();
        private final AtomicInteger calls = new AtomicInteger();
        private boolean failAll;
        private String blockNumber = "0x0";
        private final List<String> blockTags = new ArrayList<>();

        void onCall(byte[] callData, byte[] returnData) {
            onCallRaw(callData, "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x" + Hex.toHexString(returnData) + "\"}");
        }

        void onCallRaw(byte[] callData, String response) {
            responses.put("0x" + Hex.toHexString(callData), response);
        }

        @Override
        public Mono<String> call(String endpointUrl, String method, Object params) {
            calls.incrementAndGet();
            if (failAll) {
                return Mono.error(new RpcException("connection refused"));
            }
            if ("eth_blockNumber".equals(method)) {
                return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"" + blockNumber + "\"}");
            }
            Map<?, ?> tx = (Map<?, ?>) ((List<?>) params).get(0);
            blockTags.add((String) ((List<?>) params).get(1));
            String response = responses.get((String) tx.get("data"));
            if (response == null) {
                return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x\"}");
            }
            return Mono.just(response);
        }
    }
}
