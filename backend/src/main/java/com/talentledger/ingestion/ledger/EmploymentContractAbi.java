package com.talentledger.ingestion.ledger;

import com.esaulpaugh.headlong.abi.Address;
import com.esaulpaugh.headlong.abi.Function;
import com.esaulpaugh.headlong.abi.Tuple;
import com.talentledger.domain.AgreementStatus;
import com.talentledger.domain.MilestoneStatus;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * ABI of the read functions used by the indexer, with decoding of their return values into ledger snapshots.
 */
public final class EmploymentContractAbi {

    public static final Function GET_CONTRACT = new Function("getContract(uint256)",
            "((uint256,address,address,string,string,uint256,uint256,uint256,uint8,uint256,bool,bool))");
    public static final Function GET_MILESTONE = new Function("getMilestone(uint256,uint256)",
            "((string,uint256,uint256,uint8,string))");
    public static final Function GET_COMPANY_CONTRACTS = new Function("getCompanyContracts(address)", "(uint256[])");
    public static final Function GET_TALENT_CONTRACTS = new Function("getTalentContracts(address)", "(uint256[])");
    public static final Function GET_CREDENTIAL = new Function("getCredential(uint256)",
            "((address,address,string,string,uint256,bool))");

    private EmploymentContractAbi() {
    }

    /** Header of getContract plus its milestone count; milestones are fetched separately. */
    public record AgreementHeader(
            long id,
            String company,
            String talent,
            String title,
            String metadataRef,
            BigInteger totalAmount,
            Instant startDate,
            Instant endDate,
            AgreementStatus status,
            int milestoneCount,
            boolean companyApproved,
            boolean talentApproved
    ) {
        public LedgerAgreement withMilestones(List<LedgerMilestone> milestones) {
            return new LedgerAgreement(id, company, talent, title, metadataRef, totalAmount, startDate, endDate,
                    status, companyApproved, talentApproved, milestones);
        }
    }

    public static byte[] encodeGetContract(long agreementId) {
        return GET_CONTRACT.encodeCallWithArgs(BigInteger.valueOf(agreementId)).array();
    }

    public static byte[] encodeGetMilestone(long agreementId, int index) {
        return GET_MILESTONE.encodeCallWithArgs(BigInteger.valueOf(agreementId), BigInteger.valueOf(index)).array();
    }

    public static byte[] encodeGetPartyContracts(Function function, String address) {
        return function.encodeCallWithArgs(toAbiAddress(address)).array();
    }

    public static byte[] encodeGetCredential(long tokenId) {
        return GET_CREDENTIAL.encodeCallWithArgs(BigInteger.valueOf(tokenId)).array();
    }

    public static AgreementHeader decodeContract(byte[] returnData) {
        Tuple outer = GET_CONTRACT.decodeReturn(returnData);
        Tuple c = (Tuple) outer.get(0);
        return new AgreementHeader(
                ((BigInteger) c.get(0)).longValueExact(),
                address(c.get(1)),
                address(c.get(2)),
                (String) c.get(3),
                (String) c.get(4),
                (BigInteger) c.get(5),
                epochSeconds((BigInteger) c.get(6)),
                epochSeconds((BigInteger) c.get(7)),
                AgreementStatus.fromCode((Integer) c.get(8)),
                ((BigInteger) c.get(9)).intValueExact(),
                (Boolean) c.get(10),
                (Boolean) c.get(11));
    }

    public static LedgerMilestone decodeMilestone(byte[] returnData) {
        Tuple outer = GET_MILESTONE.decodeReturn(returnData);
        Tuple m = (Tuple) outer.get(0);
        String deliverable = (String) m.get(4);
        return new LedgerMilestone(
                (String) m.get(0),
                (BigInteger) m.get(1),
                epochSeconds((BigInteger) m.get(2)),
                MilestoneStatus.fromCode((Integer) m.get(3)),
                deliverable == null || deliverable.isEmpty() ? null : deliverable);
    }

    public static Set<Long> decodeIdList(Function function, byte[] returnData) {
        Tuple outer = function.decodeReturn(returnData);
        BigInteger[] ids = (BigInteger[]) outer.get(0);
        Set<Long> result = new LinkedHashSet<>();
        for (BigInteger id : ids) {
            result.add(id.longValueExact());
        }
        return result;
    }

    public static LedgerCredential decodeCredential(long tokenId, byte[] returnData) {
        Tuple outer = GET_CREDENTIAL.decodeReturn(returnData);
        Tuple c = (Tuple) outer.get(0);
        return new LedgerCredential(
                tokenId,
                address(c.get(0)),
                address(c.get(1)),
                (String) c.get(2),
                (String) c.get(3),
                epochSeconds((BigInteger) c.get(4)),
                (Boolean) c.get(5));
    }

    static Address toAbiAddress(String address) {
        return Address.wrap(Address.toChecksumAddress(address.toLowerCase()));
    }

    private static String address(Object value) {
        return value.toString().toLowerCase();
    }

    private static Instant epochSeconds(BigInteger seconds) {
        if (seconds == null || seconds.signum() == 0) {
            return null;
        }
        return Instant.ofEpochSecond(seconds.longValueExact());
    }
}
