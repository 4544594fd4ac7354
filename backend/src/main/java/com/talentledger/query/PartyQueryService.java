package com.talentledger.query;

import com.talentledger.domain.Agreement;
import com.talentledger.domain.AgreementRepository;
import com.talentledger.domain.PartyProfile;
import com.talentledger.domain.PartyProfileRepository;
import com.talentledger.domain.PartyRole;
import com.talentledger.ingestion.ledger.LedgerClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Party profiles from the local store; agreement membership straight from the ledger.
 */
@Service
@RequiredArgsConstructor
public class PartyQueryService {

    private final PartyProfileRepository partyProfileRepository;
    private final AgreementRepository agreementRepository;
    private final LedgerClient ledgerClient;

    public Optional<PartyProfile> findProfile(String address) {
        return partyProfileRepository.findById(address);
    }

    /**
     * @param role null for both roles
     * @throws com.talentledger.ingestion.ledger.UnreachableSourceException when the ledger cannot be queried
     */
    public PartyAgreements findAgreements(String address, PartyRole role) {
        List<Long> ids = ledgerClient.fetchPartyAgreements(address, role).stream().sorted().toList();
        return new PartyAgreements(ids, agreementRepository.findAllById(ids));
    }

    /**
     * @param agreementIds ledger-reported ids, ascending
     * @param mirrored     the subset already indexed locally
     */
    public record PartyAgreements(List<Long> agreementIds, List<Agreement> mirrored) {
    }
}
