package com.talentledger.query;

import com.talentledger.domain.ActivityRecord;
import com.talentledger.domain.ActivityRecordRepository;
import com.talentledger.domain.Agreement;
import com.talentledger.domain.AgreementRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only agreement mirror and activity history for the API.
 */
@Service
@RequiredArgsConstructor
public class AgreementQueryService {

    private final AgreementRepository agreementRepository;
    private final ActivityRecordRepository activityRecordRepository;

    public Optional<Agreement> findAgreement(long id) {
        return agreementRepository.findById(id);
    }

    public boolean isIndexed(long id) {
        return agreementRepository.existsById(id);
    }

    public List<Agreement> findAgreements(Collection<Long> ids) {
        return agreementRepository.findAllById(ids);
    }

    /** Most recent 50 records, newest first. */
    public List<ActivityRecord> recentActivity(long agreementId) {
        return activityRecordRepository.findTop50ByAgreementIdOrderBySequencePositionDescLogIndexDesc(agreementId);
    }

    /** Full history in ledger order. */
    public List<ActivityRecord> activity(long agreementId) {
        return activityRecordRepository.findByAgreementIdOrderBySequencePositionAscLogIndexAsc(agreementId);
    }
}
