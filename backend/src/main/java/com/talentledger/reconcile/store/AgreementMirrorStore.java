package com.talentledger.reconcile.store;

import com.talentledger.domain.Agreement;
import com.talentledger.domain.AgreementRepository;
import com.talentledger.domain.AgreementStatus;
import com.talentledger.domain.Milestone;
import com.talentledger.domain.MilestoneStatus;
import com.talentledger.ingestion.ledger.LedgerAgreement;
import com.talentledger.ingestion.ledger.LedgerMilestone;
import com.talentledger.reconcile.engine.InvariantViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Merges ledger snapshots into the local agreement mirror. The mirror only moves forward: a snapshot behind the
 * mirror on the same lifecycle path is ignored, a snapshot on a diverging path is an invariant violation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgreementMirrorStore {

    private final AgreementRepository repository;

    public Agreement merge(LedgerAgreement snapshot, long sequencePosition) {
        Agreement mirror = repository.findById(snapshot.id()).orElse(null);
        Instant now = Instant.now();
        if (mirror == null) {
            Agreement created = fromSnapshot(snapshot);
            created.setLastSyncedBlock(sequencePosition);
            created.setUpdatedAt(now);
            log.debug("Agreement {} mirrored from ledger at status {}", snapshot.id(), snapshot.status());
            return repository.save(created);
        }
        if (!Objects.equals(mirror.getCompany(), snapshot.company()) || !Objects.equals(mirror.getTalent(), snapshot.talent())) {
            throw new InvariantViolationException("Agreement " + snapshot.id() + " parties changed on the ledger");
        }
        if (mirror.getTotalAmount() != null && mirror.getTotalAmount().compareTo(new BigDecimal(snapshot.totalAmount())) != 0) {
            throw new InvariantViolationException("Agreement " + snapshot.id() + " total amount changed on the ledger");
        }
        mirror.setStatus(forwardStatus(snapshot.id(), mirror.getStatus(), snapshot.status()));
        mirror.setMilestones(mergeMilestones(snapshot.id(), mirror.getMilestones(), snapshot.milestones()));
        mirror.setCompanyApproved(mirror.isCompanyApproved() || snapshot.companyApproved());
        mirror.setTalentApproved(mirror.isTalentApproved() || snapshot.talentApproved());
        mirror.setTitle(snapshot.title());
        mirror.setMetadataRef(snapshot.metadataRef());
        mirror.setStartDate(snapshot.startDate());
        mirror.setEndDate(snapshot.endDate());
        long synced = mirror.getLastSyncedBlock() == null ? sequencePosition : Math.max(mirror.getLastSyncedBlock(), sequencePosition);
        mirror.setLastSyncedBlock(synced);
        mirror.setUpdatedAt(now);
        return repository.save(mirror);
    }

    static AgreementStatus forwardStatus(long id, AgreementStatus current, AgreementStatus fetched) {
        if (current == null || current.canReach(fetched)) {
            return fetched;
        }
        if (fetched.canReach(current)) {
            log.debug("Agreement {} snapshot status {} is behind mirror {}; keeping mirror", id, fetched, current);
            return current;
        }
        throw new InvariantViolationException("Agreement " + id + " cannot move from " + current + " to " + fetched);
    }

    static List<Milestone> mergeMilestones(long id, List<Milestone> current, List<LedgerMilestone> fetched) {
        List<Milestone> existing = current == null ? List.of() : current;
        if (fetched.size() < existing.size()) {
            throw new InvariantViolationException("Agreement " + id + " lost milestones on the ledger ("
                    + existing.size() + " -> " + fetched.size() + ")");
        }
        List<Milestone> merged = new ArrayList<>(fetched.size());
        for (int i = 0; i < fetched.size(); i++) {
            LedgerMilestone f = fetched.get(i);
            Milestone m = toMilestone(f);
            if (i < existing.size()) {
                Milestone old = existing.get(i);
                if (old.getAmount() != null && old.getAmount().compareTo(m.getAmount()) != 0) {
                    throw new InvariantViolationException("Agreement " + id + " milestone " + i + " amount changed");
                }
                if (m.getStatus().isBefore(old.getStatus())) {
                    log.debug("Agreement {} milestone {} snapshot {} is behind mirror {}; keeping mirror",
                            id, i, m.getStatus(), old.getStatus());
                    m.setStatus(old.getStatus());
                }
                if (m.getDeliverableRef() == null) {
                    m.setDeliverableRef(old.getDeliverableRef());
                }
            }
            merged.add(m);
        }
        return merged;
    }

    static Agreement fromSnapshot(LedgerAgreement s) {
        Agreement a = new Agreement();
        a.setId(s.id());
        a.setCompany(s.company());
        a.setTalent(s.talent());
        a.setTitle(s.title());
        a.setMetadataRef(s.metadataRef());
        a.setTotalAmount(new BigDecimal(s.totalAmount()));
        a.setStartDate(s.startDate());
        a.setEndDate(s.endDate());
        a.setStatus(s.status());
        a.setCompanyApproved(s.companyApproved());
        a.setTalentApproved(s.talentApproved());
        List<Milestone> milestones = new ArrayList<>(s.milestones().size());
        s.milestones().forEach(m -> milestones.add(toMilestone(m)));
        a.setMilestones(milestones);
        return a;
    }

    private static Milestone toMilestone(LedgerMilestone f) {
        Milestone m = new Milestone();
        m.setDescription(f.description());
        m.setAmount(new BigDecimal(f.amount()));
        m.setDeadline(f.deadline());
        m.setStatus(f.status() != null ? f.status() : MilestoneStatus.PENDING);
        m.setDeliverableRef(f.deliverableRef());
        return m;
    }
}
