package com.talentledger.api.controller;

import com.talentledger.api.dto.ActivityResponse;
import com.talentledger.api.dto.AgreementResponse;
import com.talentledger.api.dto.ErrorBody;
import com.talentledger.domain.Agreement;
import com.talentledger.query.AgreementQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * GET /agreements/{id}, GET /agreements/{id}/activity. Served from the local mirror only.
 */
@RestController
@RequestMapping("/api/v1/agreements")
@RequiredArgsConstructor
public class AgreementController {

    private final AgreementQueryService agreementQueryService;

    @GetMapping("/{id}")
    public ResponseEntity<?> getAgreement(@PathVariable long id) {
        Optional<Agreement> agreement = agreementQueryService.findAgreement(id);
        if (agreement.isEmpty()) {
            return notFound(id);
        }
        List<ActivityResponse> recent = agreementQueryService.recentActivity(id).stream()
                .map(ActivityResponse::from)
                .toList();
        return ResponseEntity.ok(AgreementResponse.from(agreement.get(), recent));
    }

    @GetMapping("/{id}/activity")
    public ResponseEntity<?> getActivity(@PathVariable long id) {
        if (!agreementQueryService.isIndexed(id)) {
            return notFound(id);
        }
        List<ActivityResponse> history = agreementQueryService.activity(id).stream()
                .map(ActivityResponse::from)
                .toList();
        return ResponseEntity.ok(history);
    }

    private static ResponseEntity<ErrorBody> notFound(long id) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorBody.of("NOT_FOUND", "Agreement " + id + " is not indexed"));
    }
}
