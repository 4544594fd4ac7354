package com.talentledger.api.dto;

import java.util.List;

/**
 * GET /api/v1/parties/{address}/agreements response. Ids come straight from the ledger; mirrored entries are those
 * already indexed locally.
 */
public record PartyAgreementsResponse(String address, String role, List<Long> agreementIds,
                                      List<AgreementResponse> mirrored) {
}
