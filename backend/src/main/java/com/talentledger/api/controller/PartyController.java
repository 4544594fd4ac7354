package com.talentledger.api.controller;

import com.talentledger.api.dto.AgreementResponse;
import com.talentledger.api.dto.ErrorBody;
import com.talentledger.api.dto.PartyAgreementsResponse;
import com.talentledger.api.dto.PartyProfileResponse;
import com.talentledger.common.AddressFormat;
import com.talentledger.config.AsyncConfig;
import com.talentledger.domain.PartyRole;
import com.talentledger.publication.PartyChannelRegistry;
import com.talentledger.publication.PublicationEvent;
import com.talentledger.query.PartyQueryService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * GET /parties/{address}, GET /parties/{address}/agreements, GET /parties/{address}/events (SSE).
 */
@RestController
@RequestMapping("/api/v1/parties")
public class PartyController {

    private final PartyQueryService partyQueryService;
    private final PartyChannelRegistry channelRegistry;
    private final Scheduler ledgerReadScheduler;

    public PartyController(PartyQueryService partyQueryService,
                           PartyChannelRegistry channelRegistry,
                           @Qualifier(AsyncConfig.LEDGER_READ_EXECUTOR) Executor ledgerReadExecutor) {
        this.partyQueryService = partyQueryService;
        this.channelRegistry = channelRegistry;
        this.ledgerReadScheduler = Schedulers.fromExecutor(ledgerReadExecutor);
    }

    @GetMapping("/{address}")
    public ResponseEntity<?> getProfile(@PathVariable String address) {
        if (!AddressFormat.isValid(address)) {
            return invalidAddress();
        }
        String addr = AddressFormat.normalize(address);
        return partyQueryService.findProfile(addr)
                .<ResponseEntity<?>>map(p -> ResponseEntity.ok(PartyProfileResponse.from(p)))
                .orElse(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("NOT_FOUND", "No activity indexed for " + addr)));
    }

    /**
     * Agreement ids are read from the ledger so parties see agreements the indexer has not caught up with yet.
     * The ledger client blocks, so the lookup runs on the ledger read pool, never on the HTTP event loop.
     */
    @GetMapping("/{address}/agreements")
    public Mono<ResponseEntity<?>> getAgreements(@PathVariable String address,
                                                 @RequestParam(required = false) String role) {
        if (!AddressFormat.isValid(address)) {
            return Mono.<ResponseEntity<?>>just(invalidAddress());
        }
        PartyRole partyRole = null;
        if (role != null && !role.isBlank()) {
            try {
                partyRole = PartyRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return Mono.<ResponseEntity<?>>just(ResponseEntity.badRequest()
                        .body(ErrorBody.of("INVALID_ROLE", "Role must be company or talent")));
            }
        }
        String addr = AddressFormat.normalize(address);
        PartyRole requestedRole = partyRole;
        return Mono.fromCallable(() -> partyQueryService.findAgreements(addr, requestedRole))
                .subscribeOn(ledgerReadScheduler)
                .<ResponseEntity<?>>map(agreements -> {
                    List<AgreementResponse> mirrored = agreements.mirrored().stream()
                            .map(a -> AgreementResponse.from(a, List.of()))
                            .toList();
                    return ResponseEntity.ok(new PartyAgreementsResponse(addr,
                            requestedRole != null ? requestedRole.name() : null, agreements.agreementIds(), mirrored));
                });
    }

    @GetMapping(value = "/{address}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<Flux<ServerSentEvent<Map<String, Object>>>> events(@PathVariable String address) {
        if (!AddressFormat.isValid(address)) {
            return ResponseEntity.badRequest().build();
        }
        Flux<ServerSentEvent<Map<String, Object>>> stream = channelRegistry.stream(AddressFormat.normalize(address))
                .map(PartyController::toSse);
        return ResponseEntity.ok(stream);
    }

    private static ServerSentEvent<Map<String, Object>> toSse(PublicationEvent event) {
        return ServerSentEvent.<Map<String, Object>>builder()
                .event(event.type())
                .data(event.payload())
                .build();
    }

    private static ResponseEntity<ErrorBody> invalidAddress() {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid party address"));
    }
}
