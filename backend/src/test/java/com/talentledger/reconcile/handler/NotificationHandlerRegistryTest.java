package com.talentledger.reconcile.handler;

import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.reconcile.config.ReconcileProperties;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class NotificationHandlerRegistryTest {

    private final LedgerClient ledgerClient = mock(LedgerClient.class);

    @Test
    void acceptsOneHandlerPerType() {
        assertThatCode(() -> new NotificationHandlerRegistry(allHandlers())).doesNotThrowAnyException();
    }

    @Test
    void missingHandlerFailsStartup() {
        List<NotificationHandler<?>> handlers = allHandlers();
        handlers.remove(0);

        assertThatThrownBy(() -> new NotificationHandlerRegistry(handlers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("No handler for");
    }

    @Test
    void duplicateHandlerFailsStartup() {
        List<NotificationHandler<?>> handlers = allHandlers();
        handlers.add(new AgreementActivatedHandler(ledgerClient));

        assertThatThrownBy(() -> new NotificationHandlerRegistry(handlers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Duplicate handler");
    }

    private List<NotificationHandler<?>> allHandlers() {
        List<NotificationHandler<?>> handlers = new ArrayList<>();
        handlers.add(new AgreementCreatedHandler(ledgerClient));
        handlers.add(new AgreementAcceptedHandler(ledgerClient));
        handlers.add(new AgreementActivatedHandler(ledgerClient));
        handlers.add(new MilestoneSubmittedHandler(ledgerClient));
        handlers.add(new MilestoneApprovedHandler(ledgerClient));
        handlers.add(new MilestonePaidHandler(ledgerClient, new ReconcileProperties()));
        handlers.add(new AgreementDisputedHandler(ledgerClient));
        handlers.add(new AgreementCompletedHandler(ledgerClient));
        handlers.add(new AgreementFinalizedHandler(ledgerClient));
        handlers.add(new AgreementCancelledHandler(ledgerClient));
        handlers.add(new CredentialIssuedHandler(ledgerClient));
        return handlers;
    }
}
