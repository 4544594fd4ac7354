package com.talentledger.publication;

import java.util.Map;

/**
 * Lightweight live update addressed to one party channel (a lowercase address).
 */
public record PublicationEvent(String channel, String type, Map<String, Object> payload) {
}
