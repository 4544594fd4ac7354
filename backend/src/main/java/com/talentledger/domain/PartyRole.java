package com.talentledger.domain;

/**
 * Role a party has played in at least one agreement.
 */
public enum PartyRole {
    COMPANY,
    TALENT
}
