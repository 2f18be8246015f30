package com.taxstudio.domain;

/**
 * Whether a transaction's partner reference points at a user-owned or a global partner.
 */
public enum PartnerType {
    USER,
    GLOBAL
}
