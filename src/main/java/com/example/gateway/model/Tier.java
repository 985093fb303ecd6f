package com.example.gateway.model;

/**
 * Commercial tier assigned to a principal at credential issuance.
 */
public enum Tier {
    FREE,
    STANDARD,
    PREMIUM,
    ENTERPRISE
}
