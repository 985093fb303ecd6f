package com.example.gateway.model;

/**
 * What an emergency override applies to.
 */
public enum OverrideScope {
    PRINCIPAL,
    EVENT,
    GLOBAL
}
