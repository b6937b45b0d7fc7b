package com.supplyguard.core.config;

/**
 * What an agent keeps when its AI-derived and traditional scores disagree.
 */
public enum DisagreementPolicy {
    PREFER_AI,
    PREFER_TRADITIONAL,
    BLEND
}
