package com.chatcoach.domain.reply.model;

public enum QualityTier {
    CHEAP,
    NORMAL,
    PREMIUM
}
