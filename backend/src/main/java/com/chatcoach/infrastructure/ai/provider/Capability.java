package com.chatcoach.infrastructure.ai.provider;

public enum Capability {
    TEXT,
    VISION
}
