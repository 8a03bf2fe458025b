package com.chatcoach.domain.reply.model;

/**
 * How the analysis stages are obtained from the providers.
 * Both strategies read and write the same stage cache keys.
 */
public enum FlowStrategy {
    /** One provider call per analysis stage. */
    TRADITIONAL,
    /** One provider call producing context and scene analysis together. */
    MERGED
}
