package com.mediafleet.core.error;

import lombok.Getter;

/**
 * Base type for media node lifecycle errors.
 * <p>
 * All subtypes are unchecked: contract violations are surfaced to the immediate
 * caller, while asynchronous failures are logged by the Reactor chain that saw them.
 * </p>
 */
@Getter
public class MediaNodeException extends RuntimeException {
    private final String mediaNodeId;

    public MediaNodeException(String mediaNodeId, String message) {
        super(message);
        this.mediaNodeId = mediaNodeId;
    }

    public MediaNodeException(String mediaNodeId, String message, Throwable cause) {
        super(message, cause);
        this.mediaNodeId = mediaNodeId;
    }
}
