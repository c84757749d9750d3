package com.mediafleet.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Control topic for lifecycle transitions (LifecycleTransition messages).
     * Published by the fleet manager, keyed by media node id so that all
     * transitions of one node land in order on one partition.
     */
    public static final String CONTROL_LIFECYCLE = "mediafleet.control.lifecycle";

}
