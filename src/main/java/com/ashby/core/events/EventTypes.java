package com.ashby.core.events;

/**
 * Event type names published on the {@link EventBus}.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String GAP_ACCEPTED = "gap.accepted";
    public static final String ACQUISITION_STARTED = "acquisition.started";
    public static final String ACQUISITION_STAGE = "acquisition.stage";
    public static final String ACQUISITION_REGISTERED = "acquisition.registered";
    public static final String ACQUISITION_FAILED = "acquisition.failed";
    public static final String PROCESS_STARTED = "process.started";
    public static final String PROCESS_CRASHED = "process.crashed";
    public static final String PROCESS_STOPPED = "process.stopped";
}
