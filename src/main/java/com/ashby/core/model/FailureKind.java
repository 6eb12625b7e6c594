package com.ashby.core.model;

public enum FailureKind {
    DISCOVERY_EMPTY,
    INSTALL_FAILED,
    SPAWN_FAILED,
    HANDSHAKE_FAILED,
    TIMEOUT,
    PROCESS_CRASHED
}
