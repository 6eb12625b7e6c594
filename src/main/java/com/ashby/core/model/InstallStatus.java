package com.ashby.core.model;

public enum InstallStatus {
    INSTALLING,
    INSTALLED,
    FAILED
}
