package com.netcracker.core.access.model;

public enum OsType {
    LINUX,
    WINDOWS
}
