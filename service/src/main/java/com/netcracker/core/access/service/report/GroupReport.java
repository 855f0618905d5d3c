package com.netcracker.core.access.service.report;

public record GroupReport(String groupName, String attachment, boolean success, String detail) {

    public static GroupReport succeeded(String groupName, String attachment, String detail) {
        return new GroupReport(groupName, attachment, true, detail);
    }

    public static GroupReport failed(String groupName, String attachment, String reason) {
        return new GroupReport(groupName, attachment, false, reason);
    }
}
