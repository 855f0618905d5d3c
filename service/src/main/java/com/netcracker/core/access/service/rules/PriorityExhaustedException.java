package com.netcracker.core.access.service.rules;

import com.netcracker.core.access.service.AccessManagerException;

public class PriorityExhaustedException extends AccessManagerException {

    public PriorityExhaustedException(PriorityRange range) {
        super("No free rule priority in range %d-%d".formatted(range.min(), range.max()));
    }
}
