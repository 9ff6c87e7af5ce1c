package com.skilltrace.gap;

public class TargetProfileNotConfiguredException extends IllegalStateException {

    public TargetProfileNotConfiguredException(String message) {
        super(message);
    }
}
