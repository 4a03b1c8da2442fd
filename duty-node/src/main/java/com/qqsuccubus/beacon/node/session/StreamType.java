package com.qqsuccubus.beacon.node.session;

public enum StreamType {
    DUTIES,
    VALIDATORS;

    public String tag() {
        return name().toLowerCase();
    }
}
