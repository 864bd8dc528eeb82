package com.hubzone.designations.importer.model;

public enum HubzoneMembership {
    IN_HUBZONE,
    NOT_IN_HUBZONE;

    public static HubzoneMembership of(boolean inHubzone) {
        return inHubzone ? IN_HUBZONE : NOT_IN_HUBZONE;
    }
}
