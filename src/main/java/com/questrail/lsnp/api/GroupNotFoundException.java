package com.questrail.lsnp.api;

public final class GroupNotFoundException extends LsnpException
{
    private final String groupId;

    public GroupNotFoundException(String groupId) {
        super("Unknown group: " + groupId);
        this.groupId = groupId;
    }

    public String groupId() {
        return groupId;
    }
}
