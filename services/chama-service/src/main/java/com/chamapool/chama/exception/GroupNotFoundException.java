package com.chamapool.chama.exception;

import com.chamapool.common.exception.ErrorCode;

/**
 * Exception thrown when a group id is not known to the registry
 * Results in HTTP 404 Not Found
 */
public class GroupNotFoundException extends ChamaException {

    public GroupNotFoundException(String groupId) {
        super(ErrorCode.GROUP_NOT_FOUND, "Group not found: " + groupId);
        withMetadata("groupId", groupId);
    }
}
