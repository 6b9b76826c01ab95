package com.chamapool.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes for the Chama platform
 * Format: MODULE_CATEGORY_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== GROUP AUTHORIZATION ERRORS (GROUP_AUTH_XXX) =====
    GROUP_NOT_ADMIN("GROUP_AUTH_001", "Not admin"),
    GROUP_NOT_CREATOR("GROUP_AUTH_002", "Only creator"),
    GROUP_NOT_ACTIVE_MEMBER("GROUP_AUTH_003", "Not an active member"),

    // ===== GROUP PRECONDITION ERRORS (GROUP_STATE_XXX) =====
    GROUP_NOT_STARTED("GROUP_STATE_001", "Group has not started"),
    GROUP_ENDED("GROUP_STATE_002", "Group has ended"),
    GROUP_INACTIVE("GROUP_STATE_003", "Group is not active"),
    GROUP_PAUSED("GROUP_STATE_004", "Group is paused"),
    GROUP_NOT_PAUSED("GROUP_STATE_005", "Group is not paused"),
    GROUP_WINDOW_CLOSED("GROUP_STATE_006", "Contribution window closed"),
    GROUP_ALREADY_CONTRIBUTED("GROUP_STATE_007", "Already contributed this period"),
    GROUP_ALREADY_MEMBER("GROUP_STATE_008", "Already a member"),
    GROUP_JOIN_ALREADY_REQUESTED("GROUP_STATE_009", "Join request already pending"),
    GROUP_NO_JOIN_REQUEST("GROUP_STATE_010", "No pending join request"),
    GROUP_ACTIVE_PUNISHMENT("GROUP_STATE_011", "Cannot leave with active punishment"),
    GROUP_MEMBER_PUNISHED("GROUP_STATE_012", "Member has an active punishment"),
    GROUP_NO_ACTIVE_FINE("GROUP_STATE_013", "No active fine"),
    GROUP_NO_ACTIVE_PUNISHMENT("GROUP_STATE_014", "No active punishment"),
    GROUP_ALREADY_VOTED("GROUP_STATE_015", "Already voted"),
    GROUP_VOTING_CLOSED("GROUP_STATE_016", "Voting period over"),
    GROUP_VOTING_ACTIVE("GROUP_STATE_017", "Voting still active"),
    GROUP_INSUFFICIENT_PARTICIPATION("GROUP_STATE_018", "Insufficient participation"),
    GROUP_PROPOSAL_REJECTED("GROUP_STATE_019", "Proposal rejected"),
    GROUP_MEMBER_NOT_CONTRIBUTED("GROUP_STATE_020", "Member has not contributed yet"),
    GROUP_NO_ELIGIBLE_RECIPIENTS("GROUP_STATE_021", "No eligible recipients"),
    GROUP_INSUFFICIENT_POOL("GROUP_STATE_022", "Insufficient pool balance"),
    GROUP_EMERGENCY_WITHDRAW_DISABLED("GROUP_STATE_023", "Emergency withdraw not allowed"),
    GROUP_MEMBER_INACTIVE("GROUP_STATE_024", "Member is not active"),
    GROUP_REENTRANT_CALL("GROUP_STATE_025", "Reentrant call"),

    // ===== GROUP VALUE ERRORS (GROUP_VALUE_XXX) =====
    GROUP_INCORRECT_CONTRIBUTION("GROUP_VALUE_001", "Incorrect contribution amount"),
    GROUP_INCORRECT_FINE("GROUP_VALUE_002", "Incorrect fine amount"),
    GROUP_WRONG_ASSET("GROUP_VALUE_003", "Wrong contribution asset"),

    // ===== GROUP CAPACITY ERRORS (GROUP_CAPACITY_XXX) =====
    GROUP_FULL("GROUP_CAPACITY_001", "Group is full"),
    GROUP_QUEUE_ALREADY_SET("GROUP_CAPACITY_002", "Payout queue already set"),
    GROUP_QUEUE_LENGTH_MISMATCH("GROUP_CAPACITY_003", "Queue length must equal member count"),
    GROUP_QUEUE_NOT_SET("GROUP_CAPACITY_004", "Payout queue not set"),
    GROUP_QUEUE_INVALID_ENTRY("GROUP_CAPACITY_005", "Queue entry is not a member"),
    GROUP_QUEUE_DUPLICATE("GROUP_CAPACITY_006", "Queue contains duplicate member"),

    // ===== GROUP INTEGRITY ERRORS (GROUP_INTEGRITY_XXX) =====
    GROUP_PROPOSAL_EXECUTED("GROUP_INTEGRITY_001", "Proposal already executed"),
    GROUP_PAYOUT_PROCESSED("GROUP_INTEGRITY_002", "Payout already processed for this period"),
    GROUP_UNKNOWN_MEMBER("GROUP_INTEGRITY_003", "Not a member"),
    GROUP_INVALID_ADDRESS("GROUP_INTEGRITY_004", "Invalid address"),
    GROUP_CANNOT_REMOVE_CREATOR("GROUP_INTEGRITY_005", "Cannot remove creator"),
    GROUP_PROPOSAL_NOT_FOUND("GROUP_INTEGRITY_006", "Proposal does not exist"),
    GROUP_INVALID_PUNISHMENT("GROUP_INTEGRITY_007", "Invalid punishment action"),
    GROUP_ALREADY_CREATOR("GROUP_INTEGRITY_008", "Already the creator"),

    GROUP_NOT_FOUND("GROUP_NOT_FOUND", "Group not found"),

    // ===== REGISTRY ERRORS (REGISTRY_XXX) =====
    REGISTRY_PAUSED("REGISTRY_STATE_001", "Registry is paused"),
    REGISTRY_NOT_PAUSED("REGISTRY_STATE_002", "Registry is not paused"),
    REGISTRY_NOT_OWNER("REGISTRY_AUTH_001", "Only registry owner"),
    REGISTRY_INVALID_NAME("REGISTRY_VALUE_001", "Invalid name length"),
    REGISTRY_INVALID_CONTRIBUTION("REGISTRY_VALUE_002", "Invalid contribution amount"),
    REGISTRY_INVALID_MAX_MEMBERS("REGISTRY_VALUE_003", "Invalid max members"),
    REGISTRY_START_IN_PAST("REGISTRY_VALUE_004", "Start date must be in future"),
    REGISTRY_INVALID_END_DATE("REGISTRY_VALUE_005", "Invalid end date"),
    REGISTRY_INVALID_WINDOW("REGISTRY_VALUE_006", "Invalid contribution window"),
    REGISTRY_TOO_MANY_GROUPS("REGISTRY_CAPACITY_001", "Too many groups for creator"),

    // ===== INTEGRATION ERRORS (INT_XXX) =====
    INT_TRANSFER_FAILED("INT_002", "Value transfer failed"),

    // ===== VALIDATION ERRORS (VAL_XXX) =====
    VALIDATION_FAILED("VAL_000", "Validation failed"),

    // ===== SYSTEM ERRORS (SYS_XXX) =====
    SYS_INTERNAL_ERROR("SYS_001", "Internal system error");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Get HTTP status for this error code
     */
    public HttpStatus getStatus() {
        if (code.contains("_AUTH_")) {
            return HttpStatus.FORBIDDEN;
        } else if (code.contains("_STATE_") || code.contains("_INTEGRITY_")) {
            return HttpStatus.CONFLICT;
        } else if (code.contains("_VALUE_") || code.startsWith("VAL_")) {
            return HttpStatus.BAD_REQUEST;
        } else if (code.contains("_CAPACITY_")) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        } else if (code.startsWith("INT_")) {
            return HttpStatus.BAD_GATEWAY;
        } else if (code.startsWith("SYS_")) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        } else if (code.endsWith("_NOT_FOUND")) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.BAD_REQUEST;
    }

    /**
     * Find error code by code string
     */
    public static ErrorCode fromCode(String code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(code)) {
                return errorCode;
            }
        }
        return SYS_INTERNAL_ERROR;
    }
}
