package com.chamapool.chama.engine;

public enum ChamaEventType {
    GROUP_CREATED,
    MEMBER_JOINED,
    MEMBER_LEFT,
    JOIN_REQUESTED,
    JOIN_APPROVED,
    JOIN_REJECTED,
    CONTRIBUTION_MADE,
    MISSED_CONTRIBUTION_DETECTED,
    MEMBER_PUNISHED,
    PUNISHMENT_CANCELLED,
    FINE_COLLECTED,
    PAYOUT_PROCESSED,
    EMERGENCY_WITHDRAWAL,
    ADMIN_ADDED,
    ADMIN_REMOVED,
    PROPOSAL_CREATED,
    VOTE_CAST,
    PROPOSAL_EXECUTED,
    CREATOR_TRANSFERRED,
    GROUP_PAUSED,
    GROUP_UNPAUSED
}
