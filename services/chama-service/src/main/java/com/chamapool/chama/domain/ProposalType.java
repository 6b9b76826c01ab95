package com.chamapool.chama.domain;

public enum ProposalType {
    CANCEL_PUNISHMENT,
    ADD_ADMIN,
    REMOVE_ADMIN,
    KICK_MEMBER
}
