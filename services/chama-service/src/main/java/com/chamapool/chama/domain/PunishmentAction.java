package com.chamapool.chama.domain;

/**
 * Severity of a punishment. Also used as a group's configured punishment mode,
 * where NONE means missed contributions are counted but never punished.
 */
public enum PunishmentAction {
    NONE,
    WARNING,
    FINE,
    BAN
}
