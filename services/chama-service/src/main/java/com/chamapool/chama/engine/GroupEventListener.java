package com.chamapool.chama.engine;

/**
 * Receives group events after the operation that raised them has committed.
 */
@FunctionalInterface
public interface GroupEventListener {

    GroupEventListener NO_OP = event -> { };

    void onEvent(ChamaEvent event);
}
