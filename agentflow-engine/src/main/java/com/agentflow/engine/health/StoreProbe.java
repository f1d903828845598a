package com.agentflow.engine.health;

/**
 * Reachability check of the state store.
 */
public interface StoreProbe {

    String name();

    boolean isAvailable();

    /**
     * Probe for the in-process store, which is always reachable.
     */
    static StoreProbe inMemory() {
        return new StoreProbe() {
            @Override
            public String name() {
                return "in-memory";
            }

            @Override
            public boolean isAvailable() {
                return true;
            }
        };
    }
}
