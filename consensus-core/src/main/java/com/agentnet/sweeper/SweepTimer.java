package com.agentnet.sweeper;

public interface SweepTimer {
    /**
     * Start running the sweep handler periodically
     */
    void start();

    /**
     * Stop running the sweep handler; a sweep already in progress finishes
     */
    void stop();

    /**
     * Set the handler to be called on every tick
     */
    void setSweepHandler(Runnable handler);

    /**
     * Stop and release the scheduler thread
     */
    void shutdown();
}
