package io.doat4j.config;

import io.doat4j.DoAt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the DoAt wake runner once the context is up and stops it first on shutdown.
 *
 * <p>Running state is read from the runner itself: a runner that stopped on its own after repeated
 * storage failures is reported as not running, so a later context start restarts it.
 */
public class DoAtLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(DoAtLifecycle.class);

    // last to start, first to stop
    static final int PHASE = Integer.MAX_VALUE;

    private final DoAt doAt;

    public DoAtLifecycle(DoAt doAt) {
        this.doAt = doAt;
    }

    @Override
    public void start() {
        if (doAt.isStarted()) {
            return;
        }
        doAt.start();
    }

    @Override
    public void stop() {
        if (!doAt.isStarted()) {
            log.debug("DoAt runner already stopped");
            return;
        }
        doAt.stop();
    }

    @Override
    public boolean isRunning() {
        return doAt.isStarted();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
