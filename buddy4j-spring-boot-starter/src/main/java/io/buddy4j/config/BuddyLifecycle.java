package io.buddy4j.config;

import io.buddy4j.Buddy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Bridges Buddy start/stop lifecycle with the Spring container lifecycle.
 *
 * <p>Runs in the last phase, so handler beans and the task store's collaborators are ready before the
 * dispatcher takes work and stay up until it has drained. With {@code buddy.auto-startup=false} the
 * application starts it explicitly.
 */
public class BuddyLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(BuddyLifecycle.class);

    private final Buddy buddy;
    private final BuddyProperties props;

    public BuddyLifecycle(Buddy buddy, BuddyProperties props) {
        this.buddy = Objects.requireNonNull(buddy, "buddy must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public void start() {
        buddy.start();
    }

    @Override
    public void stop() {
        buddy.stop();
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return buddy.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        if (!props.isAutoStartup()) {
            log.info("Buddy auto-startup disabled; call start() to begin dispatching");
        }
        return props.isAutoStartup();
    }
}
