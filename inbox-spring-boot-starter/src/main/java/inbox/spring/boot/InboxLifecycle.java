package inbox.spring.boot;

import inbox.Inbox;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the {@link Inbox} once the context is refreshed, so every {@link InboxHandler}
 * is registered before the startup drain.
 *
 * <p>Stopping closes the inbox for good. An inbox cannot be restarted, so a later
 * {@link #start()} is ignored and {@link #isRunning()} stays {@code false}.
 */
public class InboxLifecycle implements SmartLifecycle {

    private final Inbox inbox;
    private volatile boolean running;
    private volatile boolean stopped;

    public InboxLifecycle(Inbox inbox) {
        this.inbox = inbox;
    }

    @Override
    public synchronized void start() {
        if (stopped || running) {
            return;
        }
        inbox.start();
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        running = false;
        inbox.close();
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
