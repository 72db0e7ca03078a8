package io.github.hotbrkm.inviteengine.agent.invite.schedule.reservation;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One {@link ReentrantLock} per inbox id.
 * <p>
 * A thread may hold at most one inbox lock at a time; asking for a second inbox while holding one fails
 * immediately. Re-entering the lock already held is allowed.
 */
@Slf4j
public class InboxLockManager {

    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofMillis(2000);

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ThreadLocal<String> heldInboxId = new ThreadLocal<>();
    private final Duration lockTimeout;

    public InboxLockManager() {
        this(DEFAULT_LOCK_TIMEOUT);
    }

    public InboxLockManager(Duration lockTimeout) {
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout must not be null");
        if (lockTimeout.isNegative()) {
            throw new IllegalArgumentException("lockTimeout must not be negative: " + lockTimeout);
        }
    }

    /**
     * Runs {@code action} while holding the lock of {@code inboxId}.
     *
     * @throws InboxLockTimeoutException if the lock is not acquired within the configured timeout
     */
    public <T> T withLock(String inboxId, Supplier<T> action) {
        String held = heldInboxId.get();
        if (held != null && !held.equals(inboxId)) {
            throw new IllegalStateException("Thread already holds lock of inbox " + held + ", refusing " + inboxId);
        }

        ReentrantLock lock = locks.computeIfAbsent(inboxId, k -> new ReentrantLock());
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("inboxId={}, timeoutMs={}, event=inbox_lock_timeout", inboxId, lockTimeout.toMillis());
                throw new InboxLockTimeoutException(inboxId, lockTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InboxLockTimeoutException(inboxId, e);
        }

        boolean outermost = held == null;
        if (outermost) {
            heldInboxId.set(inboxId);
        }
        try {
            return action.get();
        } finally {
            if (outermost) {
                heldInboxId.remove();
            }
            lock.unlock();
        }
    }

    public void withLock(String inboxId, Runnable action) {
        withLock(inboxId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * True if some thread currently holds the lock of {@code inboxId}. For monitoring and tests.
     */
    public boolean isLocked(String inboxId) {
        ReentrantLock lock = locks.get(inboxId);
        return lock != null && lock.isLocked();
    }

    public Duration lockTimeout() {
        return lockTimeout;
    }
}
