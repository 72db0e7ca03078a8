package io.github.hotbrkm.inviteengine.agent.invite.send.queue;

/**
 * Waits between retry attempts. Replaceable so tests do not sleep.
 */
@FunctionalInterface
public interface RetryDelayer {

    void delay(long millis) throws InterruptedException;

    static RetryDelayer sleeping() {
        return millis -> {
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
}
