package io.github.hotbrkm.inviteengine.agent.invite.domain;

/**
 * Invalid scheduling settings, e.g. a minimum lead time greater than the maximum.
 * <p>
 * Fatal for the whole operation: callers must surface it before any recipient is processed.
 */
public class SchedulingConfigurationException extends RuntimeException {

    public SchedulingConfigurationException(String message) {
        super(message);
    }

    public SchedulingConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
