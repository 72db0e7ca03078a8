package io.github.hotbrkm.inviteengine.agent.invite.domain;

/**
 * Response reported by the recipient's calendar.
 */
public enum RsvpStatus {
    ACCEPTED(SlotStatus.ACCEPTED),
    DECLINED(SlotStatus.DECLINED),
    TENTATIVE(SlotStatus.TENTATIVE);

    private final SlotStatus slotStatus;

    RsvpStatus(SlotStatus slotStatus) {
        this.slotStatus = slotStatus;
    }

    public SlotStatus toSlotStatus() {
        return slotStatus;
    }
}
