package io.github.hotbrkm.inviteengine.agent.invite.domain;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Picks the timezone string handed to the slot calculator for a recipient.
 * <p>
 * An explicit recipient timezone always wins. Otherwise, when detection is enabled, the mail domain is looked up
 * in the configured domain table. The returned value is not validated here; an unknown zone is handled by the
 * slot calculator, which falls back to the default zone and flags the slot for review.
 */
public class RecipientTimezoneResolver {

    private final Map<String, String> domainZones = new HashMap<>();

    public RecipientTimezoneResolver(Map<String, String> domainZones) {
        Map<String, String> safe = domainZones == null ? Collections.emptyMap() : domainZones;
        safe.forEach((domain, zone) -> {
            if (domain != null && zone != null && !zone.isBlank()) {
                this.domainZones.put(domain.toLowerCase(Locale.ROOT), zone.trim());
            }
        });
    }

    public static RecipientTimezoneResolver none() {
        return new RecipientTimezoneResolver(Map.of());
    }

    /**
     * @return the timezone id to use, or {@code null} when nothing is known about the recipient
     */
    public String resolve(Recipient recipient, SchedulingSettings settings) {
        if (recipient.timezone() != null && !recipient.timezone().isBlank()) {
            return recipient.timezone().trim();
        }
        if (!settings.enableTimezoneDetection()) {
            return null;
        }
        String domain = EmailAddressUtil.extractDomain(recipient.email());
        if (EmailAddressUtil.INVALID.equals(domain)) {
            return null;
        }
        return domainZones.get(domain);
    }

    public Map<String, String> domainZones() {
        return Collections.unmodifiableMap(domainZones);
    }
}
