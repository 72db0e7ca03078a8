package io.github.hotbrkm.inviteengine.agent.invite.domain;

import java.util.Locale;

public final class EmailAddressUtil {
    /**
     * Label used when the address has no usable domain part
     */
    public static final String INVALID = "INVALID";

    private EmailAddressUtil() {}

    /**
     * Lower-cased bare address, with any display name and angle brackets removed.
     */
    public static String normalize(String email) {
        if (email == null) {
            return "";
        }
        String addr = email.trim();
        int lt = addr.indexOf('<');
        int gt = addr.indexOf('>');
        if (lt >= 0 && gt > lt) {
            addr = addr.substring(lt + 1, gt).trim();
        }
        return addr.toLowerCase(Locale.ROOT);
    }

    public static String extractDomain(String email) {
        String addr = normalize(email);
        if (addr.isEmpty()) {
            return INVALID;
        }
        int at = addr.lastIndexOf('@');
        if (at <= 0 || at >= addr.length() - 1) {
            return INVALID;
        }
        String dom = addr.substring(at + 1).trim();
        if (dom.endsWith(".")) {
            dom = dom.substring(0, dom.length() - 1);
        }
        if (dom.length() <= 2 || dom.indexOf('.') < 0 || dom.indexOf(' ') != -1) {
            return INVALID;
        }
        return dom;
    }
}
