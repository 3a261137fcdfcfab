package com.altrii.mdm.modules.profile.domain;

import java.util.List;

public final class SupervisionCatalog {

    public static final String PROFILE_IDENTIFIER_PREFIX = "com.altriirecovery.supervision";
    public static final String DISPLAY_NAME = "Altrii Recovery - Maximum Protection";
    public static final String ORGANIZATION = "Altrii Recovery";

    /**
     * Operator service domains. These and their subdomains are never blocked.
     */
    public static final List<String> OPERATOR_DOMAINS = List.of(
            "altriirecovery.com",
            "www.altriirecovery.com",
            "app.altriirecovery.com",
            "api.altriirecovery.com"
    );

    /**
     * Reachable under every policy: operator services, platform essentials, emergency and
     * crisis lines.
     */
    public static final List<String> ALWAYS_ALLOWED = List.of(
            "apple.com",
            "icloud.com",
            "icloud-content.com",
            "cdn-apple.com",
            "mzstatic.com",
            "altriirecovery.com",
            "www.altriirecovery.com",
            "app.altriirecovery.com",
            "api.altriirecovery.com",
            "emergency.gov",
            "911.gov",
            "suicidepreventionlifeline.org",
            "crisistextline.org"
    );

    /**
     * VPN, proxy and privacy browsers that tunnel around the content filter.
     */
    public static final List<String> CIRCUMVENTION_APPS = List.of(
            "com.opera.OperaMini",
            "com.opera.Opera-Touch",
            "org.torproject.ios",
            "com.tunnelbear.ios.TunnelBear",
            "com.nordvpn.ios",
            "com.expressvpn.ExpressVPN",
            "com.protonvpn.ios",
            "com.cloudflare.onedotonedotonedotone"
    );

    public static final List<String> THIRD_PARTY_BROWSERS = List.of(
            "com.brave.ios.browser",
            "com.mozilla.ios.Firefox",
            "com.mozilla.ios.Focus",
            "com.google.chrome.ios",
            "com.microsoft.msedge",
            "com.duckduckgo.mobile.ios",
            "com.alohabrowser.alohabrowser"
    );

    private SupervisionCatalog() {
    }

    public static String profileIdentifier(String deviceId) {
        return PROFILE_IDENTIFIER_PREFIX + "." + deviceId;
    }

    public static boolean isSupervisionProfile(String payloadIdentifier) {
        return payloadIdentifier != null && payloadIdentifier.startsWith(PROFILE_IDENTIFIER_PREFIX);
    }
}
