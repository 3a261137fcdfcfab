package com.altrii.mdm.modules.push.infrastructure.apns;

import java.security.PrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

public class ApnsProviderTokenFactory {

    private final PrivateKey signingKey;
    private final String keyId;
    private final String teamId;
    private final Duration tokenTtl;
    private final Clock clock;

    private String cachedToken;
    private Instant cachedIssuedAt;

    public ApnsProviderTokenFactory(PrivateKey signingKey, String keyId, String teamId, Duration tokenTtl, Clock clock) {
        this.signingKey = signingKey;
        this.keyId = keyId;
        this.teamId = teamId;
        this.tokenTtl = tokenTtl;
        this.clock = clock;
    }

    public synchronized String currentToken() {
        Instant now = clock.instant();
        if (cachedToken != null && now.isBefore(cachedIssuedAt.plus(tokenTtl))) {
            return cachedToken;
        }
        cachedToken = Jwts.builder()
                .header().keyId(keyId).and()
                .issuer(teamId)
                .issuedAt(Date.from(now))
                .signWith(signingKey, SIG.ES256)
                .compact();
        cachedIssuedAt = now;
        return cachedToken;
    }

    public synchronized void invalidate() {
        cachedToken = null;
        cachedIssuedAt = null;
    }
}
