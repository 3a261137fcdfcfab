package com.altrii.mdm.modules.push.infrastructure.apns;

import java.util.HexFormat;
import java.util.Map;

import com.altrii.mdm.modules.push.domain.PushGateway;
import com.altrii.mdm.modules.push.domain.PushResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

public class ApnsPushGateway implements PushGateway {

    private static final Logger log = LoggerFactory.getLogger(ApnsPushGateway.class);

    private final RestClient restClient;
    private final ApnsProviderTokenFactory tokenFactory;
    private final String topic;

    public ApnsPushGateway(RestClient restClient, ApnsProviderTokenFactory tokenFactory, String topic) {
        this.restClient = restClient;
        this.tokenFactory = tokenFactory;
        this.topic = topic;
    }

    @Override
    public PushResult wake(String deviceId, byte[] pushToken, String pushMagic) {
        String deviceToken = HexFormat.of().formatHex(pushToken);
        try {
            ResponseEntity<Void> response = restClient.post()
                    .uri("/3/device/{token}", deviceToken)
                    .header("authorization", "bearer " + tokenFactory.currentToken())
                    .header("apns-topic", topic)
                    .header("apns-push-type", "mdm")
                    .header("apns-priority", "5")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("mdm", pushMagic))
                    .retrieve()
                    .toBodilessEntity();
            String apnsId = response.getHeaders().getFirst("apns-id");
            log.info("Push sent to device {} (apns-id {})", deviceId, apnsId);
            return PushResult.delivered(response.getStatusCode().value(), apnsId);
        } catch (RestClientResponseException ex) {
            if (ex.getStatusCode().value() == HttpStatus.FORBIDDEN.value()) {
                // expired or revoked provider token; mint a new one next time
                tokenFactory.invalidate();
            }
            log.error("Push to device {} rejected: {} {}", deviceId, ex.getStatusCode().value(),
                    ex.getResponseBodyAsString());
            return PushResult.rejected(ex.getStatusCode().value(), ex.getResponseBodyAsString());
        } catch (RestClientException ex) {
            log.error("Push to device {} failed", deviceId, ex);
            return PushResult.rejected(0, ex.getMessage());
        }
    }
}
