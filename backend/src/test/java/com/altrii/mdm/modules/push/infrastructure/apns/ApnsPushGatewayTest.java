package com.altrii.mdm.modules.push.infrastructure.apns;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.altrii.mdm.modules.push.domain.PushResult;
import com.altrii.mdm.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class ApnsPushGatewayTest {

    private static final byte[] TOKEN = {(byte) 0xab, 0x01, 0x7f};

    private MockRestServiceServer server;
    private MutableClock clock;
    private ApnsProviderTokenFactory tokenFactory;
    private ApnsPushGateway gateway;

    @BeforeEach
    void setUp() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(256);
        KeyPair keyPair = generator.generateKeyPair();
        clock = new MutableClock(OffsetDateTime.of(2025, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC).toInstant());
        tokenFactory = new ApnsProviderTokenFactory(keyPair.getPrivate(), "KEY123", "TEAM456",
                Duration.ofMinutes(50), clock);

        RestClient.Builder builder = RestClient.builder().baseUrl("https://apns.example.com");
        server = MockRestServiceServer.bindTo(builder).build();
        gateway = new ApnsPushGateway(builder.build(), tokenFactory, "com.example.mdm");
    }

    @Test
    @DisplayName("sends an MDM push with the hex token path and push magic body")
    void wake_delivered() {
        HttpHeaders responseHeaders = new HttpHeaders();
        responseHeaders.add("apns-id", "8f1e0000-0000-0000-0000-000000000001");
        server.expect(requestTo("https://apns.example.com/3/device/ab017f"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("apns-topic", "com.example.mdm"))
                .andExpect(header("apns-push-type", "mdm"))
                .andExpect(header("authorization", "bearer " + tokenFactory.currentToken()))
                .andExpect(content().json("{\"mdm\":\"magic-1\"}"))
                .andRespond(withSuccess().headers(responseHeaders).contentType(MediaType.APPLICATION_JSON));

        PushResult result = gateway.wake("device-1", TOKEN, "magic-1");

        assertThat(result.delivered()).isTrue();
        assertThat(result.apnsId()).isEqualTo("8f1e0000-0000-0000-0000-000000000001");
        server.verify();
    }

    @Test
    @DisplayName("a rejected push is reported with status and reason")
    void wake_rejected() {
        server.expect(requestTo("https://apns.example.com/3/device/ab017f"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"reason\":\"BadDeviceToken\"}"));

        PushResult result = gateway.wake("device-1", TOKEN, "magic-1");

        assertThat(result.outcome()).isEqualTo(PushResult.Outcome.REJECTED);
        assertThat(result.statusCode()).isEqualTo(400);
        assertThat(result.failureReason()).contains("BadDeviceToken");
    }

    @Test
    @DisplayName("a 403 drops the cached provider token")
    void wake_forbiddenInvalidatesToken() {
        String before = tokenFactory.currentToken();
        server.expect(requestTo("https://apns.example.com/3/device/ab017f"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN).body("{\"reason\":\"ExpiredProviderToken\"}"));

        gateway.wake("device-1", TOKEN, "magic-1");
        clock.advance(Duration.ofSeconds(1));

        assertThat(tokenFactory.currentToken()).isNotEqualTo(before);
    }

    @Test
    @DisplayName("the provider token is reused until its lifetime elapses")
    void providerToken_cached() {
        String first = tokenFactory.currentToken();
        clock.advance(Duration.ofMinutes(49));
        assertThat(tokenFactory.currentToken()).isEqualTo(first);

        clock.advance(Duration.ofMinutes(2));
        assertThat(tokenFactory.currentToken()).isNotEqualTo(first);
    }
}
