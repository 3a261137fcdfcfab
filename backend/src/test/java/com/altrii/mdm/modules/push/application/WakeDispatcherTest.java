package com.altrii.mdm.modules.push.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.altrii.mdm.modules.push.domain.PushGateway;
import com.altrii.mdm.modules.push.domain.PushResult;
import com.altrii.mdm.modules.push.domain.WakeRequested;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WakeDispatcherTest {

    private static final byte[] TOKEN = {0x01, 0x02};

    @Mock
    private PushGateway pushGateway;

    private WakeDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new WakeDispatcher(pushGateway);
    }

    @Test
    @DisplayName("a wake with credentials goes to the gateway")
    void dispatch_delivers() {
        when(pushGateway.wake("device-1", TOKEN, "magic")).thenReturn(PushResult.delivered(200, "apns-1"));

        PushResult result = dispatcher.dispatch(new WakeRequested("device-1", TOKEN, "magic", "command_enqueued"));

        assertThat(result.delivered()).isTrue();
        assertThat(result.apnsId()).isEqualTo("apns-1");
    }

    @Test
    @DisplayName("a device without a push token is skipped")
    void dispatch_skipsWithoutToken() {
        PushResult result = dispatcher.dispatch(new WakeRequested("device-1", null, "magic", "verification"));

        assertThat(result.outcome()).isEqualTo(PushResult.Outcome.SKIPPED);
        verify(pushGateway, never()).wake(anyString(), any(), anyString());
    }

    @Test
    @DisplayName("a gateway exception becomes a rejected result")
    void dispatch_gatewayThrows() {
        when(pushGateway.wake(eq("device-1"), any(), eq("magic"))).thenThrow(new IllegalStateException("boom"));

        PushResult result = dispatcher.dispatch(new WakeRequested("device-1", TOKEN, "magic", "token_update"));

        assertThat(result.outcome()).isEqualTo(PushResult.Outcome.REJECTED);
        assertThat(result.failureReason()).isEqualTo("boom");
    }
}
