package com.altrii.mdm.modules.supervision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.altrii.mdm.global.plist.PropertyListCodec;
import com.altrii.mdm.global.security.ApiKeyAuthenticationFilter;
import com.altrii.mdm.modules.device.domain.DeviceRecord;
import com.altrii.mdm.modules.device.infrastructure.persistence.DeviceRecordRepository;
import com.altrii.mdm.modules.enrollment.presentation.EnrollmentController;
import com.altrii.mdm.modules.profile.domain.SupervisionCatalog;
import com.altrii.mdm.support.AbstractPostgresIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest(properties = {
        "mdm.api-key=integration-key",
        "mdm.server-url=https://mdm.test.local",
        "mdm.entitlement.default-tier=PREMIUM"
})
@AutoConfigureMockMvc
class SupervisionFlowIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String API_KEY = "integration-key";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PropertyListCodec codec;

    @Autowired
    private DeviceRecordRepository deviceRecordRepository;

    private String deviceId;

    @BeforeEach
    void registerDevice() {
        deviceId = UUID.randomUUID().toString();
        DeviceRecord device = new DeviceRecord();
        device.setDeviceId(deviceId);
        device.setUserId("user-" + deviceId.substring(0, 8));
        device.setDeviceName("Test iPhone");
        deviceRecordRepository.save(device);
    }

    @Test
    void operatorEndpointsRequireTheApiKey() throws Exception {
        mockMvc.perform(get("/mdm/devices/{deviceId}/status", deviceId))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/mdm/devices/{deviceId}/status", deviceId)
                        .header(ApiKeyAuthenticationFilter.API_KEY_HEADER, "wrong-key"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/mdm/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void enrollmentCodeDownloadsTheProfileExactlyOnce() throws Exception {
        String code = generateProfile(2).get("enrollmentCode").asText();

        mockMvc.perform(get("/mdm/enroll/{code}", code))
                .andExpect(status().isOk())
                .andExpect(content().contentType(EnrollmentController.APPLE_CONFIGURATION))
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"supervision.mobileconfig\""));

        mockMvc.perform(get("/mdm/enroll/{code}", code))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("INVALID_CODE"));

        mockMvc.perform(post("/mdm/enroll")
                        .header(ApiKeyAuthenticationFilter.API_KEY_HEADER, API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "deviceId", deviceId,
                                "userId", "user-" + deviceId.substring(0, 8)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ENROLLED"));
    }

    @Test
    void checkInThenVerificationRoundTrip() throws Exception {
        generateProfile(3);

        checkIn(Map.of("MessageType", "Authenticate", "UDID", "UDID-" + deviceId, "Model", "iPhone15,2",
                "OSVersion", "17.4", "IsSupervised", true));
        checkIn(Map.of("MessageType", "TokenUpdate", "Token", new byte[]{0x01, 0x02, 0x03},
                "PushMagic", "magic-" + deviceId));

        mockMvc.perform(post("/mdm/devices/{deviceId}/verify", deviceId)
                        .header(ApiKeyAuthenticationFilter.API_KEY_HEADER, API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.commandsSent").value(4))
                .andExpect(jsonPath("$.wakeRequested").value(true));

        List<String> delivered = new ArrayList<>();
        Map<String, Object> command = exchange(Map.of("Status", "Idle", "UDID", "UDID-" + deviceId));
        while (command != null) {
            @SuppressWarnings("unchecked")
            Map<String, Object> body = (Map<String, Object>) command.get("Command");
            String requestType = (String) body.get("RequestType");
            delivered.add(requestType);

            Map<String, Object> report = new LinkedHashMap<>();
            report.put("Status", "Acknowledged");
            report.put("UDID", "UDID-" + deviceId);
            report.put("CommandUUID", command.get("CommandUUID"));
            if ("ProfileList".equals(requestType)) {
                report.put("ProfileList", List.of(Map.of(
                        "PayloadIdentifier", SupervisionCatalog.profileIdentifier(deviceId),
                        "PayloadDisplayName", SupervisionCatalog.DISPLAY_NAME)));
            } else if ("SecurityInfo".equals(requestType)) {
                report.put("SecurityInfo", Map.of("IsSupervised", true, "PasscodePresent", true));
            }
            command = exchange(report);
        }

        assertThat(delivered).containsExactly("ProfileList", "SecurityInfo", "Restrictions", "InstalledApplicationList");

        mockMvc.perform(get("/mdm/devices/{deviceId}/status", deviceId)
                        .header(ApiKeyAuthenticationFilter.API_KEY_HEADER, API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.online").value(true))
                .andExpect(jsonPath("$.supervised").value(true))
                .andExpect(jsonPath("$.pendingCommands").value(0))
                .andExpect(jsonPath("$.profileInstalled").value(true))
                .andExpect(jsonPath("$.securityLevel").value(3));
    }

    @Test
    void tokenUpdateBeforeAuthenticateIsRejected() throws Exception {
        mockMvc.perform(put("/mdm/checkin/{deviceId}", deviceId)
                        .contentType(MediaType.APPLICATION_XML)
                        .content(codec.encode(Map.of("MessageType", "TokenUpdate", "Token", new byte[]{0x01},
                                "PushMagic", "magic"))))
                .andExpect(status().isUnauthorized());
    }

    private JsonNode generateProfile(int securityLevel) throws Exception {
        Map<String, Object> request = Map.of(
                "deviceId", deviceId,
                "userId", "user-" + deviceId.substring(0, 8),
                "securityLevel", securityLevel);
        MvcResult result = mockMvc.perform(post("/mdm/profiles/generate")
                        .header(ApiKeyAuthenticationFilter.API_KEY_HEADER, API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(body.get("downloadUrl").asText()).startsWith("/mdm/enroll/");
        return body;
    }

    private void checkIn(Map<String, Object> message) throws Exception {
        mockMvc.perform(put("/mdm/checkin/{deviceId}", deviceId)
                        .contentType(MediaType.APPLICATION_XML)
                        .content(codec.encode(message)))
                .andExpect(status().isOk());
    }

    private Map<String, Object> exchange(Map<String, Object> report) throws Exception {
        MvcResult result = mockMvc.perform(put("/mdm/server/{deviceId}", deviceId)
                        .contentType(MediaType.APPLICATION_XML)
                        .content(codec.encode(report)))
                .andExpect(status().isOk())
                .andReturn();
        byte[] body = result.getResponse().getContentAsByteArray();
        return body.length == 0 ? null : codec.decode(body);
    }
}
