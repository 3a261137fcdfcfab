package com.altrii.mdm.modules.profile.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.altrii.mdm.global.config.MdmProperties;
import com.altrii.mdm.modules.device.domain.BlockCategory;
import com.altrii.mdm.modules.profile.domain.BlockingPolicy;
import com.altrii.mdm.modules.profile.domain.ConfigurationProfile;
import com.altrii.mdm.modules.profile.domain.ProfileBuildRequest;
import com.altrii.mdm.modules.profile.domain.SecurityLevel;
import com.altrii.mdm.modules.profile.domain.SupervisionCatalog;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SupervisionProfileBuilderTest {

    private static final String DEVICE = "device-42";
    private static final UUID PROFILE_UUID = UUID.fromString("6f1c7f7e-9a0b-4c55-8d0e-0b5a2f7c1d10");

    private SupervisionProfileBuilder builder;

    @BeforeEach
    void setUp() {
        MdmProperties properties = new MdmProperties();
        properties.setServerUrl("https://mdm.example.com/");
        properties.setTopic("com.example.mdm");
        builder = new SupervisionProfileBuilder(properties);
    }

    @Test
    @DisplayName("level 1 carries only the MDM and content filter payloads")
    void level1_webFilterOnly() {
        ConfigurationProfile profile = builder.build(request(SecurityLevel.WEB_FILTER, BlockingPolicy.defaults()));

        assertThat(profile.payloads()).extracting(payload -> payload.get("PayloadType"))
                .containsExactly(SupervisionProfileBuilder.MDM_PAYLOAD, SupervisionProfileBuilder.CONTENT_FILTER_PAYLOAD);
        assertThat(profile.removalDisallowed()).isFalse();
        assertThat(profile.identifier()).isEqualTo(SupervisionCatalog.profileIdentifier(DEVICE));
    }

    @Test
    @DisplayName("the MDM payload points at the device's server and check-in URLs")
    void mdmPayload_urls() {
        ConfigurationProfile profile = builder.build(request(SecurityLevel.WEB_FILTER, BlockingPolicy.defaults()));

        Map<String, Object> mdm = profile.payload(SupervisionProfileBuilder.MDM_PAYLOAD).orElseThrow();
        assertThat(mdm.get("ServerURL")).isEqualTo("https://mdm.example.com/mdm/server/" + DEVICE);
        assertThat(mdm.get("CheckInURL")).isEqualTo("https://mdm.example.com/mdm/checkin/" + DEVICE);
        assertThat(mdm.get("Topic")).isEqualTo("com.example.mdm");
        assertThat(mdm.get("UseDevelopmentAPNS")).isEqualTo(true);
    }

    @Test
    @DisplayName("level 3 locks app installation, tightens the passcode and disallows removal")
    void level3_maximum() {
        ConfigurationProfile profile = builder.build(request(SecurityLevel.MAXIMUM, BlockingPolicy.defaults()));

        Map<String, Object> restrictions = profile.payload(SupervisionProfileBuilder.RESTRICTIONS_PAYLOAD).orElseThrow();
        Map<String, Object> security = profile.payload(SupervisionProfileBuilder.SECURITY_PAYLOAD).orElseThrow();
        assertThat(restrictions.get("allowAppInstallation")).isEqualTo(false);
        assertThat(restrictions.get("allowEraseContentAndSettings")).isEqualTo(false);
        assertThat(asList(restrictions.get("blacklistedAppBundleIDs")))
                .containsAll(SupervisionCatalog.CIRCUMVENTION_APPS)
                .containsAll(SupervisionCatalog.THIRD_PARTY_BROWSERS);
        assertThat(security.get("maxFailedAttempts")).isEqualTo(5);
        assertThat(profile.removalDisallowed()).isTrue();
    }

    @Test
    @DisplayName("level 2 keeps app installation and leaves browsers alone")
    void level2_restricted() {
        ConfigurationProfile profile = builder.build(request(SecurityLevel.RESTRICTED, BlockingPolicy.defaults()));

        Map<String, Object> restrictions = profile.payload(SupervisionProfileBuilder.RESTRICTIONS_PAYLOAD).orElseThrow();
        Map<String, Object> security = profile.payload(SupervisionProfileBuilder.SECURITY_PAYLOAD).orElseThrow();
        assertThat(restrictions.get("allowAppInstallation")).isEqualTo(true);
        assertThat(asList(restrictions.get("blacklistedAppBundleIDs")))
                .doesNotContainAnyElementsOf(SupervisionCatalog.THIRD_PARTY_BROWSERS);
        assertThat(security.get("maxFailedAttempts")).isEqualTo(10);
        assertThat(profile.removalDisallowed()).isFalse();
    }

    @Test
    @DisplayName("the deny list never contains an always-allowed domain or operator subdomain")
    void denyList_excludesAlwaysAllowed() {
        BlockingPolicy policy = new BlockingPolicy(Set.of(BlockCategory.ADULT),
                List.of(" Apple.com ", "blocked.example", "status.altriirecovery.com", "crisistextline.org", ""),
                List.of(), List.of(), true);

        List<String> denied = builder.compileDenyList(Set.of("casino.example", "icloud.com"), policy);

        assertThat(denied).containsExactlyInAnyOrder("casino.example", "blocked.example");
        assertThat(denied).doesNotContainAnyElementsOf(SupervisionCatalog.ALWAYS_ALLOWED);
    }

    @Test
    @DisplayName("custom allowed domains join the operator allow list")
    void allowList_includesCustomDomains() {
        BlockingPolicy policy = new BlockingPolicy(Set.of(), List.of(), List.of("Library.example"), List.of(), true);

        ConfigurationProfile profile = builder.build(request(SecurityLevel.WEB_FILTER, policy));

        Map<String, Object> filter = profile.payload(SupervisionProfileBuilder.CONTENT_FILTER_PAYLOAD).orElseThrow();
        assertThat(asList(filter.get("WhitelistedURLs")))
                .containsAll(SupervisionCatalog.OPERATOR_DOMAINS)
                .contains("library.example");
        assertThat(filter.get("PermittedURLs")).isEqualTo(SupervisionCatalog.ALWAYS_ALLOWED);
    }

    @Test
    @DisplayName("the same request always builds the same document")
    void build_isDeterministic() {
        ProfileBuildRequest request = request(SecurityLevel.MAXIMUM, BlockingPolicy.defaults());

        assertThat(builder.build(request).document()).isEqualTo(builder.build(request).document());
    }

    private static ProfileBuildRequest request(SecurityLevel level, BlockingPolicy policy) {
        return new ProfileBuildRequest(DEVICE, PROFILE_UUID, level, policy, true, Set.of("adult.example"));
    }

    @SuppressWarnings("unchecked")
    private static List<String> asList(Object value) {
        return (List<String>) value;
    }
}
