package com.altrii.mdm.global.config;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "mdm.api-key",
            "mdm.server-url",
            "mdm.topic"
    };

    private final Environment environment;
    private final MdmProperties properties;

    public EnvironmentValidator(Environment environment, MdmProperties properties) {
        this.environment = environment;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + " is missing");
            }
        }

        String serverUrl = properties.getServerUrl();
        if (serverUrl != null && !serverUrl.isBlank()) {
            try {
                URI uri = URI.create(serverUrl);
                if (uri.getScheme() == null || uri.getHost() == null) {
                    problems.add("mdm.server-url must be an absolute URL");
                }
            } catch (IllegalArgumentException ex) {
                problems.add("mdm.server-url is not a valid URL");
            }
        }

        String storeType = properties.getStore().getType();
        if (!"memory".equals(storeType) && !"redis".equals(storeType)) {
            problems.add("mdm.store.type must be memory or redis");
        }

        MdmProperties.ApnsConfig apns = properties.getApns();
        if (apns.isEnabled() && (isBlank(apns.getKeyPath()) || isBlank(apns.getKeyId()) || isBlank(apns.getTeamId()))) {
            problems.add("mdm.apns.key-path, key-id and team-id are required when APNs is enabled");
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid MDM configuration: " + String.join("; ", problems));
        }

        if (properties.getSigning().getCertificatePath() == null) {
            log.warn("No signing identity configured; supervision profiles will be served unsigned");
        }
        log.info("MDM configuration validated (store={}, apns={})", storeType, apns.isEnabled());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
