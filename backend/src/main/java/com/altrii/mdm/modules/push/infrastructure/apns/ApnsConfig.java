package com.altrii.mdm.modules.push.infrastructure.apns;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.time.Clock;

import com.altrii.mdm.global.config.MdmProperties;
import com.altrii.mdm.global.crypto.PemReader;
import com.altrii.mdm.modules.push.domain.PushGateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(value = "mdm.apns.enabled", havingValue = "true")
public class ApnsConfig {

    private static final Logger log = LoggerFactory.getLogger(ApnsConfig.class);

    @Bean
    public ApnsProviderTokenFactory apnsProviderTokenFactory(MdmProperties properties, Clock clock) throws IOException {
        MdmProperties.ApnsConfig apns = properties.getApns();
        PrivateKey key = PemReader.readPrivateKey(Path.of(apns.getKeyPath()));
        return new ApnsProviderTokenFactory(key, apns.getKeyId(), apns.getTeamId(), apns.getTokenTtl(), clock);
    }

    @Bean
    public PushGateway apnsPushGateway(MdmProperties properties, ApnsProviderTokenFactory tokenFactory) {
        MdmProperties.ApnsConfig apns = properties.getApns();
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .connectTimeout(apns.getRequestTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(apns.getRequestTimeout());
        RestClient restClient = RestClient.builder()
                .baseUrl(apns.getHost())
                .requestFactory(requestFactory)
                .build();
        log.info("APNs push enabled against {} for topic {}", apns.getHost(), properties.getTopic());
        return new ApnsPushGateway(restClient, tokenFactory, properties.getTopic());
    }
}
