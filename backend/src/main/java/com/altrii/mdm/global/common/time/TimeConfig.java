package com.altrii.mdm.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

    @Bean
    public Clock mdmClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
