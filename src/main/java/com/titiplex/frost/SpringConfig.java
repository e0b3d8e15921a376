package com.titiplex.frost;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class SpringConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
