package com.example.triage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.example.triage.config.ChannelProperties;
import com.example.triage.config.LlmProperties;
import com.example.triage.config.TriageProperties;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({LlmProperties.class, TriageProperties.class, ChannelProperties.class})
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
