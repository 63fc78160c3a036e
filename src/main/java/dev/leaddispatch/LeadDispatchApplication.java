package dev.leaddispatch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class LeadDispatchApplication implements CommandLineRunner {

    private final CommandRunner commandRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(LeadDispatchApplication.class, args);
    }

    @Override
    public void run(String... args) {
        int status;
        try {
            status = commandRunner.execute(args);
        } catch (Exception e) {
            log.error("Lead Dispatch failed: {}", e.getMessage(), e);
            status = 1;
        }
        exitManager.exit(status);
    }
}
