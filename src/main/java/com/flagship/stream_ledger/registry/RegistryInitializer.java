package com.flagship.stream_ledger.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Makes sure the registry row exists before the service takes traffic.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegistryInitializer implements ApplicationRunner {

    private final RegistryService registryService;

    @Override
    public void run(ApplicationArguments args) {
        if (!registryService.initialize()) {
            log.info("Stream registry already present: {}", registryService.getRegistry());
        }
    }
}
