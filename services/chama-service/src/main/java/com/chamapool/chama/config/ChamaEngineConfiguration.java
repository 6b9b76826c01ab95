package com.chamapool.chama.config;

import com.chamapool.chama.engine.EngineSettings;
import com.chamapool.chama.engine.GroupEventListener;
import com.chamapool.chama.engine.ValueTransferGateway;
import com.chamapool.chama.registry.ChamaGroupRegistry;
import com.chamapool.chama.registry.RegistrySettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the group registry from {@code chama.*} properties.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ChamaProperties.class)
public class ChamaEngineConfiguration {

    @Bean
    public EngineSettings engineSettings(ChamaProperties properties) {
        EngineSettings settings = properties.toEngineSettings();
        log.info("Chama engine settings: period={}, window={}, grace={}, quorum={}%, maxMissed={}",
                settings.getPeriodDuration(), settings.getDefaultContributionWindow(),
                settings.getDefaultGracePeriod(), settings.getQuorumPercent(),
                settings.getMaxMissedContributions());
        return settings;
    }

    @Bean
    public RegistrySettings registrySettings(ChamaProperties properties) {
        RegistrySettings settings = properties.toRegistrySettings();
        if (settings.getOwner() == null || settings.getOwner().isBlank()) {
            log.warn("chama.registry.owner is not set; registry pause/unpause will be rejected");
        }
        return settings;
    }

    @Bean
    public ChamaGroupRegistry chamaGroupRegistry(RegistrySettings registrySettings,
                                                 EngineSettings engineSettings,
                                                 Clock clock,
                                                 ValueTransferGateway valueTransferGateway,
                                                 GroupEventListener groupEventListener) {
        return new ChamaGroupRegistry(registrySettings, engineSettings, clock, valueTransferGateway, groupEventListener);
    }
}
