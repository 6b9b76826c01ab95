package com.chamapool.chama.config;

import com.chamapool.chama.engine.EngineSettings;
import com.chamapool.chama.registry.RegistrySettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "chama")
public class ChamaProperties {

    private EngineProperties engine = new EngineProperties();
    private RegistryProperties registry = new RegistryProperties();
    private EventProperties events = new EventProperties();

    @Data
    public static class EngineProperties {
        private Duration periodDuration = Duration.ofDays(7);
        private Duration contributionWindow = Duration.ofDays(5);
        private Duration gracePeriod = Duration.ofDays(2);
        private Integer defaultFinePercent = 10;
        private Integer maxMissedContributions = 3;
        private Integer fineEscalationThreshold = 3;
        private Integer quorumPercent = 50;
        private Duration proposalDuration = Duration.ofDays(3);
    }

    @Data
    public static class RegistryProperties {
        private String owner;
        private Integer maxNameLength = 50;
        private BigDecimal minContribution = new BigDecimal("0.001");
        private BigDecimal maxContribution = new BigDecimal("100");
        private Integer minMembers = 3;
        private Integer maxMembers = 100;
        private Duration maxGroupDuration = Duration.ofDays(365);
        private Integer maxGroupsPerCreator = 10;
    }

    @Data
    public static class EventProperties {
        private String topic = "chama-group-events";
        private Boolean enabled = true;
    }

    public EngineSettings toEngineSettings() {
        return EngineSettings.builder()
                .periodDuration(engine.getPeriodDuration())
                .defaultContributionWindow(engine.getContributionWindow())
                .defaultGracePeriod(engine.getGracePeriod())
                .defaultFinePercent(engine.getDefaultFinePercent())
                .maxMissedContributions(engine.getMaxMissedContributions())
                .fineEscalationThreshold(engine.getFineEscalationThreshold())
                .quorumPercent(engine.getQuorumPercent())
                .proposalDuration(engine.getProposalDuration())
                .build();
    }

    public RegistrySettings toRegistrySettings() {
        return RegistrySettings.builder()
                .owner(registry.getOwner())
                .maxNameLength(registry.getMaxNameLength())
                .minContribution(registry.getMinContribution())
                .maxContribution(registry.getMaxContribution())
                .minMembers(registry.getMinMembers())
                .maxMembers(registry.getMaxMembers())
                .maxGroupDuration(registry.getMaxGroupDuration())
                .maxGroupsPerCreator(registry.getMaxGroupsPerCreator())
                .build();
    }
}
