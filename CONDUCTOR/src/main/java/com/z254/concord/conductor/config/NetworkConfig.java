package com.z254.concord.conductor.config;

import com.z254.concord.conductor.network.AgentIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Signing identity of the conductor on the event network.
 */
@Configuration
@Slf4j
public class NetworkConfig {

    @Bean
    public AgentIdentity orchestratorIdentity(ConductorProperties properties) {
        ConductorProperties.NetworkProperties.IdentityProperties identity = properties.getNetwork().getIdentity();
        if (StringUtils.hasText(identity.getPrivateKey()) && StringUtils.hasText(identity.getPublicKey())) {
            AgentIdentity restored = AgentIdentity.fromHex(identity.getPrivateKey(), identity.getPublicKey());
            log.info("Loaded orchestrator identity {}", restored.publicKeyHex());
            return restored;
        }
        AgentIdentity generated = AgentIdentity.generate();
        log.warn("No orchestrator identity configured, generated ephemeral key {}. "
                + "Agents addressing a previous key will not reach this instance.", generated.publicKeyHex());
        return generated;
    }
}
