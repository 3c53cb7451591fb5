package com.z254.concord.conductor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * CONDUCTOR - phase-gated orchestration core for CONCORD agent teams.
 *
 * <p>CONDUCTOR provides:
 * <ul>
 *   <li>Phase State Machine - validated transitions across CHAT, BRAINSTORM, PLAN, EXECUTE,
 *       VERIFICATION, CHORES, REFLECTION and registered custom phases</li>
 *   <li>Routing Engine - completion-service backed decisions on which agents act next</li>
 *   <li>Delegation - fan-out of tagged requests with a suspended wait for every reply</li>
 *   <li>Event Ingestion - exactly-once dispatch of signed network events backed by a
 *       restart-safe processed-event ledger</li>
 *   <li>Inspection API - read and steer conversations through the same operations</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class ConductorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConductorApplication.class, args);
    }
}
