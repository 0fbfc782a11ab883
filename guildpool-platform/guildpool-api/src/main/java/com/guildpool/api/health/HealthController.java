package com.guildpool.api.health;

import com.guildpool.blockchain.service.OnChainRewardPool;
import com.guildpool.core.round.RoundClock;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Health check endpoints.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final RoundClock roundClock;
    private final OnChainRewardPool rewardPool;

    public HealthController(RoundClock roundClock, OnChainRewardPool rewardPool) {
        this.roundClock = roundClock;
        this.rewardPool = rewardPool;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "timestamp", Instant.now().toString()
        ));
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        return ResponseEntity.ok(Map.of(
            "name", "Guildpool Platform API",
            "version", "1.0.0-SNAPSHOT",
            "description", "Group verification and reward distribution",
            "currentRound", roundClock.currentRound(),
            "onChainMirroring", rewardPool.isMirroring(),
            "timestamp", Instant.now().toString()
        ));
    }
}
