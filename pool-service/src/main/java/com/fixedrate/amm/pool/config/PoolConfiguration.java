package com.fixedrate.amm.pool.config;

import com.fixedrate.amm.config.AmmProperties;
import com.fixedrate.amm.config.PoolConfig;
import com.fixedrate.amm.pool.CheckpointKeeper;
import com.fixedrate.amm.pool.PositionLedger;
import com.fixedrate.amm.pool.port.PositionTokenLedger;
import com.fixedrate.amm.pool.port.YieldSource;
import com.fixedrate.amm.pool.sim.InMemoryFungibleToken;
import com.fixedrate.amm.pool.sim.InMemoryPositionTokenLedger;
import com.fixedrate.amm.pool.sim.SimulatedYieldSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

import static com.fixedrate.amm.math.FixedPointMath.wadToRay;

/**
 * Wires one pool from {@code amm.pool}. Without a real vault or position store on the context the pool
 * runs against the in-memory simulations, with the vault index starting at the configured initial
 * vault share price.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(AmmProperties.class)
public class PoolConfiguration {

  @Bean
  public PoolConfig poolConfig(AmmProperties properties) {
    PoolConfig config = PoolConfig.from(properties.pool());
    log.info("pool configuration loaded: address={}, positionDuration={}s, checkpointDuration={}s, timeStretch={}, fees={}",
        config.poolAddress(), config.positionDuration(), config.checkpointDuration(), config.timeStretch(), config.fees());
    return config;
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean
  public InMemoryFungibleToken baseToken() {
    return new InMemoryFungibleToken("BASE");
  }

  @Bean
  public InMemoryFungibleToken vaultShareToken() {
    return new InMemoryFungibleToken("SHARES");
  }

  @Bean
  @ConditionalOnMissingBean(YieldSource.class)
  public SimulatedYieldSource simulatedYieldSource(PoolConfig config, InMemoryFungibleToken baseToken,
                                                   InMemoryFungibleToken vaultShareToken) {
    log.info("no yield source configured, using simulated vault for pool {}", config.poolAddress());
    return new SimulatedYieldSource(config.poolAddress(), baseToken, vaultShareToken,
        wadToRay(config.initialVaultSharePrice()));
  }

  @Bean
  @ConditionalOnMissingBean
  public PositionTokenLedger positionTokenLedger() {
    return new InMemoryPositionTokenLedger();
  }

  @Bean
  public PositionLedger positionLedger(PoolConfig config, YieldSource yieldSource, PositionTokenLedger tokens,
                                       Clock clock, MeterRegistry meterRegistry) {
    return new PositionLedger(config, yieldSource, tokens, clock, meterRegistry);
  }

  @Bean
  @ConditionalOnProperty(prefix = "amm.pool", name = "checkpoint-keeper-enabled", havingValue = "true")
  public CheckpointKeeper checkpointKeeper(PositionLedger ledger) {
    log.info("checkpoint keeper enabled for pool {}", ledger.address());
    return new CheckpointKeeper(ledger);
  }
}
