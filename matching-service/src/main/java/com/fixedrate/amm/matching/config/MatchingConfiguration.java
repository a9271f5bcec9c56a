package com.fixedrate.amm.matching.config;

import com.fixedrate.amm.config.AmmProperties;
import com.fixedrate.amm.matching.MatchingEngine;
import com.fixedrate.amm.matching.OrderHasher;
import com.fixedrate.amm.matching.signature.AccountCodeInspector;
import com.fixedrate.amm.matching.signature.CompositeSignatureVerifier;
import com.fixedrate.amm.matching.signature.ContractSignatureValidator;
import com.fixedrate.amm.matching.signature.ContractSignatureVerifier;
import com.fixedrate.amm.matching.signature.EcdsaSignatureVerifier;
import com.fixedrate.amm.matching.signature.LazyWeb3j;
import com.fixedrate.amm.matching.signature.SignatureVerifier;
import com.fixedrate.amm.matching.signature.Web3jAccountCodeInspector;
import com.fixedrate.amm.matching.signature.Web3jContractSignatureValidator;
import com.fixedrate.amm.pool.PositionLedger;
import com.fixedrate.amm.pool.config.PoolConfiguration;
import com.fixedrate.amm.pool.sim.InMemoryFungibleToken;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Clock;

/**
 * Wires the matching engine from {@code amm.matching} on top of the pool. Contract-account signatures
 * are checked over JSON-RPC only when {@code amm.matching.rpc-url} is set; otherwise every signer is
 * treated as an externally owned account.
 */
@Slf4j
@Configuration
@Import(PoolConfiguration.class)
public class MatchingConfiguration {

  @Bean
  public MatchingConfig matchingConfig(AmmProperties properties) {
    MatchingConfig config = MatchingConfig.from(properties.matching());
    log.info("matching configuration loaded: address={}, engineAccount={}, domain={} v{}, chainId={}",
        config.address(), config.engineAccount(), config.domainName(), config.domainVersion(), config.chainId());
    return config;
  }

  @Bean
  public OrderHasher orderHasher(MatchingConfig config) {
    return new OrderHasher(config.domainName(), config.domainVersion(), config.chainId(), config.address());
  }

  @Bean
  @ConditionalOnMissingBean
  public AccountCodeInspector accountCodeInspector(AmmProperties properties) {
    String rpcUrl = properties.matching().rpcUrl();
    if (rpcUrl.isBlank()) {
      log.info("no amm.matching.rpc-url set, contract-account signatures are not supported");
      return AccountCodeInspector.externallyOwnedOnly();
    }
    return new Web3jAccountCodeInspector(new LazyWeb3j(rpcUrl));
  }

  @Bean
  @ConditionalOnMissingBean
  public ContractSignatureValidator contractSignatureValidator(AmmProperties properties) {
    String rpcUrl = properties.matching().rpcUrl();
    if (rpcUrl.isBlank()) {
      return (account, digest, signature) -> false;
    }
    return new Web3jContractSignatureValidator(new LazyWeb3j(rpcUrl));
  }

  @Bean
  @ConditionalOnMissingBean
  public SignatureVerifier signatureVerifier(AccountCodeInspector accountCodeInspector,
                                             ContractSignatureValidator contractSignatureValidator) {
    return new CompositeSignatureVerifier(accountCodeInspector, new EcdsaSignatureVerifier(),
        new ContractSignatureVerifier(contractSignatureValidator));
  }

  @Bean
  public MatchingEngine matchingEngine(MatchingConfig config, PositionLedger positionLedger,
                                       InMemoryFungibleToken baseToken, InMemoryFungibleToken vaultShareToken,
                                       OrderHasher orderHasher, SignatureVerifier signatureVerifier,
                                       Clock clock, MeterRegistry meterRegistry) {
    return new MatchingEngine(config, positionLedger, baseToken, vaultShareToken, orderHasher, signatureVerifier,
        clock, meterRegistry);
  }
}
