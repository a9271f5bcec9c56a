package com.fixedrate.amm.matching.config;

import com.fixedrate.amm.matching.MatchingEngine;
import com.fixedrate.amm.matching.OrderHasher;
import com.fixedrate.amm.matching.signature.AccountCodeInspector;
import com.fixedrate.amm.matching.signature.SignatureVerifier;
import com.fixedrate.amm.matching.signature.Web3jAccountCodeInspector;
import com.fixedrate.amm.pool.PositionLedger;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class MatchingConfigurationTest {

  private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
      .withUserConfiguration(MatchingConfiguration.class);

  @Test
  void wiresEngineForExternallyOwnedAccountsByDefault() {
    contextRunner.run(context -> {
      assertThat(context).hasSingleBean(MatchingEngine.class);
      assertThat(context).hasSingleBean(PositionLedger.class);
      assertThat(context).hasSingleBean(SignatureVerifier.class);
      assertThat(context).doesNotHaveBean(Web3jAccountCodeInspector.class);
      assertThat(context.getBean(AccountCodeInspector.class).isContract("0x000000000000000000000000000000000000c0de")).isFalse();

      MatchingConfig config = context.getBean(MatchingConfig.class);
      assertThat(config.address()).isEqualTo("0x00000000000000000000000000000000000a4d02");
      assertThat(config.engineAccount()).isEqualTo(config.address());
      assertThat(config.domainName()).isEqualTo("Fixed Rate Matching Engine");
    });
  }

  @Test
  void checksContractAccountsOverRpcWhenConfigured() {
    contextRunner
        .withPropertyValues(
            "amm.matching.rpc-url=http://localhost:8545",
            "amm.matching.chain-id=5",
            "amm.matching.engine-account=0x00000000000000000000000000000000000e4e01")
        .run(context -> {
          assertThat(context).hasSingleBean(Web3jAccountCodeInspector.class);
          assertThat(context.getBean(MatchingEngine.class).engineAccount())
              .isEqualTo("0x00000000000000000000000000000000000e4e01");
          assertThat(context.getBean(OrderHasher.class).domainSeparator())
              .isNotEqualTo(new OrderHasher("Fixed Rate Matching Engine", "1", 1L,
                  "0x00000000000000000000000000000000000a4d02").domainSeparator());
        });
  }
}
