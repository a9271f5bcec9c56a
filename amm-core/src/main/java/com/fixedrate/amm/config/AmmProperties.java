package com.fixedrate.amm.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix="amm")
public record AmmProperties(
    @Valid Pool pool,
    @Valid Matching matching
) {

  public AmmProperties {
    if (pool == null) {
      pool = defaultPool();
    }
    if (matching == null) {
      matching = defaultMatching();
    }
  }

  private static Pool defaultPool() {
    return new Pool(null, null, null, null, null, null, null, null, null, null);
  }

  private static Fees defaultFees() {
    return new Fees(null, null, null);
  }

  private static Matching defaultMatching() {
    return new Matching(null, null, null, null, null, null);
  }

  public record Pool(
      String address,
      @Positive BigDecimal initialVaultSharePrice,
      @NotNull @Positive Long positionDurationSeconds,
      @NotNull @Positive Long checkpointDurationSeconds,
      /**
       * Curve time stretch. When unset it is derived from {@code initialApr}.
       */
      BigDecimal timeStretch,
      @NotNull @Positive BigDecimal initialApr,
      @NotNull @DecimalMin("0") BigDecimal minimumTransactionAmount,
      @Valid Fees fees,
      String feeCollector,
      /**
       * Run the checkpoint keeper on a fixed delay. Trades still checkpoint lazily when disabled.
       */
      Boolean checkpointKeeperEnabled
  ) {
    public Pool {
      if (address == null || address.isBlank()) {
        address = "0x00000000000000000000000000000000000a4d01";
      }
      if (initialVaultSharePrice == null) {
        initialVaultSharePrice = BigDecimal.ONE;
      }
      if (positionDurationSeconds == null) {
        positionDurationSeconds = 365L * 24 * 60 * 60;
      }
      if (checkpointDurationSeconds == null) {
        checkpointDurationSeconds = 24L * 60 * 60;
      }
      if (initialApr == null) {
        initialApr = new BigDecimal("0.05");
      }
      if (minimumTransactionAmount == null) {
        minimumTransactionAmount = new BigDecimal("0.001");
      }
      if (fees == null) {
        fees = defaultFees();
      }
      if (feeCollector == null || feeCollector.isBlank()) {
        feeCollector = "0x00000000000000000000000000000000000fee01";
      }
      if (checkpointKeeperEnabled == null) {
        checkpointKeeperEnabled = false;
      }
    }
  }

  public record Fees(
      @DecimalMin("0") @DecimalMax("1") BigDecimal curve,
      @DecimalMin("0") @DecimalMax("1") BigDecimal flat,
      @DecimalMin("0") @DecimalMax("1") BigDecimal governance
  ) {
    public Fees {
      if (curve == null) {
        curve = new BigDecimal("0.01");
      }
      if (flat == null) {
        flat = new BigDecimal("0.0005");
      }
      if (governance == null) {
        governance = new BigDecimal("0.15");
      }
    }
  }

  public record Matching(
      String address,
      String domainName,
      String domainVersion,
      @Positive Long chainId,
      /**
       * JSON-RPC endpoint used to verify contract-account signatures. When blank, only ECDSA signatures
       * from externally owned accounts are accepted.
       */
      String rpcUrl,
      String engineAccount
  ) {
    public Matching {
      if (address == null || address.isBlank()) {
        address = "0x00000000000000000000000000000000000a4d02";
      }
      if (domainName == null || domainName.isBlank()) {
        domainName = "Fixed Rate Matching Engine";
      }
      if (domainVersion == null || domainVersion.isBlank()) {
        domainVersion = "1";
      }
      if (chainId == null) {
        chainId = 1L;
      }
      if (rpcUrl == null) {
        rpcUrl = "";
      }
      if (engineAccount == null || engineAccount.isBlank()) {
        engineAccount = address;
      }
    }
  }
}
