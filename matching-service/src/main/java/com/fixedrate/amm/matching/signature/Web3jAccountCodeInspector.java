package com.fixedrate.amm.matching.signature;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.response.EthGetCode;

import java.util.function.Supplier;

/**
 * Looks up deployed code with {@code eth_getCode}. When the node cannot answer the account is treated as
 * externally owned, so its signature still has to recover to the trader's key.
 */
@Slf4j
@RequiredArgsConstructor
public class Web3jAccountCodeInspector implements AccountCodeInspector {

  private final @NonNull Supplier<Web3j> web3j;

  @Override
  public boolean isContract(@NonNull String account) {
    try {
      EthGetCode response = web3j.get().ethGetCode(account, DefaultBlockParameterName.LATEST).send();
      if (response.hasError()) {
        log.warn("eth_getCode failed account={} err={}", account, response.getError().getMessage());
        return false;
      }
      String code = response.getCode();
      return code != null && !code.isBlank() && !"0x".equalsIgnoreCase(code);
    } catch (Exception e) {
      log.warn("eth_getCode failed account={} err={}", account, e.toString());
      return false;
    }
  }
}
