package com.fixedrate.amm.matching.signature;

import lombok.NonNull;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.util.function.Supplier;

/**
 * Builds the JSON-RPC client on first use so a node that is down at startup does not fail the context.
 */
public class LazyWeb3j implements Supplier<Web3j> {

  private final String rpcUrl;
  private volatile Web3j web3j;

  public LazyWeb3j(@NonNull String rpcUrl) {
    this.rpcUrl = rpcUrl;
  }

  @Override
  public Web3j get() {
    Web3j existing = web3j;
    if (existing != null) {
      return existing;
    }
    synchronized (this) {
      if (web3j == null) {
        web3j = Web3j.build(new HttpService(rpcUrl));
      }
      return web3j;
    }
  }
}
