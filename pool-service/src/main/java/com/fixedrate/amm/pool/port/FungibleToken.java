package com.fixedrate.amm.pool.port;

import java.math.BigInteger;

public interface FungibleToken {

  String symbol();

  BigInteger balanceOf(String account);

  void transfer(String from, String to, BigInteger amount);
}
