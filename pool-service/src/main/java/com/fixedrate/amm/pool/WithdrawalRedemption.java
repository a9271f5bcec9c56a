package com.fixedrate.amm.pool;

import java.math.BigInteger;

public record WithdrawalRedemption(BigInteger proceeds, BigInteger sharesRedeemed) {
}
