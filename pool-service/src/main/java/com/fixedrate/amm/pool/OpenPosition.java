package com.fixedrate.amm.pool;

import java.math.BigInteger;

/**
 * @param maturityTime when the opened bonds mature
 * @param bondAmount   bonds credited to the position
 * @param amountPaid   base or shares taken from the trader, per the trade's options
 */
public record OpenPosition(long maturityTime, BigInteger bondAmount, BigInteger amountPaid) {
}
