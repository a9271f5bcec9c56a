package com.fixedrate.amm.matching;

import lombok.NonNull;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Typed structured-data digest of an order: {@code keccak256(0x1901 || domainSeparator || structHash)}.
 * Fields are ABI encoded one word each; the nested options struct contributes its own hash.
 */
public class OrderHasher {

  static final String DOMAIN_TYPE = "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";
  static final String OPTIONS_TYPE = "Options(address destination,bool asBase)";
  static final String ORDER_INTENT_TYPE = "OrderIntent(address trader,address counterparty,address pool,"
      + "uint256 fundAmount,uint256 bondAmount,uint256 minVaultSharePrice,Options options,uint8 orderType,"
      + "uint256 minMaturityTime,uint256 maxMaturityTime,uint256 expiry,bytes32 salt)" + OPTIONS_TYPE;

  private static final byte[] DOMAIN_TYPEHASH = keccak(DOMAIN_TYPE);
  private static final byte[] OPTIONS_TYPEHASH = keccak(OPTIONS_TYPE);
  private static final byte[] ORDER_INTENT_TYPEHASH = keccak(ORDER_INTENT_TYPE);
  private static final byte[] PREFIX = {0x19, 0x01};

  private final byte[] domainSeparator;

  public OrderHasher(@NonNull String name, @NonNull String version, long chainId, @NonNull String verifyingContract) {
    this.domainSeparator = hashWords(List.of(
        new Bytes32(DOMAIN_TYPEHASH),
        new Bytes32(keccak(name)),
        new Bytes32(keccak(version)),
        new Uint256(BigInteger.valueOf(chainId)),
        new Address(verifyingContract)
    ));
  }

  public String domainSeparator() {
    return Numeric.toHexString(domainSeparator);
  }

  public byte[] digest(@NonNull OrderIntent order) {
    byte[] optionsHash = hashWords(List.of(
        new Bytes32(OPTIONS_TYPEHASH),
        new Address(order.options().destination()),
        new Bool(order.options().asBase())
    ));
    byte[] structHash = hashWords(List.of(
        new Bytes32(ORDER_INTENT_TYPEHASH),
        new Address(order.trader()),
        new Address(order.counterparty()),
        new Address(order.pool()),
        new Uint256(order.fundAmount()),
        new Uint256(order.bondAmount()),
        new Uint256(order.minVaultSharePrice()),
        new Bytes32(optionsHash),
        new Uint8(order.orderType().code()),
        new Uint256(BigInteger.valueOf(order.minMaturityTime())),
        new Uint256(BigInteger.valueOf(order.maxMaturityTime())),
        new Uint256(BigInteger.valueOf(order.expiry())),
        new Bytes32(Numeric.toBytesPadded(order.salt(), 32))
    ));

    byte[] payload = new byte[PREFIX.length + domainSeparator.length + structHash.length];
    System.arraycopy(PREFIX, 0, payload, 0, PREFIX.length);
    System.arraycopy(domainSeparator, 0, payload, PREFIX.length, domainSeparator.length);
    System.arraycopy(structHash, 0, payload, PREFIX.length + domainSeparator.length, structHash.length);
    return Hash.sha3(payload);
  }

  public String hash(@NonNull OrderIntent order) {
    return Numeric.toHexString(digest(order));
  }

  private static byte[] hashWords(List<Type> words) {
    return Hash.sha3(Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(words)));
  }

  private static byte[] keccak(String text) {
    return Hash.sha3(text.getBytes(StandardCharsets.UTF_8));
  }
}
