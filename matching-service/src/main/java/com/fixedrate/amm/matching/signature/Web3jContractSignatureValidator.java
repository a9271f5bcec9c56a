package com.fixedrate.amm.matching.signature;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Bytes4;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * Calls {@code isValidSignature(bytes32,bytes)} on the signer's contract and compares the answer with
 * the ERC-1271 magic value. Reverts, RPC failures and malformed answers all count as rejection.
 */
@Slf4j
@RequiredArgsConstructor
public class Web3jContractSignatureValidator implements ContractSignatureValidator {

  static final byte[] MAGIC_VALUE = {0x16, 0x26, (byte) 0xba, 0x7e};

  private final @NonNull Supplier<Web3j> web3j;

  @Override
  public boolean isValidSignature(@NonNull String account, @NonNull byte[] digest, @NonNull byte[] signature) {
    Function fn = new Function(
        "isValidSignature",
        List.of(new Bytes32(digest), new DynamicBytes(signature)),
        List.of(new TypeReference<Bytes4>() {
        })
    );
    String data = FunctionEncoder.encode(fn);
    try {
      Transaction tx = Transaction.createEthCallTransaction(account, account, data);
      EthCall response = web3j.get().ethCall(tx, DefaultBlockParameterName.LATEST).send();
      if (response.hasError() || response.isReverted()) {
        log.debug("isValidSignature rejected account={} err={}", account, response.getRevertReason());
        return false;
      }
      List<Type> decoded = FunctionReturnDecoder.decode(response.getValue(), fn.getOutputParameters());
      if (decoded == null || decoded.isEmpty()) {
        return false;
      }
      Object raw = decoded.get(0).getValue();
      return raw instanceof byte[] bytes && Arrays.equals(bytes, MAGIC_VALUE);
    } catch (Exception e) {
      log.warn("isValidSignature call failed account={} err={}", account, e.toString());
      return false;
    }
  }
}
