package com.lpzapper.chain;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint112;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint8;

import java.math.BigInteger;
import java.util.List;

/**
 * ABI definitions for the Uniswap V2 factory/pair and ERC-20 calls the gateway makes.
 */
public final class ContractCalls {

    private ContractCalls() {
    }

    public static Function getPair(String tokenA, String tokenB) {
        return new Function("getPair",
                List.of(new Address(tokenA), new Address(tokenB)),
                List.of(new TypeReference<Address>() {}));
    }

    public static Function getReserves() {
        return new Function("getReserves",
                List.of(),
                List.of(new TypeReference<Uint112>() {}, new TypeReference<Uint112>() {}, new TypeReference<Uint32>() {}));
    }

    public static Function token0() {
        return new Function("token0", List.of(), List.of(new TypeReference<Address>() {}));
    }

    public static Function totalSupply() {
        return new Function("totalSupply", List.of(), List.of(new TypeReference<Uint256>() {}));
    }

    public static Function balanceOf(String owner) {
        return new Function("balanceOf", List.of(new Address(owner)), List.of(new TypeReference<Uint256>() {}));
    }

    public static Function decimals() {
        return new Function("decimals", List.of(), List.of(new TypeReference<Uint8>() {}));
    }

    public static Function name() {
        return new Function("name", List.of(), List.of(new TypeReference<Utf8String>() {}));
    }

    public static Function symbol() {
        return new Function("symbol", List.of(), List.of(new TypeReference<Utf8String>() {}));
    }

    public static Function approve(String spender, BigInteger amount) {
        return new Function("approve",
                List.of(new Address(spender), new Uint256(amount)),
                List.of(new TypeReference<Bool>() {}));
    }

    public static String encode(Function function) {
        return FunctionEncoder.encode(function);
    }

    /**
     * Decodes an eth_call result. Throws RpcException when the result is empty (no contract at the address,
     * or a call that returned nothing).
     */
    public static List<Type> decode(String resultHex, Function function) {
        if (resultHex == null || resultHex.isBlank() || "0x".equalsIgnoreCase(resultHex.trim())) {
            throw new RpcException("Empty result for " + function.getName());
        }
        List<Type> values;
        try {
            values = FunctionReturnDecoder.decode(resultHex, function.getOutputParameters());
        } catch (RuntimeException e) {
            throw new RpcException("Undecodable result for " + function.getName() + ": " + e.getMessage(), e);
        }
        if (values.size() < function.getOutputParameters().size()) {
            throw new RpcException("Malformed result for " + function.getName() + ": " + resultHex);
        }
        return values;
    }
}
