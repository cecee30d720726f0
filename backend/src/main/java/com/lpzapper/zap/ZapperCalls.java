package com.lpzapper.zap;

import com.lpzapper.chain.ContractCalls;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.List;

/**
 * Calldata for the zapper contract.
 */
final class ZapperCalls {

    private ZapperCalls() {
    }

    /**
     * {@code zapInETH(address tokenOther, uint256 amountAMin, uint256 amountBMin, address to, uint256 deadline,
     * uint256 slippageToleranceBps)}, payable.
     */
    static String zapInEth(String token, BigInteger amountAMin, BigInteger amountBMin, String to,
                           long deadline, int toleranceBps) {
        Function function = new Function("zapInETH",
                List.of(new Address(token),
                        new Uint256(amountAMin),
                        new Uint256(amountBMin),
                        new Address(to),
                        new Uint256(BigInteger.valueOf(deadline)),
                        new Uint256(BigInteger.valueOf(toleranceBps))),
                List.of());
        return ContractCalls.encode(function);
    }

    /**
     * {@code zapOut(address tokenA, address tokenB, uint256 liquidity, address tokenOut, uint256 amountOutMin,
     * uint256 amountAMin, uint256 amountBMin, address to, uint256 deadline, uint256 slippageToleranceBps)}.
     */
    static String zapOut(String tokenA, String tokenB, BigInteger liquidity, String tokenOut, BigInteger amountOutMin,
                         BigInteger amountAMin, BigInteger amountBMin, String to, long deadline, int toleranceBps) {
        Function function = new Function("zapOut",
                List.of(new Address(tokenA),
                        new Address(tokenB),
                        new Uint256(liquidity),
                        new Address(tokenOut),
                        new Uint256(amountOutMin),
                        new Uint256(amountAMin),
                        new Uint256(amountBMin),
                        new Address(to),
                        new Uint256(BigInteger.valueOf(deadline)),
                        new Uint256(BigInteger.valueOf(toleranceBps))),
                List.of());
        return ContractCalls.encode(function);
    }

    static String approve(String spender, BigInteger amount) {
        return ContractCalls.encode(ContractCalls.approve(spender, amount));
    }
}
