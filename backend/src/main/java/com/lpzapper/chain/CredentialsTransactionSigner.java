package com.lpzapper.chain;

import com.lpzapper.common.Addresses;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * web3j {@link Credentials} signer. Without a private key it runs watch-only: reads work for the
 * configured account address, signing throws.
 */
@Slf4j
public class CredentialsTransactionSigner implements TransactionSigner {

    private final Credentials credentials;
    private final String address;

    public CredentialsTransactionSigner(String privateKey, String watchOnlyAddress) {
        if (privateKey != null && !privateKey.isBlank()) {
            this.credentials = Credentials.create(privateKey.trim());
            this.address = Addresses.checksum(credentials.getAddress());
            log.info("Signing account loaded: {}", address);
        } else {
            this.credentials = null;
            this.address = Addresses.isValid(watchOnlyAddress) ? Addresses.checksum(watchOnlyAddress) : Addresses.ZERO_ADDRESS;
            log.warn("No private key configured, running watch-only for {}", address);
        }
    }

    @Override
    public String address() {
        return address;
    }

    @Override
    public boolean canSign() {
        return credentials != null;
    }

    @Override
    public String sign(long chainId, BigInteger nonce, TransactionRequest request) {
        if (credentials == null) {
            throw new IllegalStateException("Watch-only mode: no private key configured");
        }
        RawTransaction raw = RawTransaction.createTransaction(
                chainId,
                nonce,
                request.gasLimit(),
                request.to(),
                request.value(),
                request.data(),
                request.maxPriorityFeePerGas(),
                request.maxFeePerGas());
        return Numeric.toHexString(TransactionEncoder.signMessage(raw, credentials));
    }
}
