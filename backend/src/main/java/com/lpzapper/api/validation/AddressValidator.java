package com.lpzapper.api.validation;

import com.lpzapper.common.Addresses;
import org.springframework.stereotype.Component;

/**
 * Request-level check for token addresses given as text.
 */
@Component
public class AddressValidator {

    public boolean isValidAddress(String address) {
        return address != null && !address.isBlank() && Addresses.isValid(address);
    }
}
