package com.lpzapper.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

/**
 * Bean Validation adapter over {@link AddressValidator}.
 */
@Component
public class TokenAddressValidator implements ConstraintValidator<TokenAddress, String> {

    private final AddressValidator addressValidator;

    public TokenAddressValidator(AddressValidator addressValidator) {
        this.addressValidator = addressValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && addressValidator.isValidAddress(value);
    }
}
