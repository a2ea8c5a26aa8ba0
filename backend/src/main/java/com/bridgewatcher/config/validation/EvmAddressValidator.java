package com.bridgewatcher.config.validation;

import com.bridgewatcher.common.AddressFormat;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Bean Validation side of {@link EvmAddress}; delegates to {@link AddressFormat}.
 */
public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && AddressFormat.isValidAddress(value);
    }
}
