package com.paywatch.api.validation;

import com.paywatch.oracle.config.OracleProperties;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Accepts chain ids the oracle has configuration for, ignoring case and surrounding whitespace.
 */
@Component
public class SupportedChainValidator implements ConstraintValidator<SupportedChain, String> {

    private final OracleProperties oracleProperties;

    public SupportedChainValidator(OracleProperties oracleProperties) {
        this.oracleProperties = oracleProperties;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        return oracleProperties.getChains().containsKey(value.trim().toLowerCase(Locale.ROOT));
    }
}
