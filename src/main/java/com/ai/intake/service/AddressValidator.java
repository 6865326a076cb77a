package com.ai.intake.service;

public interface AddressValidator {

    /**
     * @throws AddressValidationException when the validator itself fails, as
     *                                    opposed to judging the address invalid
     */
    AddressValidation validate(String address);
}
