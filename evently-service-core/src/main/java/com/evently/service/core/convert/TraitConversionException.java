package com.evently.service.core.convert;

import com.evently.event.model.TraitType;

/** A value was found for a trait but could not be coerced to the trait's declared type. */
public class TraitConversionException extends IllegalArgumentException {

    private final String traitName;
    private final TraitType traitType;
    private final transient Object rawValue;

    public TraitConversionException(String traitName, TraitType traitType, Object rawValue, Throwable cause) {
        super(
                "Cannot convert value '" + rawValue + "' of trait '" + traitName + "' to " + traitType.configValue(),
                cause);
        this.traitName = traitName;
        this.traitType = traitType;
        this.rawValue = rawValue;
    }

    public String getTraitName() {
        return traitName;
    }

    public TraitType getTraitType() {
        return traitType;
    }

    public Object getRawValue() {
        return rawValue;
    }
}
