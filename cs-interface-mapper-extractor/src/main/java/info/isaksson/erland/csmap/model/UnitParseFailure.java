package info.isaksson.erland.csmap.model;

import java.util.Objects;

/** Diagnostic for a source file that could not be processed and was left out of the model. */
public final class UnitParseFailure {
    public final String unitId;
    public final String message;

    public UnitParseFailure(String unitId, String message) {
        this.unitId = Objects.requireNonNullElse(unitId, "");
        this.message = Objects.requireNonNullElse(message, "");
    }

    @Override
    public String toString() {
        return unitId + ": " + message;
    }
}
