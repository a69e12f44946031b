package com.analyzer.report.identity;

import lombok.NonNull;
import lombok.Value;

/**
 * Classification of a unit identifier.
 *
 * {@code packageName} is only set when {@code scope} is {@link UnitScope#PACKAGE}.
 */
@Value
public class UnitIdentity {
    @NonNull
    String id;
    @NonNull
    UnitScope scope;
    String packageName;

    public static UnitIdentity system(String id) {
        return new UnitIdentity(id, UnitScope.SYSTEM, null);
    }

    public static UnitIdentity inPackage(String id, String packageName) {
        return new UnitIdentity(id, UnitScope.PACKAGE, packageName);
    }

    public static UnitIdentity loose(String id) {
        return new UnitIdentity(id, UnitScope.LOOSE, null);
    }
}
