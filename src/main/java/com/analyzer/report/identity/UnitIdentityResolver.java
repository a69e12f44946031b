package com.analyzer.report.identity;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

/**
 * Classifies {@code scheme:path} unit identifiers.
 *
 * Rules:
 * - {@code dart:<path>}     -> SYSTEM
 * - {@code package:<name>/...} -> PACKAGE, name is the first path segment
 * - everything else        -> LOOSE
 *
 * Never throws; an identifier that cannot be read is simply LOOSE.
 */
@UtilityClass
public class UnitIdentityResolver {

    public static final String SYSTEM_SCHEME = "dart";
    public static final String PACKAGE_SCHEME = "package";

    private static final Pattern SCHEME_PATTERN = Pattern.compile("^([A-Za-z][A-Za-z0-9+.\\-]*):(.*)$", Pattern.DOTALL);

    public static UnitIdentity resolve(String id) {
        String safeId = id == null ? "" : id.trim();
        Matcher matcher = SCHEME_PATTERN.matcher(safeId);
        if (!matcher.matches()) {
            return UnitIdentity.loose(safeId);
        }

        String scheme = matcher.group(1).toLowerCase(Locale.ROOT);
        String path = matcher.group(2);
        if (path.isEmpty()) {
            return UnitIdentity.loose(safeId);
        }

        if (SYSTEM_SCHEME.equals(scheme)) {
            return UnitIdentity.system(safeId);
        }
        if (PACKAGE_SCHEME.equals(scheme)) {
            String packageName = firstSegment(path);
            return packageName.isEmpty()
                    ? UnitIdentity.loose(safeId)
                    : UnitIdentity.inPackage(safeId, packageName);
        }
        return UnitIdentity.loose(safeId);
    }

    private static String firstSegment(String path) {
        int slash = path.indexOf('/');
        return slash < 0 ? path : path.substring(0, slash);
    }
}
