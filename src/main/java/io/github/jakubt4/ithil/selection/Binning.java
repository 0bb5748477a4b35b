package io.github.jakubt4.ithil.selection;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Conversions between the compact binning notation used on the command line
 * ({@code "2x2"}) and the CCDSUM header form kept in the store ({@code "2 2"}).
 */
public final class Binning {

    public static final List<String> SUPPORTED = List.of("1x1", "2x2");

    private static final Pattern COMPACT = Pattern.compile("(\\d+)x(\\d+)");
    private static final Pattern NATIVE = Pattern.compile("(\\d+) (\\d+)");

    private Binning() {
    }

    /**
     * @throws IllegalArgumentException if the value is in neither notation
     */
    public static String toNative(final String binning) {
        final var value = binning.trim();
        if (NATIVE.matcher(value).matches()) {
            return value;
        }
        final var compact = COMPACT.matcher(value);
        if (!compact.matches()) {
            throw new IllegalArgumentException("Unrecognised binning '" + binning + "'");
        }
        return compact.group(1) + " " + compact.group(2);
    }

    /**
     * @throws IllegalArgumentException if the value is in neither notation
     */
    public static String toCompact(final String binning) {
        final var value = binning.trim();
        if (COMPACT.matcher(value).matches()) {
            return value;
        }
        final var nativeForm = NATIVE.matcher(value);
        if (!nativeForm.matches()) {
            throw new IllegalArgumentException("Unrecognised binning '" + binning + "'");
        }
        return nativeForm.group(1) + "x" + nativeForm.group(2);
    }
}
