package com.searchnexus.util;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Engine heap size such as {@code 512m} or {@code 4g}. Units scale by 1024.
 */
public final class HeapSize {

    private static final Pattern FORMAT = Pattern.compile("^([0-9]+)([kmgt])$", Pattern.CASE_INSENSITIVE);
    private static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

    private final long amount;
    private final char unit;

    private HeapSize(long amount, char unit) {
        this.amount = amount;
        this.unit = unit;
    }

    public static Optional<HeapSize> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = FORMAT.matcher(value.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            long amount = Long.parseLong(matcher.group(1));
            return Optional.of(new HeapSize(amount, matcher.group(2).toLowerCase(Locale.ROOT).charAt(0)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public double toGigabytes() {
        switch (unit) {
            case 't':
                return amount * 1024d;
            case 'g':
                return amount;
            case 'm':
                return amount / 1024d;
            default:
                return amount / (1024d * 1024d);
        }
    }

    public static double bytesToGigabytes(long bytes) {
        return bytes / BYTES_PER_GB;
    }

    @Override
    public String toString() {
        return amount + String.valueOf(unit);
    }
}
