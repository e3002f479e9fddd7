package clusterwatch.parser;

/**
 * A TRES quantity such as {@code 64}, {@code 15000M} or {@code 1.5G}.
 *
 * Suffixes are decimal: K = 10^3, M = 10^6, G = 10^9, T = 10^12.
 * Fractional values are truncated after scaling. Values outside the {@code long} range
 * are rejected with a {@link NumberFormatException}.
 */
public record ResourceQuantity(long value) {

    public static ResourceQuantity parse(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new NumberFormatException("Empty resource quantity");
        }

        long multiplier = 1L;
        char suffix = trimmed.charAt(trimmed.length() - 1);
        switch (suffix) {
            case 'K' -> multiplier = 1_000L;
            case 'M' -> multiplier = 1_000_000L;
            case 'G' -> multiplier = 1_000_000_000L;
            case 'T' -> multiplier = 1_000_000_000_000L;
            default -> {
            }
        }
        String number = multiplier == 1L ? trimmed : trimmed.substring(0, trimmed.length() - 1);

        long whole;
        try {
            whole = Long.parseLong(number);
        } catch (NumberFormatException e) {
            double scaled = Double.parseDouble(number) * multiplier;
            if (Double.isNaN(scaled) || scaled >= 0x1p63 || scaled < -0x1p63) {
                throw new NumberFormatException("Resource quantity out of range: " + text);
            }
            return new ResourceQuantity((long) scaled);
        }
        try {
            return new ResourceQuantity(Math.multiplyExact(whole, multiplier));
        } catch (ArithmeticException e) {
            throw new NumberFormatException("Resource quantity out of range: " + text);
        }
    }
}
