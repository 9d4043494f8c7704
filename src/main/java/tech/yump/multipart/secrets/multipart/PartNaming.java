package tech.yump.multipart.secrets.multipart;

import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Maps part indices to physical record names and back.
 * Index 0 is the base record, named exactly like the base name; index k &gt;= 1 is named
 * {@code base-k}.
 */
public final class PartNaming {

    public static final int BASE_INDEX = 0;
    private static final char SEPARATOR = '-';

    private PartNaming() {}

    public static String partName(String baseName, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Part index cannot be negative: " + index);
        }
        return index == BASE_INDEX ? baseName : baseName + SEPARATOR + index;
    }

    /**
     * Recognizes a physical record name as one of the parts of {@code baseName}.
     *
     * @return the part index, or empty if the name does not belong to this base name. Suffixes
     * that are not digits, that are zero, or that carry leading zeros never match.
     */
    public static Optional<Integer> parseIndex(String baseName, String name) {
        if (name == null || baseName == null) {
            return Optional.empty();
        }
        if (name.equals(baseName)) {
            return Optional.of(BASE_INDEX);
        }
        String prefix = baseName + SEPARATOR;
        if (!name.startsWith(prefix)) {
            return Optional.empty();
        }
        String suffix = name.substring(prefix.length());
        if (!isNumeric(suffix) || suffix.charAt(0) == '0' || suffix.length() > 9) {
            return Optional.empty();
        }
        return Optional.of(Integer.parseInt(suffix));
    }

    /**
     * Trims and checks a user supplied base name. A name that already looks like an overflow part
     * ({@code something-3}) is refused so callers cannot address a single part by mistake.
     */
    public static String validateBaseName(String secretName) {
        if (!StringUtils.hasText(secretName)) {
            throw new IllegalArgumentException("Secret name cannot be null or empty.");
        }
        String clean = secretName.trim();
        int lastSeparator = clean.lastIndexOf(SEPARATOR);
        if (lastSeparator >= 0 && isNumeric(clean.substring(lastSeparator + 1))) {
            throw new IllegalArgumentException(String.format(
                    "Multipart secret name provided: %s. Please provide the base secret name instead", clean));
        }
        return clean;
    }

    static boolean isNumeric(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
