package com.chainscope.common.validation;

import com.chainscope.common.error.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Pre-I/O checks for caller input. Every method returns the normalized (lower-case) form so
 * that cache keys do not depend on checksum casing.
 */
public final class InputValidator {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern TX_HASH = Pattern.compile("^0x[0-9a-fA-F]{64}$");
    private static final Pattern HEX_DATA = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    private InputValidator() {
    }

    public static boolean isValidAddress(String address) {
        return address != null && ADDRESS.matcher(address.trim()).matches();
    }

    public static String requireAddress(String address) {
        if (!isValidAddress(address)) {
            throw new ValidationException("Invalid address: " + address);
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    public static String requireTxHash(String hash) {
        if (hash == null || !TX_HASH.matcher(hash.trim()).matches()) {
            throw new ValidationException("Invalid transaction hash: " + hash);
        }
        return hash.trim().toLowerCase(Locale.ROOT);
    }

    /** Accepts null (no data); otherwise requires 0x-prefixed, even-length hex. */
    public static String requireHexDataOrNull(String data) {
        if (data == null) {
            return null;
        }
        if (!HEX_DATA.matcher(data.trim()).matches()) {
            throw new ValidationException("Invalid hex data: " + data);
        }
        return data.trim().toLowerCase(Locale.ROOT);
    }

    public static long requireBlockNumber(long number) {
        if (number < 0) {
            throw new ValidationException("Invalid block number: " + number);
        }
        return number;
    }
}
