package com.chainscope.adapter.rpc;

import com.chainscope.common.error.ResponseParseException;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decoding of eth_call return data for the handful of ABI shapes the explorer reads. Data that is
 * not hex fails with {@link ResponseParseException}.
 */
final class AbiDecoding {

    private static final String DYNAMIC_OFFSET = "0000000000000000000000000000000000000000000000000000000000000020";
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]*$");

    private AbiDecoding() {
    }

    /**
     * Decode an ABI string: dynamic (offset + length + data) or bytes32 left-aligned, as some
     * older tokens return. Empty string when the data fits neither shape.
     */
    static String decodeString(String hex) {
        String raw = strip(hex);
        if (raw.length() < 64) return "";
        if (raw.length() >= 128 && raw.startsWith(DYNAMIC_OFFSET)) {
            BigInteger length = new BigInteger(raw.substring(64, 128), 16);
            if (length.signum() <= 0 || length.bitLength() > 24) return "";
            int dataLen = length.intValue() * 2;
            if (raw.length() < 128 + dataLen) return "";
            return new String(Numeric.hexStringToByteArray(raw.substring(128, 128 + dataLen)), StandardCharsets.UTF_8).trim();
        }
        byte[] bytes = Numeric.hexStringToByteArray(raw.substring(0, 64));
        int end = 0;
        while (end < bytes.length && bytes[end] != 0) end++;
        return new String(bytes, 0, end, StandardCharsets.UTF_8).trim();
    }

    /** First 32-byte word as an unsigned integer, null when the data is shorter. */
    static BigInteger decodeUint(String hex) {
        String raw = strip(hex);
        if (raw.length() < 64) return null;
        return new BigInteger(raw.substring(0, 64), 16);
    }

    /** Address held in the low 20 bytes of the first word, null when the data is shorter. */
    static String decodeAddress(String hex) {
        String raw = strip(hex);
        if (raw.length() < 64) return null;
        return "0x" + raw.substring(24, 64).toLowerCase(Locale.ROOT);
    }

    static boolean isZeroAddress(String address) {
        return address == null || address.matches("^0x0{40}$");
    }

    private static String strip(String hex) {
        if (hex == null) return "";
        String raw = Numeric.cleanHexPrefix(hex);
        if (!HEX.matcher(raw).matches()) {
            throw new ResponseParseException("eth_call returned non-hex data: " + abbreviate(hex));
        }
        return raw;
    }

    private static String abbreviate(String value) {
        return value.length() > 24 ? value.substring(0, 24) + "..." : value;
    }
}
