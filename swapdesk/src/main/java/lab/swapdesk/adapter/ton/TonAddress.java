package lab.swapdesk.adapter.ton;

import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Standard TON address: workchain plus 256-bit account id.
 * Parses both the raw form ({@code 0:<64 hex>}) and the 48-character user-friendly form.
 */
public record TonAddress(int workchain, byte[] hash) {

    private static final int TAG_BOUNCEABLE = 0x11;
    private static final int TAG_NON_BOUNCEABLE = 0x51;
    private static final int TAG_TEST_ONLY = 0x80;

    public TonAddress {
        if (hash == null || hash.length != 32) {
            throw new IllegalArgumentException("account id must be 32 bytes");
        }
        if (workchain != 0 && workchain != -1) {
            throw new IllegalArgumentException("unsupported workchain " + workchain);
        }
        hash = hash.clone();
    }

    public static TonAddress parse(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address is required");
        }
        String value = address.trim();
        int colon = value.indexOf(':');
        if (colon > 0) {
            return parseRaw(value, colon);
        }
        return parseUserFriendly(value);
    }

    public static boolean isValid(String address) {
        try {
            parse(address);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static TonAddress parseRaw(String value, int colon) {
        int workchain;
        try {
            workchain = Integer.parseInt(value.substring(0, colon));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid workchain in " + value);
        }
        String hex = value.substring(colon + 1);
        if (hex.length() != 64) {
            throw new IllegalArgumentException("raw address must carry 64 hex characters");
        }
        return new TonAddress(workchain, HexFormat.of().parseHex(hex.toLowerCase(Locale.ROOT)));
    }

    private static TonAddress parseUserFriendly(String value) {
        if (value.length() != 48) {
            throw new IllegalArgumentException("user-friendly address must be 48 characters");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(value.replace('-', '+').replace('_', '/'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("address is not base64: " + value);
        }
        int tag = raw[0] & 0xff;
        int baseTag = tag & ~TAG_TEST_ONLY;
        if (baseTag != TAG_BOUNCEABLE && baseTag != TAG_NON_BOUNCEABLE) {
            throw new IllegalArgumentException("unknown address tag 0x" + Integer.toHexString(tag));
        }
        int expected = ((raw[34] & 0xff) << 8) | (raw[35] & 0xff);
        if (crc16(raw, 34) != expected) {
            throw new IllegalArgumentException("address checksum mismatch: " + value);
        }
        return new TonAddress(raw[1], Arrays.copyOfRange(raw, 2, 34));
    }

    public String toRaw() {
        return workchain + ":" + HexFormat.of().formatHex(hash);
    }

    public String toUserFriendly(boolean bounceable, boolean testOnly) {
        byte[] raw = new byte[36];
        raw[0] = (byte) ((bounceable ? TAG_BOUNCEABLE : TAG_NON_BOUNCEABLE) | (testOnly ? TAG_TEST_ONLY : 0));
        raw[1] = (byte) workchain;
        System.arraycopy(hash, 0, raw, 2, 32);
        int crc = crc16(raw, 34);
        raw[34] = (byte) (crc >> 8);
        raw[35] = (byte) crc;
        return Base64.getUrlEncoder().encodeToString(raw);
    }

    @Override
    public byte[] hash() {
        return hash.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TonAddress other && workchain == other.workchain && Arrays.equals(hash, other.hash);
    }

    @Override
    public int hashCode() {
        return 31 * workchain + Arrays.hashCode(hash);
    }

    @Override
    public String toString() {
        return toRaw();
    }

    // CRC-16/XMODEM
    static int crc16(byte[] data, int length) {
        int crc = 0;
        for (int i = 0; i < length; i++) {
            crc ^= (data[i] & 0xff) << 8;
            for (int bit = 0; bit < 8; bit++) {
                crc = (crc & 0x8000) != 0 ? (crc << 1) ^ 0x1021 : crc << 1;
            }
            crc &= 0xffff;
        }
        return crc;
    }
}
