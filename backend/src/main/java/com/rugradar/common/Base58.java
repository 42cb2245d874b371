package com.rugradar.common;

import java.util.Arrays;

/**
 * Bitcoin-alphabet Base58 encoding, as used for Solana public keys and signatures.
 */
public final class Base58 {

    private static final char[] ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();

    private Base58() {
    }

    public static String encode(byte[] input) {
        if (input == null || input.length == 0) {
            return "";
        }
        int zeros = 0;
        while (zeros < input.length && input[zeros] == 0) {
            zeros++;
        }
        byte[] number = Arrays.copyOf(input, input.length);
        // Worst case: log(256) / log(58) ≈ 1.37 output chars per input byte.
        char[] encoded = new char[input.length * 2];
        int out = encoded.length;
        int start = zeros;
        while (start < number.length) {
            encoded[--out] = ALPHABET[divmod58(number, start)];
            if (number[start] == 0) {
                start++;
            }
        }
        while (out < encoded.length && encoded[out] == ALPHABET[0]) {
            out++;
        }
        while (zeros-- > 0) {
            encoded[--out] = ALPHABET[0];
        }
        return new String(encoded, out, encoded.length - out);
    }

    /** Divides the big-endian number in place by 58 starting at {@code from}; returns the remainder. */
    private static int divmod58(byte[] number, int from) {
        int remainder = 0;
        for (int i = from; i < number.length; i++) {
            int digit = number[i] & 0xFF;
            int temp = remainder * 256 + digit;
            number[i] = (byte) (temp / 58);
            remainder = temp % 58;
        }
        return remainder;
    }
}
