package com.rugradar.risk;

import com.rugradar.common.Base58;
import com.rugradar.domain.AuthorityField;
import com.rugradar.domain.MintAuthorityState;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Decodes the two authority slots of a mint account. Offsets are fixed by the account layout:
 * mint authority at [4, 36), freeze authority at [36, 68). A slot is revoked iff all 32 bytes are zero.
 * Data too short for a slot leaves that slot undetermined.
 */
@Component
public class MintAuthorityDecoder {

    public static final int KEY_LENGTH = 32;
    public static final int MINT_AUTHORITY_OFFSET = 4;
    public static final int FREEZE_AUTHORITY_OFFSET = 36;

    public MintAuthorityState decode(byte[] data) {
        byte[] bytes = data != null ? data : new byte[0];
        return new MintAuthorityState(
                slot(bytes, MINT_AUTHORITY_OFFSET),
                slot(bytes, FREEZE_AUTHORITY_OFFSET));
    }

    private static AuthorityField slot(byte[] data, int offset) {
        if (data.length < offset + KEY_LENGTH) {
            return AuthorityField.undetermined();
        }
        byte[] key = Arrays.copyOfRange(data, offset, offset + KEY_LENGTH);
        if (isAllZero(key)) {
            return AuthorityField.revoked();
        }
        return AuthorityField.active(Base58.encode(key));
    }

    private static boolean isAllZero(byte[] key) {
        for (byte b : key) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }
}
