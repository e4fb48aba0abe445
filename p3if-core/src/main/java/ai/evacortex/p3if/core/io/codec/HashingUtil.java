/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.io.codec;

import net.jpountz.xxhash.XXHashFactory;

import java.util.HexFormat;

public final class HashingUtil {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private HashingUtil() {}

    public static long xxHash64(byte[]... chunks) {
        int total = 0;
        for (byte[] chunk : chunks) total += chunk.length;
        byte[] joined = new byte[total];
        int pos = 0;
        for (byte[] chunk : chunks) {
            System.arraycopy(chunk, 0, joined, pos, chunk.length);
            pos += chunk.length;
        }
        return XX_HASH.hash64().hash(joined, 0, joined.length, SEED);
    }

    public static String xxHash64Hex(byte[]... chunks) {
        return HexFormat.of().toHexDigits(xxHash64(chunks));
    }
}
