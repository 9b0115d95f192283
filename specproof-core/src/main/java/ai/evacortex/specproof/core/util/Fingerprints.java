/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.util;

import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

public final class Fingerprints {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private Fingerprints() {
    }

    public static long xxHash64(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    /**
     * Hex-encoded XXHash64 of the UTF-8 bytes of {@code text}. Always 16 lowercase characters.
     */
    public static String of(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        return HexFormat.of().formatHex(ByteBuffer.allocate(Long.BYTES).putLong(xxHash64(text)).array());
    }
}
