package com.questrail.msgpack.config;

/**
 * Tunables for the MessagePack encoder and decoder.
 *
 * @param maxDepth      deepest container nesting the decoder accepts; a
 *                      top-level array counts as depth 1
 * @param compactFloats whether the encoder writes float32 when that width
 *                      reproduces the stored double bit-for-bit
 */
public record MsgPackCodecConfig(
    int maxDepth,
    boolean compactFloats
) {
    public static final int DEFAULT_MAX_DEPTH = 512;

    public MsgPackCodecConfig {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1 (was " + maxDepth + ")");
        }
    }

    public static MsgPackCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private boolean compactFloats = true;

        public Builder withMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder withCompactFloats(boolean compactFloats) {
            this.compactFloats = compactFloats;
            return this;
        }

        public MsgPackCodecConfig build() {
            return new MsgPackCodecConfig(maxDepth, compactFloats);
        }
    }
}
