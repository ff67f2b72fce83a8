package com.gamecal.backend.etl;

/** Deterministic ids for sources that do not hand out their own. */
public final class StableIds {

    private StableIds() {}

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    /** FNV-1a 64 over UTF-16 code units, as 16 lowercase hex digits. */
    public static String hash64(String input) {
        long hash = FNV_OFFSET;
        for (int i = 0; i < input.length(); i++) {
            hash ^= input.charAt(i);
            hash *= FNV_PRIME;
        }
        String hex = Long.toHexString(hash);
        return "0".repeat(16 - hex.length()) + hex;
    }

    public static String of(String... parts) {
        return hash64(String.join("|", parts));
    }
}
