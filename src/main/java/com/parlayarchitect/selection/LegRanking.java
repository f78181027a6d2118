package com.parlayarchitect.selection;

import com.parlayarchitect.domain.model.RankedLeg;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Request-scoped ordering of the eligible pool.
 *
 * <p>Order: tier (STRONG first), then weight descending, then a seed-derived key that breaks exact
 * weight ties, then id ascending. The seed key is a pure function of {@code (seed, id)} over every
 * byte of the id, drawn from a generator created for this request only, so the same pool and seed
 * always rank identically and concurrent requests never share random state.
 */
public final class LegRanking {

    private final Map<String, Long> tieBreakKeys;
    private final Comparator<RankedLeg> comparator;

    private LegRanking(Map<String, Long> tieBreakKeys) {
        this.tieBreakKeys = tieBreakKeys;
        this.comparator = Comparator.comparing(RankedLeg::getTier)
                .thenComparing(Comparator.comparingDouble(RankedLeg::getWeight).reversed())
                .thenComparingLong(leg -> this.tieBreakKeys.get(leg.getId()))
                .thenComparing(RankedLeg::getId);
    }

    public static LegRanking forPool(Collection<RankedLeg> pool, long seed) {
        MessageDigest digest = sha256();
        Map<String, Long> keys = new HashMap<>();
        for (RankedLeg leg : pool) {
            keys.put(leg.getId(), tieBreakKey(digest, seed, leg.getId()));
        }
        return new LegRanking(keys);
    }

    /** Seeds the generator with the request seed mixed with the first 64 bits of SHA-256(id). */
    static long tieBreakKey(MessageDigest digest, long seed, String id) {
        byte[] hash = digest.digest(id.getBytes(StandardCharsets.UTF_8));
        long idBits = ByteBuffer.wrap(hash, 0, Long.BYTES).getLong();
        return new SplittableRandom(seed ^ idBits).nextLong();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public Comparator<RankedLeg> comparator() {
        return comparator;
    }
}
