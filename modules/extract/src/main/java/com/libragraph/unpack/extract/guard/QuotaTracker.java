package com.libragraph.unpack.extract.guard;

import com.libragraph.unpack.extract.config.ExtractionLimits;

/**
 * Per-job accounting of declared member sizes.
 *
 * <p>One tracker per job; not thread-safe. Once {@link Verdict#EXHAUSTED} has been
 * returned every later call returns it too. The member-count ceiling is applied
 * by truncating the listing, not here.
 */
public class QuotaTracker {

    public enum Verdict {
        /** Charged to the budget; extract it. */
        ACCEPTED,
        /** Over the per-member ceiling; skip this member only. */
        MEMBER_TOO_LARGE,
        /** Would overrun the archive budget; stop processing the archive. */
        EXHAUSTED
    }

    private final ExtractionLimits limits;
    private long acceptedBytes;
    private int acceptedMembers;
    private boolean exhausted;

    public QuotaTracker(ExtractionLimits limits) {
        this.limits = limits;
    }

    /**
     * Checks a member's declared size and charges it when accepted.
     *
     * @param declaredSize declared uncompressed size, negative when unknown
     */
    public Verdict tryAccept(long declaredSize) {
        if (exhausted) {
            return Verdict.EXHAUSTED;
        }
        if (declaredSize > limits.maxFileBytes()) {
            return Verdict.MEMBER_TOO_LARGE;
        }
        long charge = chargeFor(declaredSize);
        if (acceptedBytes + charge > limits.maxTotalBytes()) {
            exhausted = true;
            return Verdict.EXHAUSTED;
        }
        acceptedBytes += charge;
        acceptedMembers++;
        return Verdict.ACCEPTED;
    }

    /**
     * Bytes charged for a member; unknown sizes are charged at the per-member ceiling.
     * This is also the most the member may decompress to.
     */
    public long chargeFor(long declaredSize) {
        return declaredSize < 0 ? limits.maxFileBytes() : declaredSize;
    }

    public long acceptedBytes() {
        return acceptedBytes;
    }

    public int acceptedMembers() {
        return acceptedMembers;
    }

    public boolean isExhausted() {
        return exhausted;
    }
}
