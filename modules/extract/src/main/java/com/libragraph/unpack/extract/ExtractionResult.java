package com.libragraph.unpack.extract;

import com.libragraph.unpack.types.Document;

import java.util.List;

/**
 * Outcome of one extraction job.
 *
 * @param documents        enriched documents in delegation order
 * @param membersListed    non-directory members in the archive
 * @param membersVisited   members considered after the member-count cut
 * @param membersDelegated members whose loader ran to completion
 * @param exhausted        true if the size budget stopped the job early
 */
public record ExtractionResult(
        List<Document> documents,
        int membersListed,
        int membersVisited,
        int membersDelegated,
        boolean exhausted
) {
    public ExtractionResult {
        documents = List.copyOf(documents);
    }

    public int membersSkipped() {
        return membersVisited - membersDelegated;
    }
}
