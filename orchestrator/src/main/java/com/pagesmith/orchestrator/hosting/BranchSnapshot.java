package com.pagesmith.orchestrator.hosting;

import java.util.Map;

/**
 * What the head of a branch currently holds.
 *
 * @param commitSha head commit
 * @param blobShas  path → git blob SHA for every file in the head tree
 */
public record BranchSnapshot(String commitSha, Map<String, String> blobShas) {

    public BranchSnapshot {
        blobShas = Map.copyOf(blobShas);
    }
}
