package org.refactor.depcheck;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 控制流边 tail -> head
 */
public record CfgEdge<N>(N tail, N head) {

    public CfgEdge {
        checkNotNull(tail, "tail");
        checkNotNull(head, "head");
    }

    public boolean isSelfLoop() {
        return tail.equals(head);
    }

    @Override
    public String toString() {
        return tail + " -> " + head;
    }
}
