package com.dcruver.notegraph.io;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Rewrite every link to one of {@code oldTargets} so it points at {@code newTarget}.
 */
@Data
@Builder
public class MergeLinkRequest {
    private final List<String> oldTargets;
    private final String newTarget;

    /** Keep the old spelling visible as the link alias when the link has none. */
    private final boolean preserveAsAlias;
}
