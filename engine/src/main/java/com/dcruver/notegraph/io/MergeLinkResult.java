package com.dcruver.notegraph.io;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class MergeLinkResult {
    private final int filesModified;
    private final int linksReplaced;
    private final List<String> modifiedFiles;
    private final Map<String, String> errors;  // file path to failure message

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
