package com.reviewmerge.domain.consolidation.model;

import java.time.Instant;
import java.util.List;

public record ReportMetadata(
        List<String> sources,
        int sourceCount,
        Instant consolidatedAt,
        String version
) {}
