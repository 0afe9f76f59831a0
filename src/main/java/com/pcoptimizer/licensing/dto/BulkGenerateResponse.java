package com.pcoptimizer.licensing.dto;

import java.util.List;

public record BulkGenerateResponse(
        int requested,
        int generated,
        int failed,
        List<GenerateLicenseResponse> licenses
) {}
