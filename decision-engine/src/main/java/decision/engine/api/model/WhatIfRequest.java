package decision.engine.api.model;

import com.fasterxml.jackson.databind.JsonNode;

public record WhatIfRequest(
        JsonNode originalData,
        JsonNode modifiedData,
        String policyType,
        Double coverageAmount
) {}
