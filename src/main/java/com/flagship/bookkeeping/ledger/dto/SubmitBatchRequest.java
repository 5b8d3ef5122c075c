package com.flagship.bookkeeping.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.ledger.BatchRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class SubmitBatchRequest {

    @NotEmpty(message = "At least one line is required")
    @Valid
    @JsonProperty("lines")
    List<BatchLineRequest> lines;

    public BatchRequest toBatchRequest() {
        return new BatchRequest(lines.stream()
            .map(BatchLineRequest::toBatchLine)
            .collect(Collectors.toList()));
    }
}
