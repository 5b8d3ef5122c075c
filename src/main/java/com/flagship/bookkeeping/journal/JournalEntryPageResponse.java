package com.flagship.bookkeeping.journal;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;

@Value
public class JournalEntryPageResponse {

    @JsonProperty("entries")
    List<JournalEntryResponse> entries;

    @JsonProperty("total")
    long total;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    public static JournalEntryPageResponse from(Page<JournalEntry> page) {
        return new JournalEntryPageResponse(
            page.getContent().stream().map(JournalEntryResponse::from).toList(),
            page.getTotalElements(),
            page.getNumber(),
            page.getSize());
    }
}
