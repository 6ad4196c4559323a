package com.identitygraph.api.dto;

import com.identitygraph.ingestion.IngestionRecord;
import lombok.Value;

import java.util.List;

@Value
public class EventListResponse {
    List<IngestionRecord> events;
    int count;
}
