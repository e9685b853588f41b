package com.firehose.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Domain model representing one event from the stream.
 * 
 * Mirrors the Jetstream JSON shape: an actor DID, a microsecond timestamp,
 * an event kind and, for commit events, the repository operation with its record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawEvent {
    
    public static final String KIND_COMMIT = "commit";
    
    @NotBlank
    private String did;
    
    @JsonProperty("time_us")
    private Long timeUs;
    
    private String kind;
    
    private Commit commit;
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Commit {
        
        private String rev;
        private String operation;
        private String collection;
        private String rkey;
        private String cid;
        private JsonNode record;
    }
}
