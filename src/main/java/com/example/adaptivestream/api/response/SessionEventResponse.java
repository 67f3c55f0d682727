package com.example.adaptivestream.api.response;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionEventResponse {

    private Long sequence;
    private Long timestampMs;
    private String type;
    private Map<String, String> attributes;
}
