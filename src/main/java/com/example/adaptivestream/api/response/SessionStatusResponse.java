package com.example.adaptivestream.api.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionStatusResponse {

    private String sessionId;
    private String state;
    private String contentId;
    private String provider;
    private String sourceUrl;
    private String tier;
    private Long tierBitrate;
    private Boolean autoQuality;
    private Double cursorSec;
    private String bufferHealth;
    private Double bufferAheadSec;
    private List<BufferedRangeResponse> bufferedRanges;
    private Long bufferedBytes;
    private Double contentEndSec;
    private Long bandwidthBps;
    private Integer outstandingFetches;
    private Integer providerSwitches;
    private Boolean seeking;
    private Long lastEventSequence;
}
