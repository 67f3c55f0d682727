package com.example.adaptivestream.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BufferedRangeResponse {

    private double startSec;
    private double endSec;
}
