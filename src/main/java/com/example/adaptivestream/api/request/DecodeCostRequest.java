package com.example.adaptivestream.api.request;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import lombok.Data;

@Data
public class DecodeCostRequest {

    @DecimalMin("0")
    @DecimalMax("1")
    private double complexity;

    @DecimalMin("0")
    @DecimalMax("1")
    private double motion;

    @DecimalMin("0")
    private double processingTimeMs;

    @Min(0)
    private int droppedFrames;
}
