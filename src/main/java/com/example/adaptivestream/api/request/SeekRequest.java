package com.example.adaptivestream.api.request;

import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SeekRequest {

    @NotNull
    @DecimalMin("0")
    private Double positionSec;
}
