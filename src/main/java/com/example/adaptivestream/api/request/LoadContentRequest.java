package com.example.adaptivestream.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class LoadContentRequest {

    @NotBlank
    @Size(max = 128)
    private String contentId;
}
