package com.example.adaptivestream.api.request;

import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateSessionRequest {

    /**
     * Optional; when present the new session starts loading it right away.
     */
    @Size(max = 128)
    private String contentId;
}
