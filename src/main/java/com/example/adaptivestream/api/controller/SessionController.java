package com.example.adaptivestream.api.controller;

import com.example.adaptivestream.api.request.CreateSessionRequest;
import com.example.adaptivestream.api.request.DecodeCostRequest;
import com.example.adaptivestream.api.request.LoadContentRequest;
import com.example.adaptivestream.api.request.PlaybackPositionRequest;
import com.example.adaptivestream.api.request.QualityPreferenceRequest;
import com.example.adaptivestream.api.request.SeekRequest;
import com.example.adaptivestream.api.response.ApiResponse;
import com.example.adaptivestream.api.response.SessionEventResponse;
import com.example.adaptivestream.api.response.SessionStatusResponse;
import com.example.adaptivestream.application.service.StreamSessionService;
import com.example.adaptivestream.domain.model.Chunk;
import java.util.List;
import javax.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private final StreamSessionService streamSessionService;

    public SessionController(StreamSessionService streamSessionService) {
        this.streamSessionService = streamSessionService;
    }

    @PostMapping
    public ApiResponse<SessionStatusResponse> createSession(
            @Valid @RequestBody(required = false) CreateSessionRequest request) {
        String contentId = request == null ? null : request.getContentId();
        return ApiResponse.success(streamSessionService.createSession(contentId));
    }

    @PostMapping("/{id}/load")
    public ApiResponse<SessionStatusResponse> load(@PathVariable("id") String id,
                                                   @Valid @RequestBody LoadContentRequest request) {
        return ApiResponse.success(streamSessionService.load(id, request.getContentId()));
    }

    @PostMapping("/{id}/seek")
    public ApiResponse<SessionStatusResponse> seek(@PathVariable("id") String id,
                                                   @Valid @RequestBody SeekRequest request) {
        return ApiResponse.success(streamSessionService.seek(id, request.getPositionSec()));
    }

    @PostMapping("/{id}/position")
    public ApiResponse<SessionStatusResponse> updatePosition(@PathVariable("id") String id,
                                                             @Valid @RequestBody PlaybackPositionRequest request) {
        return ApiResponse.success(streamSessionService.updatePosition(id, request.getPositionSec()));
    }

    @PostMapping("/{id}/decode-cost")
    public ApiResponse<String> reportDecodeCost(@PathVariable("id") String id,
                                                @Valid @RequestBody DecodeCostRequest request) {
        streamSessionService.reportDecodeCost(id, request);
        return ApiResponse.acknowledged("ACCEPTED");
    }

    @PostMapping("/{id}/quality")
    public ApiResponse<SessionStatusResponse> updateQuality(@PathVariable("id") String id,
                                                            @Valid @RequestBody QualityPreferenceRequest request) {
        return ApiResponse.success(streamSessionService.updateQuality(id, request));
    }

    @GetMapping("/{id}")
    public ApiResponse<SessionStatusResponse> getStatus(@PathVariable("id") String id) {
        return ApiResponse.success(streamSessionService.getStatus(id));
    }

    @GetMapping("/{id}/events")
    public ApiResponse<List<SessionEventResponse>> listEvents(
            @PathVariable("id") String id,
            @RequestParam(value = "after", defaultValue = "0") long after) {
        return ApiResponse.success(streamSessionService.listEvents(id, after));
    }

    @GetMapping("/{id}/segment")
    public ResponseEntity<byte[]> readSegment(@PathVariable("id") String id,
                                              @RequestParam("positionSec") double positionSec) {
        Chunk chunk = streamSessionService.readSegment(id, positionSec);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header("X-Segment-Start", String.valueOf(chunk.getSpan().getStart()))
                .header("X-Segment-End", String.valueOf(chunk.getSpan().getEnd()))
                .header("X-Segment-Tier", chunk.getTier().getLabel())
                .header("X-Segment-Provider", chunk.getProviderName())
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .body(chunk.getPayload());
    }

    @DeleteMapping("/{id}")
    public ApiResponse<String> dispose(@PathVariable("id") String id) {
        streamSessionService.dispose(id);
        return ApiResponse.acknowledged("DISPOSED");
    }
}
