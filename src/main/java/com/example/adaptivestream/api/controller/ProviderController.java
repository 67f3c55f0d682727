package com.example.adaptivestream.api.controller;

import com.example.adaptivestream.api.response.ApiResponse;
import com.example.adaptivestream.api.response.ProviderStatusResponse;
import com.example.adaptivestream.application.service.ProviderAdminService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/providers")
public class ProviderController {

    private final ProviderAdminService providerAdminService;

    public ProviderController(ProviderAdminService providerAdminService) {
        this.providerAdminService = providerAdminService;
    }

    @GetMapping
    public ApiResponse<List<ProviderStatusResponse>> listProviders() {
        return ApiResponse.success(providerAdminService.listProviders());
    }

    @PostMapping("/{name}/disable")
    public ApiResponse<ProviderStatusResponse> disable(@PathVariable("name") String name) {
        return ApiResponse.success(providerAdminService.disable(name));
    }

    @PostMapping("/{name}/enable")
    public ApiResponse<ProviderStatusResponse> enable(@PathVariable("name") String name) {
        return ApiResponse.success(providerAdminService.enable(name));
    }
}
