package com.chamapool.chama.controller;

import com.chamapool.chama.dto.RegistryStatusResponse;
import com.chamapool.chama.service.ChamaGroupService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Registry administration: global pause of group creation.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chama/registry")
@RequiredArgsConstructor
@Tag(name = "Chama Registry", description = "Group registry administration")
@SecurityRequirement(name = "bearer-jwt")
public class ChamaRegistryController {

    private final ChamaGroupService chamaGroupService;

    @GetMapping
    @Operation(summary = "Get registry status")
    public ResponseEntity<RegistryStatusResponse> getStatus() {
        return ResponseEntity.ok(chamaGroupService.getRegistryStatus());
    }

    @PostMapping("/pause")
    @Operation(summary = "Pause group creation (registry owner only)")
    public ResponseEntity<RegistryStatusResponse> pause(@AuthenticationPrincipal Jwt jwt) {
        log.warn("Registry pause requested by {}", jwt.getSubject());
        return ResponseEntity.ok(chamaGroupService.pauseRegistry(jwt.getSubject()));
    }

    @PostMapping("/unpause")
    @Operation(summary = "Resume group creation (registry owner only)")
    public ResponseEntity<RegistryStatusResponse> unpause(@AuthenticationPrincipal Jwt jwt) {
        log.info("Registry unpause requested by {}", jwt.getSubject());
        return ResponseEntity.ok(chamaGroupService.unpauseRegistry(jwt.getSubject()));
    }
}
