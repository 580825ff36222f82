package com.structo.shortener.controller;

import com.structo.shortener.dto.MessageResponse;
import com.structo.shortener.dto.ShortLinkResponse;
import com.structo.shortener.dto.ShortenRequest;
import com.structo.shortener.exception.UnauthorizedException;
import com.structo.shortener.model.AppUser;
import com.structo.shortener.model.ShortLink;
import com.structo.shortener.service.AuthService;
import com.structo.shortener.service.ShortLinkService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class UrlController {

    private final ShortLinkService shortLinkService;
    private final AuthService authService;

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    @PostMapping("/shorten")
    public ResponseEntity<ShortLinkResponse> shorten(
            @RequestAttribute(value = "userId", required = false) Long userId,
            @Valid @RequestBody ShortenRequest request) {

        AppUser user = authService.getUser(userId);
        ShortLink link = shortLinkService.shorten(request.getUrl(), request.getCustomCode(), request.getTtl(), user);
        return ResponseEntity.status(HttpStatus.CREATED).body(shortLinkService.toResponse(link, false));
    }

    @GetMapping("/urls")
    public ResponseEntity<List<ShortLinkResponse>> listUrls(
            @RequestAttribute(value = "userId", required = false) Long userId,
            @RequestParam(value = "active_only", defaultValue = "true") boolean activeOnly) {

        Long ownerId = requireUser(userId);
        return ResponseEntity.ok(shortLinkService.toResponses(shortLinkService.listOwned(ownerId, activeOnly), true));
    }

    @GetMapping("/urls/{code}")
    public ResponseEntity<ShortLinkResponse> getInfo(
            @RequestAttribute(value = "userId", required = false) Long userId,
            @PathVariable String code) {

        ShortLink link = shortLinkService.findVisible(code, userId);
        return ResponseEntity.ok(shortLinkService.toResponse(link, link.isOwnedBy(userId)));
    }

    @DeleteMapping("/urls/{code}")
    public ResponseEntity<MessageResponse> deactivate(
            @RequestAttribute(value = "userId", required = false) Long userId,
            @PathVariable String code) {

        shortLinkService.deactivate(code, requireUser(userId));
        return ResponseEntity.ok(new MessageResponse("URL deactivated successfully."));
    }

    private Long requireUser(Long userId) {
        if (authService.getUser(userId) == null) {
            throw new UnauthorizedException();
        }
        return userId;
    }
}
