package com.structo.shortener.controller;

import com.structo.shortener.model.ClientInfo;
import com.structo.shortener.service.AsyncClickRecorder;
import com.structo.shortener.service.RedirectService;
import com.structo.shortener.service.RedirectTarget;
import com.structo.shortener.util.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

import java.io.IOException;
import java.util.Optional;

@Controller
@RequiredArgsConstructor
public class RedirectController {

    private final RedirectService redirectService;
    private final AsyncClickRecorder clickRecorder;

    @GetMapping("/{code:[A-Za-z0-9-]{3,20}}")
    public void redirect(@PathVariable String code, HttpServletRequest request, HttpServletResponse response) throws IOException {
        Optional<RedirectTarget> target = redirectService.resolve(code);
        if (target.isEmpty()) {
            response.sendError(HttpServletResponse.SC_NOT_FOUND);
            return;
        }

        ClientInfo client = new ClientInfo(
                ClientIpResolver.resolve(request),
                request.getHeader(HttpHeaders.USER_AGENT),
                request.getHeader(HttpHeaders.REFERER));
        clickRecorder.record(client, target.get().getLinkId());
        response.sendRedirect(target.get().getOriginalUrl());
    }
}
