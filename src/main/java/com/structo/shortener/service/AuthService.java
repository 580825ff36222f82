package com.structo.shortener.service;

import com.structo.shortener.dto.AuthResponse;
import com.structo.shortener.dto.LoginRequest;
import com.structo.shortener.dto.RegisterRequest;
import com.structo.shortener.exception.ConflictException;
import com.structo.shortener.exception.UnauthorizedException;
import com.structo.shortener.model.AppUser;
import com.structo.shortener.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import org.mindrot.jbcrypt.BCrypt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Minimal identity provider: the shortener only needs "current user or none".
 */
@Service
@RequiredArgsConstructor
public class AuthService {

    private final AppUserRepository userRepository;
    private final JwtService jwtService;

    @Transactional
    public AuthResponse register(RegisterRequest request) {
        String email = request.getEmail().toLowerCase(Locale.ROOT);
        if (userRepository.findByEmail(email).isPresent()) {
            throw new ConflictException("Email already registered");
        }

        AppUser user = new AppUser();
        user.setName(request.getName());
        user.setEmail(email);
        user.setPasswordHash(BCrypt.hashpw(request.getPassword(), BCrypt.gensalt()));
        user = userRepository.save(user);

        String token = jwtService.generateToken(user.getId(), user.getEmail());
        return new AuthResponse(user.getId(), user.getName(), user.getEmail(), token);
    }

    public AuthResponse login(LoginRequest request) {
        String email = request.getEmail().toLowerCase(Locale.ROOT);
        AppUser user = userRepository.findByEmail(email)
                .filter(u -> BCrypt.checkpw(request.getPassword(), u.getPasswordHash()))
                .orElseThrow(() -> new UnauthorizedException("Invalid email or password"));

        String token = jwtService.generateToken(user.getId(), user.getEmail());
        return new AuthResponse(user.getId(), user.getName(), user.getEmail(), token);
    }

    public AppUser getUser(Long id) {
        return id == null ? null : userRepository.findById(id).orElse(null);
    }
}
