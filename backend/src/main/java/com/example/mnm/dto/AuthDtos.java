package com.example.mnm.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.Map;

public class AuthDtos {

    public record PublicUser(
            String id,
            String identity,
            String email,
            String phone,
            String role,
            String createdAt,
            String updatedAt
    ) {
        public static PublicUser fromRecord(Map<String, Object> user) {
            String email = text(user.get("email"));
            return new PublicUser(
                    text(user.get("id")),
                    email,
                    email,
                    text(user.get("phone")),
                    text(user.get("role")),
                    text(user.get("createdAt")),
                    text(user.get("updatedAt"))
            );
        }

        private static String text(Object value) {
            return value != null ? value.toString() : null;
        }
    }

    public record RegisterRequest(
            @JsonAlias("email") String identity,
            @JsonAlias("password") String secret,
            String role,
            String phone
    ) {}

    public record LoginRequest(
            @JsonAlias("email") String identity,
            @JsonAlias("password") String secret
    ) {}

    public record AuthResponse(
            String token,
            PublicUser user
    ) {}
}
