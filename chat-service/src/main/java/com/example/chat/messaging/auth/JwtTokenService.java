package com.example.chat.messaging.auth;

import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.exception.AuthenticationFailureException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * HMAC-signed bearer tokens whose subject is the user id.
 */
@Component
public class JwtTokenService {

    private final SecretKey key;
    private final String issuer;
    private final JwtParser parser;

    public JwtTokenService(AppProperties appProperties) {
        AppProperties.Auth auth = appProperties.getAuth();
        this.key = Keys.hmacShaKeyFor(auth.getJwtSecret().getBytes(StandardCharsets.UTF_8));
        this.issuer = auth.getIssuer();
        this.parser = Jwts.parserBuilder()
                .setSigningKey(key)
                .requireIssuer(issuer)
                .setAllowedClockSkewSeconds(auth.getClockSkewSeconds())
                .build();
    }

    /**
     * @return the user id carried by a valid token
     */
    public String verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationFailureException("Missing bearer token");
        }
        try {
            Claims claims = parser.parseClaimsJws(token.trim()).getBody();
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                throw new AuthenticationFailureException("Token has no subject");
            }
            return subject;
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthenticationFailureException("Invalid bearer token", e);
        }
    }

    public String issue(String userId, Duration validity) {
        Instant now = Instant.now();
        return Jwts.builder()
                .setSubject(userId)
                .setIssuer(issuer)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(validity)))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }
}
