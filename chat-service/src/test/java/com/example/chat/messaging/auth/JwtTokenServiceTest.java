package com.example.chat.messaging.auth;

import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.exception.AuthenticationFailureException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenServiceTest {

    private final JwtTokenService tokenService = new JwtTokenService(new AppProperties());

    @Test
    void issuedTokenVerifiesToItsSubject() {
        String token = tokenService.issue("user-001", Duration.ofMinutes(5));

        assertThat(tokenService.verify(token)).isEqualTo("user-001");
        assertThat(tokenService.verify("  " + token + " ")).isEqualTo("user-001");
    }

    @Test
    void expiredTokenIsRejected() {
        String token = tokenService.issue("user-001", Duration.ofMinutes(-5));

        assertThatThrownBy(() -> tokenService.verify(token))
                .isInstanceOf(AuthenticationFailureException.class)
                .hasMessage("Invalid bearer token");
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        AppProperties other = new AppProperties();
        other.getAuth().setJwtSecret("another-secret-another-secret-another-secret-42");
        String forged = new JwtTokenService(other).issue("user-001", Duration.ofMinutes(5));

        assertThatThrownBy(() -> tokenService.verify(forged)).isInstanceOf(AuthenticationFailureException.class);
    }

    @Test
    void missingOrGarbageTokenIsRejected() {
        assertThatThrownBy(() -> tokenService.verify(null)).hasMessage("Missing bearer token");
        assertThatThrownBy(() -> tokenService.verify(" ")).hasMessage("Missing bearer token");
        assertThatThrownBy(() -> tokenService.verify("abc.def.ghi")).isInstanceOf(AuthenticationFailureException.class);
    }
}
