package org.holdem.security;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtUtilTest {

    private static final String SECRET = "aG9sZGVtLXRlc3Qtc2VjcmV0LWtleS1hdC1sZWFzdC0zMi1ieXRlcy1sb25nISE=";
    private static final String OTHER = "b3RoZXItc2VjcmV0LWtleS10aGF0LWlzLWF0LWxlYXN0LTMyLWJ5dGVzISE=";

    @Test
    void generatedToken_validatesAndCarriesSubject() {
        JwtUtil jwt = new JwtUtil(SECRET, 60_000);
        String token = jwt.generateToken("player-42");

        assertThat(jwt.validateToken(token)).isTrue();
        assertThat(jwt.extractSubject(token)).isEqualTo("player-42");
    }

    @Test
    void tokenSignedWithOtherKey_isRejected() {
        String token = new JwtUtil(OTHER, 60_000).generateToken("mallory");

        assertThat(new JwtUtil(SECRET, 60_000).validateToken(token)).isFalse();
    }

    @Test
    void expiredToken_isRejected() {
        JwtUtil jwt = new JwtUtil(SECRET, -1_000);

        assertThat(jwt.validateToken(jwt.generateToken("late"))).isFalse();
    }

    @Test
    void garbage_isRejected() {
        JwtUtil jwt = new JwtUtil(SECRET, 60_000);

        assertThat(jwt.validateToken("not-a-jwt")).isFalse();
        assertThat(jwt.validateToken("")).isFalse();
    }

    @Test
    void missingSecret_failsAtStartup() {
        assertThatThrownBy(() -> new JwtUtil("", 60_000))
                .isInstanceOf(IllegalStateException.class);
    }
}
