package com.chatdesk.auth;

import com.chatdesk.config.AuthProperties;
import com.chatdesk.user.domain.User;
import com.chatdesk.user.domain.UserRole;
import com.chatdesk.user.repository.UserRepository;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JwtCredentialValidator 단위 테스트")
class JwtCredentialValidatorTest {

    private static final String SECRET = "test-secret-key-for-realtime-handshake-validation";
    private static final SecretKey KEY = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));

    @Mock
    private UserRepository userRepository;

    private JwtCredentialValidator validator;
    private UUID userId;
    private UUID tenantId;

    @BeforeEach
    void setUp() {
        AuthProperties properties = new AuthProperties();
        properties.setJwtSecret(SECRET);
        validator = new JwtCredentialValidator(properties, userRepository);
        userId = UUID.randomUUID();
        tenantId = UUID.randomUUID();
    }

    @Test
    @DisplayName("유효한 토큰이면 사용자와 테넌트 정보를 반환한다")
    void validate_ValidToken() {
        // given
        when(userRepository.findActiveInActiveTenant(userId)).thenReturn(Optional.of(activeUser()));
        String token = token(userId.toString(), Instant.now().plus(1, ChronoUnit.HOURS));

        // when
        AuthenticatedPrincipal principal = validator.validate(token);

        // then
        assertThat(principal.userId()).isEqualTo(userId);
        assertThat(principal.tenantId()).isEqualTo(tenantId);
        assertThat(principal.role()).isEqualTo(UserRole.MANAGER);
        assertThat(principal.firstName()).isEqualTo("Mina");
    }

    @Test
    @DisplayName("userId 클레임이 없으면 subject를 사용자 ID로 사용한다")
    void validate_FallsBackToSubject() {
        // given
        when(userRepository.findActiveInActiveTenant(userId)).thenReturn(Optional.of(activeUser()));
        String token = Jwts.builder()
                .subject(userId.toString())
                .expiration(Date.from(Instant.now().plus(1, ChronoUnit.HOURS)))
                .signWith(KEY)
                .compact();

        // when
        AuthenticatedPrincipal principal = validator.validate(token);

        // then
        assertThat(principal.userId()).isEqualTo(userId);
    }

    @Test
    @DisplayName("토큰이 비어 있으면 Token required 예외가 발생한다")
    void validate_BlankToken() {
        assertThatThrownBy(() -> validator.validate("  "))
                .isInstanceOf(InvalidCredentialException.class)
                .hasMessage("Token required");
    }

    @Test
    @DisplayName("만료된 토큰은 Authentication failed로 거절된다")
    void validate_ExpiredToken() {
        // given
        String token = token(userId.toString(), Instant.now().minus(1, ChronoUnit.HOURS));

        // when & then
        assertThatThrownBy(() -> validator.validate(token))
                .isInstanceOf(InvalidCredentialException.class)
                .hasMessage("Authentication failed");
        verify(userRepository, never()).findActiveInActiveTenant(any());
    }

    @Test
    @DisplayName("다른 키로 서명된 토큰은 거절된다")
    void validate_ForeignSignature() {
        // given
        SecretKey otherKey = Keys.hmacShaKeyFor("another-secret-key-that-is-long-enough-for-hs256".getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder()
                .claim("userId", userId.toString())
                .signWith(otherKey)
                .compact();

        // when & then
        assertThatThrownBy(() -> validator.validate(token))
                .isInstanceOf(InvalidCredentialException.class)
                .hasMessage("Authentication failed");
    }

    @Test
    @DisplayName("사용자 ID가 UUID가 아니면 거절된다")
    void validate_MalformedUserId() {
        // given
        String token = token("not-a-uuid", Instant.now().plus(1, ChronoUnit.HOURS));

        // when & then
        assertThatThrownBy(() -> validator.validate(token))
                .isInstanceOf(InvalidCredentialException.class)
                .hasMessage("Token has a malformed user id");
    }

    @Test
    @DisplayName("비활성 사용자 또는 비활성 테넌트는 거절된다")
    void validate_InactiveUser() {
        // given
        when(userRepository.findActiveInActiveTenant(userId)).thenReturn(Optional.empty());
        String token = token(userId.toString(), Instant.now().plus(1, ChronoUnit.HOURS));

        // when & then
        assertThatThrownBy(() -> validator.validate(token))
                .isInstanceOf(InvalidCredentialException.class)
                .hasMessage("User not found or inactive");
    }

    private String token(String userIdClaim, Instant expiration) {
        return Jwts.builder()
                .claim("userId", userIdClaim)
                .issuedAt(Date.from(expiration.minus(2, ChronoUnit.HOURS)))
                .expiration(Date.from(expiration))
                .signWith(KEY)
                .compact();
    }

    private User activeUser() {
        return User.builder()
                .id(userId)
                .tenantId(tenantId)
                .email("mina@example.com")
                .firstName("Mina")
                .lastName("Park")
                .role(UserRole.MANAGER)
                .active(true)
                .build();
    }
}
