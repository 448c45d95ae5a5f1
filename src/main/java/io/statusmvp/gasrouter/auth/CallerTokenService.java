package io.statusmvp.gasrouter.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Locale;
import java.util.UUID;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HS256 bearer tokens carrying the caller id ({@code sub}) and its {@link
 * Role} ({@code role} claim).
 */
@Service
public class CallerTokenService {
  private static final String BEARER = "Bearer ";

  private final String issuer;
  private final String audience;
  private final SecretKey secret;

  public CallerTokenService(OptimizerProperties properties) {
    this.issuer = properties.getAccess().getJwtIssuer();
    this.audience = properties.getAccess().getJwtAudience();
    byte[] secretBytes = properties.getAccess().getJwtSecret().getBytes(StandardCharsets.UTF_8);
    if (secretBytes.length < 32) {
      throw new IllegalStateException("app.optimizer.access.jwtSecret must be at least 32 bytes");
    }
    this.secret = new SecretKeySpec(secretBytes, "HmacSHA256");
  }

  public String issue(Caller caller, long ttlSeconds) {
    try {
      Instant now = Instant.now();
      SignedJWT jwt =
          new SignedJWT(
              new JWSHeader.Builder(JWSAlgorithm.HS256).type(JOSEObjectType.JWT).build(),
              new JWTClaimsSet.Builder()
                  .issuer(issuer)
                  .audience(audience)
                  .subject(caller.id())
                  .issueTime(Date.from(now))
                  .expirationTime(Date.from(now.plusSeconds(Math.max(30, ttlSeconds))))
                  .jwtID(UUID.randomUUID().toString())
                  .claim("role", caller.role().name())
                  .build());
      jwt.sign(new MACSigner(secret.getEncoded()));
      return jwt.serialize();
    } catch (JOSEException e) {
      throw new IllegalStateException("failed to sign caller token", e);
    }
  }

  /** Resolves the caller from an {@code Authorization: Bearer ...} header value. */
  public Caller resolve(String authorizationHeader) {
    if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER)) {
      throw unauthenticated("missing bearer token");
    }
    return verify(authorizationHeader.substring(BEARER.length()).trim());
  }

  public Caller verify(String token) {
    try {
      SignedJWT jwt = SignedJWT.parse(token);
      JWSVerifier verifier = new MACVerifier(secret.getEncoded());
      if (!jwt.verify(verifier)) throw unauthenticated("invalid caller token");
      JWTClaimsSet claims = jwt.getJWTClaimsSet();
      if (claims.getIssuer() == null || !claims.getIssuer().equals(issuer)) {
        throw unauthenticated("invalid caller token");
      }
      if (claims.getAudience() == null || !claims.getAudience().contains(audience)) {
        throw unauthenticated("invalid caller token");
      }
      Date expires = claims.getExpirationTime();
      if (expires == null || expires.before(new Date())) {
        throw unauthenticated("caller token expired");
      }
      String subject = claims.getSubject();
      if (subject == null || subject.isBlank()) throw unauthenticated("invalid caller token");
      Object role = claims.getClaim("role");
      if (!(role instanceof String roleName)) throw unauthenticated("invalid caller role");
      return new Caller(subject, Role.valueOf(roleName.toUpperCase(Locale.ROOT)));
    } catch (OptimizerException e) {
      throw e;
    } catch (Exception e) {
      throw unauthenticated("invalid caller token");
    }
  }

  private static OptimizerException unauthenticated(String message) {
    return new OptimizerException(OptimizerErrorCode.UNAUTHENTICATED, message);
  }
}
