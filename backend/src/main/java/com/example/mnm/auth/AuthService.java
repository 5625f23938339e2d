package com.example.mnm.auth;

import com.example.mnm.access.ResourceCollection;
import com.example.mnm.auditlog.SecurityAuditService;
import com.example.mnm.config.AuthProps;
import com.example.mnm.dto.AuthDtos.AuthResponse;
import com.example.mnm.dto.AuthDtos.LoginRequest;
import com.example.mnm.dto.AuthDtos.PublicUser;
import com.example.mnm.dto.AuthDtos.RegisterRequest;
import com.example.mnm.exceptions.DuplicateIdentityException;
import com.example.mnm.exceptions.InvalidCredentialFormatException;
import com.example.mnm.exceptions.InvalidCredentialsException;
import com.example.mnm.exceptions.TooManyRequestsException;
import com.example.mnm.exceptions.UnauthenticatedException;
import com.example.mnm.record.RecordTimestamps;
import com.example.mnm.security.AuthenticatedUser;
import com.example.mnm.security.JwtService;
import com.example.mnm.security.LoginRateLimiter;
import com.example.mnm.security.PasswordVerifier;
import com.example.mnm.store.RecordStore;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Registration, login and token verification. User records live in the {@code users}
 * collection of the {@link RecordStore}; secrets are kept only as Argon2 hashes.
 */
@Service
public class AuthService {

    public static final String EMAIL = "email";
    public static final String PASSWORD = "password";
    public static final String PASSWORD_HASH = "passwordHash";
    public static final String ROLE = "role";
    public static final String PHONE = "phone";

    private static final String USERS = ResourceCollection.USERS.path();
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final RecordStore store;
    private final PasswordVerifier passwordVerifier;
    private final JwtService jwtService;
    private final LoginRateLimiter loginRateLimiter;
    private final SecurityAuditService auditService;
    private final RecordTimestamps timestamps;
    private final AuthProps authProps;

    private final Object identityLock = new Object();

    public AuthService(RecordStore store,
                       PasswordVerifier passwordVerifier,
                       JwtService jwtService,
                       LoginRateLimiter loginRateLimiter,
                       SecurityAuditService auditService,
                       RecordTimestamps timestamps,
                       AuthProps authProps) {
        this.store = store;
        this.passwordVerifier = passwordVerifier;
        this.jwtService = jwtService;
        this.loginRateLimiter = loginRateLimiter;
        this.auditService = auditService;
        this.timestamps = timestamps;
        this.authProps = authProps;
    }

    /**
     * Creates a user and returns a token bound to it.
     *
     * @throws InvalidCredentialFormatException if the email, secret or role is unacceptable
     * @throws DuplicateIdentityException       if the email is already registered
     */
    public AuthResponse register(RegisterRequest request) {
        String email = requireValidEmail(request.identity());
        requireValidSecret(request.secret());
        UserRole role = request.role() == null || request.role().isBlank()
                ? UserRole.CLIENT
                : requireValidRole(request.role());

        Map<String, Object> user = new LinkedHashMap<>();
        user.put(EMAIL, email);
        if (request.phone() != null && !request.phone().isBlank()) {
            user.put(PHONE, request.phone().trim());
        }
        user.put(PASSWORD_HASH, passwordVerifier.encode(request.secret()));
        user.put(ROLE, role.value());
        timestamps.stampCreated(user);

        Map<String, Object> saved;
        synchronized (identityLock) {
            if (findByEmail(email).isPresent()) {
                throw new DuplicateIdentityException("Email already registered");
            }
            saved = store.create(USERS, user);
        }

        String userId = saved.get(RecordStore.ID).toString();
        auditService.recordRegistration(userId, role.value());
        return new AuthResponse(jwtService.generate(userId), PublicUser.fromRecord(saved));
    }

    /**
     * Checks the credentials and returns a fresh token. Unknown identities and wrong secrets
     * fail identically.
     *
     * @throws InvalidCredentialsException on any credential mismatch
     * @throws TooManyRequestsException    when {@code clientAddress} exceeded its attempt budget
     */
    public AuthResponse login(LoginRequest request, String clientAddress) {
        String email = normalizeEmail(request.identity());
        if (!loginRateLimiter.tryAcquire(clientAddress, email)) {
            auditService.recordLoginThrottled(email);
            throw new TooManyRequestsException();
        }

        Optional<Map<String, Object>> user = email.isEmpty() ? Optional.empty() : findByEmail(email);
        boolean verified = user
                .map(u -> passwordVerifier.verify(request.secret(), stringValue(u.get(PASSWORD_HASH))))
                .orElseGet(() -> passwordVerifier.verifyAgainstPlaceholder(request.secret()));
        if (!verified) {
            auditService.recordLoginFailure(email);
            throw new InvalidCredentialsException();
        }

        Map<String, Object> account = user.get();
        String userId = account.get(RecordStore.ID).toString();
        auditService.recordLoginSuccess(userId);
        return new AuthResponse(jwtService.generate(userId), PublicUser.fromRecord(account));
    }

    /**
     * Resolves a bearer token to the user it was issued for. Empty when the token is valid but
     * its user no longer exists.
     *
     * @throws UnauthenticatedException if the token is missing, malformed, expired or badly signed
     */
    public Optional<AuthenticatedUser> verify(String token) {
        String userId = jwtService.verify(token);
        return store.get(USERS, userId)
                .map(user -> new AuthenticatedUser(userId,
                        UserRole.fromValue(stringValue(user.get(ROLE))).orElse(UserRole.CLIENT)));
    }

    /**
     * Applies the credential rules to a user-record write coming through the generic CRUD
     * surface: a plain {@code password} is checked and hashed, a raw {@code passwordHash} is
     * dropped, and a changed email must be valid and unused. For a full replacement the
     * stored hash, email and role are kept when the payload does not supply new ones.
     */
    public Map<String, Object> prepareUserChanges(Map<String, Object> existing,
                                                  Map<String, Object> changes,
                                                  boolean replace) {
        Map<String, Object> prepared = new LinkedHashMap<>(changes);
        prepared.remove(PASSWORD_HASH);

        Object password = prepared.remove(PASSWORD);
        if (password != null) {
            requireValidSecret(password.toString());
            prepared.put(PASSWORD_HASH, passwordVerifier.encode(password.toString()));
        } else if (replace) {
            prepared.put(PASSWORD_HASH, existing.get(PASSWORD_HASH));
        }

        if (prepared.containsKey(EMAIL)) {
            String email = requireValidEmail(stringValue(prepared.get(EMAIL)));
            String userId = stringValue(existing.get(RecordStore.ID));
            boolean takenByOther = findByEmail(email)
                    .filter(other -> !Objects.equals(stringValue(other.get(RecordStore.ID)), userId))
                    .isPresent();
            if (takenByOther) {
                throw new DuplicateIdentityException("Email already registered");
            }
            prepared.put(EMAIL, email);
        } else if (replace) {
            prepared.put(EMAIL, existing.get(EMAIL));
        }

        if (prepared.containsKey(ROLE)) {
            prepared.put(ROLE, requireValidRole(stringValue(prepared.get(ROLE))).value());
        } else if (replace) {
            prepared.put(ROLE, existing.get(ROLE));
        }
        return prepared;
    }

    /**
     * Copy of a user record without its password hash.
     */
    public static Map<String, Object> withoutSecrets(Map<String, Object> user) {
        Map<String, Object> copy = new LinkedHashMap<>(user);
        copy.remove(PASSWORD_HASH);
        copy.remove(PASSWORD);
        return copy;
    }

    private Optional<Map<String, Object>> findByEmail(String email) {
        List<Map<String, Object>> matches = store.list(USERS, Map.of(EMAIL, email));
        return matches.stream().findFirst();
    }

    private String requireValidEmail(String identity) {
        String email = normalizeEmail(identity);
        if (email.isEmpty() || !EMAIL_PATTERN.matcher(email).matches()) {
            throw new InvalidCredentialFormatException("Email format is invalid");
        }
        return email;
    }

    private void requireValidSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new InvalidCredentialFormatException("Password is required");
        }
        if (secret.length() < authProps.getPasswordMinLength()) {
            throw new InvalidCredentialFormatException(
                    "Password must be at least " + authProps.getPasswordMinLength() + " characters");
        }
    }

    private UserRole requireValidRole(String role) {
        return UserRole.fromValue(role)
                .orElseThrow(() -> new InvalidCredentialFormatException("Role must be 'client' or 'professional'"));
    }

    private static String normalizeEmail(String identity) {
        return identity == null ? "" : identity.trim().toLowerCase(Locale.ROOT);
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }
}
