package com.gatehouse.backend.modules.user.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.gatehouse.backend.global.error.ProblemException;
import com.gatehouse.backend.global.error.ProblemKind;
import com.gatehouse.backend.modules.user.domain.AppUser;
import com.gatehouse.backend.modules.user.infrastructure.persistence.AppUserRepository;
import com.gatehouse.backend.support.TestFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000601");

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private RoleService roleService;

    @Mock
    private PasswordEncoder passwordEncoder;

    @InjectMocks
    private UserService userService;

    @BeforeEach
    void setUp() {
        lenient().when(appUserRepository.save(any(AppUser.class))).thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(passwordEncoder.encode(any())).thenAnswer(invocation -> "hashed:" + invocation.getArgument(0));
    }

    @Test
    void updateAppliesOnlyProvidedFields() {
        AppUser alice = TestFixtures.user(USER_ID, "alice@example.com");
        alice.setAcceptedTerms(true);
        when(appUserRepository.findByIdWithRoles(USER_ID)).thenReturn(Optional.of(alice));

        AppUser updated = userService.update(USER_ID, UserUpdate.empty().withPassword("n3w").withEmailValidated(true));

        assertThat(updated.getPasswordHash()).isEqualTo("hashed:n3w");
        assertThat(updated.isEmailValidated()).isTrue();
        assertThat(updated.isAcceptedTerms()).isTrue();
    }

    @Test
    void emptyUpdateDoesNotWrite() {
        when(appUserRepository.findByIdWithRoles(USER_ID)).thenReturn(Optional.of(TestFixtures.user(USER_ID, "alice@example.com")));

        userService.update(USER_ID, UserUpdate.empty());

        verify(appUserRepository, never()).save(any());
    }

    @Test
    void unknownUserIsNotFound() {
        when(appUserRepository.findByIdWithRoles(USER_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.getById(USER_ID))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getKind()).isEqualTo(ProblemKind.NOT_FOUND));
        assertThat(userService.findById(null)).isEmpty();
    }

    @Test
    void createNormalizesEmailAndResolvesRoles() {
        when(roleService.findByNames(List.of("member"))).thenReturn(List.of(TestFixtures.role("member")));

        AppUser created = userService.create(new NewUser("  Bob@Example.COM ", null, "pw", List.of("member"), true, false, false));

        assertThat(created.getEmail()).isEqualTo("bob@example.com");
        assertThat(created.getUsername()).isEqualTo("bob@example.com");
        assertThat(created.getPasswordHash()).isEqualTo("hashed:pw");
        assertThat(created.getRoleNames()).containsExactly("member");
        assertThat(created.isEmailValidated()).isTrue();
    }

    @Test
    void createRejectsUnknownRole() {
        when(roleService.findByNames(List.of("ghost"))).thenReturn(List.of());

        assertThatThrownBy(() -> userService.create(new NewUser("new@example.com", null, null, List.of("ghost"), false, false, false)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("ROLE_NOT_FOUND"));
    }

    @Test
    void createRejectsDuplicateEmail() {
        when(appUserRepository.existsByEmailIgnoreCase("taken@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.create(new NewUser("Taken@example.com", null, null, List.of(), false, false, false)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("USER_ALREADY_EXISTS"));
    }

    @Test
    void normalizeEmailTrimsAndLowercases() {
        assertThat(UserService.normalizeEmail(" A@B.C ")).isEqualTo("a@b.c");
        assertThat(UserService.normalizeEmail("   ")).isNull();
        assertThat(UserService.normalizeEmail(null)).isNull();
    }
}
