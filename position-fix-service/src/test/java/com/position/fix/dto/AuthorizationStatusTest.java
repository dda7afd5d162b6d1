// com/position/fix/dto/AuthorizationStatusTest.java
package com.position.fix.dto;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class AuthorizationStatusTest {

    @ParameterizedTest
    @EnumSource(value = AuthorizationStatus.class, names = {"RESTRICTED", "DENIED", "NOT_AVAILABLE"})
    void shouldForbidLocationUse(AuthorizationStatus status) {
        assertThat(status.forbidsLocationUse()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = AuthorizationStatus.class, names = {"NOT_DETERMINED", "ALLOWED_WHEN_IN_USE", "ALLOWED_ALWAYS"})
    void shouldPermitLocationUse(AuthorizationStatus status) {
        assertThat(status.forbidsLocationUse()).isFalse();
    }
}
