package com.codeheadsystems.justbot.session.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.justbot.session.exceptions.SessionConfirmationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ConfirmationResultTest {

  @Test
  void orThrow_confirmed_returnsItself() {
    assertThat(ConfirmationResult.CONFIRMED.orThrow()).isEqualTo(ConfirmationResult.CONFIRMED);
  }

  @ParameterizedTest
  @EnumSource(value = ConfirmationResult.class, names = {"NOT_REQUIRED", "KEY_INCORRECT"})
  void orThrow_failure_throws(ConfirmationResult result) {
    assertThat(result.isSuccess()).isFalse();
    assertThatThrownBy(result::orThrow)
        .hasMessage("Confirmation key incorrect")
        .isInstanceOfSatisfying(SessionConfirmationException.class,
            e -> assertThat(e.result()).isEqualTo(result));
  }
}
