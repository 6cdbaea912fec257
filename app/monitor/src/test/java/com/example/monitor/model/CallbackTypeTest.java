package com.example.monitor.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class CallbackTypeTest {

  @Test
  void parsesHostCallbackNames() {
    assertThat(CallbackType.fromValue("start")).isEqualTo(CallbackType.START);
    assertThat(CallbackType.fromValue("Warning-End")).isEqualTo(CallbackType.WARNING_END);
    assertThat(CallbackType.WARNING_START.isWarning()).isTrue();
    assertThat(CallbackType.END.isWarning()).isFalse();
  }

  @Test
  void rejectsUnknownCallback() {
    assertThatThrownBy(() -> CallbackType.fromValue("pause"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unsupported callback");
  }
}
