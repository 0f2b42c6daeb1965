// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.conformance;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SuiteConfigTest {

  @Test
  void emptyPropertiesGiveDefaults() {
    assertThat(SuiteConfig.from(new Properties())).isEqualTo(SuiteConfig.defaults());
  }

  @Test
  void propertiesOverrideDefaults() {
    Properties properties = new Properties();
    properties.setProperty("didwire.suite.endpoint", "http://suite:3000/indy");
    properties.setProperty("didwire.suite.expect-millis", "2500");
    properties.setProperty("didwire.suite.silence-millis", " 750 ");

    SuiteConfig config = SuiteConfig.from(properties);

    assertThat(config.label()).isEqualTo("conformance suite");
    assertThat(config.endpoint()).isEqualTo("http://suite:3000/indy");
    assertThat(config.expectTimeout()).isEqualTo(Duration.ofMillis(2500));
    assertThat(config.silenceWindow()).isEqualTo(Duration.ofMillis(750));
  }

  @Test
  void negativeWindowsAreRejected() {
    assertThatThrownBy(() -> SuiteConfig.defaults().withSilenceWindow(Duration.ofMillis(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
