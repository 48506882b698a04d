package com.evoila.lokigate.loki.result;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class SeverityLevelTest {

  @ParameterizedTest
  @CsvSource({
    "FATAL, critical",
    "Critical, critical",
    "emerg, critical",
    "ERROR, error",
    "error, error",
    "ERR, error",
    "Warn, warning",
    "WARNING, warning",
    "INFO, info",
    "Informational, info",
    "notice, info",
    "DEBUG, debug",
    "dbug, debug",
    "TRACE, trace"
  })
  void toLevelLabel_ShouldMapCaseInsensitively(String severity, String expected) {
    assertThat(SeverityLevel.toLevelLabel(severity)).isEqualTo(expected);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"verbose", "42"})
  void toLevelLabel_ShouldMapUnrecognizedToUnknown(String severity) {
    assertThat(SeverityLevel.fromSeverityText(severity)).isEqualTo(SeverityLevel.UNKNOWN);
    assertThat(SeverityLevel.toLevelLabel(severity)).isEqualTo("unknown");
  }
}
