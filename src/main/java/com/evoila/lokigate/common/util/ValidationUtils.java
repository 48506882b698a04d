package com.evoila.lokigate.common.util;

import com.evoila.lokigate.common.model.GatewayValidationException;

/**
 * Utility class for common validation patterns used throughout the codebase. Consolidates repeated
 * validation logic to improve maintainability and consistency.
 */
public final class ValidationUtils {

  private ValidationUtils() {
    // Utility class - prevent instantiation
  }

  /**
   * Validates that a request parameter is present and not blank.
   *
   * @param value the parameter value
   * @param parameterName the parameter name for error messages
   * @throws GatewayValidationException if the value is null or blank
   */
  public static void requireParameter(String value, String parameterName) {
    if (!isNotNullOrEmpty(value)) {
      throw new GatewayValidationException(parameterName + " parameter is required");
    }
  }

  /**
   * Validates that a string is not null or empty (after trimming) Returns true if valid, false if
   * null or empty
   *
   * @param value the string to validate
   * @return true if the string is not null and not empty, false otherwise
   */
  public static boolean isNotNullOrEmpty(String value) {
    return value != null && !value.trim().isEmpty();
  }

  /**
   * Validates that a label name can be interpolated into a grouping expression. This rejects
   * whitespace, quotes and backticks; it is not a complete identifier check.
   *
   * @param labelName the label name to validate
   * @throws GatewayValidationException if the label name contains invalid characters
   */
  public static void validateLabelNameCharacters(String labelName) {
    if (labelName == null || labelName.isBlank()) {
      throw new GatewayValidationException("Label name cannot be empty");
    }

    if (labelName.chars().anyMatch(Character::isWhitespace)
        || labelName.contains("\"")
        || labelName.contains("'")
        || labelName.contains("`")
        || labelName.contains("\\")) {
      throw new GatewayValidationException("Label name contains invalid characters: " + labelName);
    }
  }
}
