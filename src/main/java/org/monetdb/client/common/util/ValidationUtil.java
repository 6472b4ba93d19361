package org.monetdb.client.common.util;

import org.monetdb.client.exception.MonetValidationException;
import org.monetdb.client.log.MonetLogger;
import org.monetdb.client.log.MonetLoggerFactory;

public class ValidationUtil {

  private static final MonetLogger LOGGER = MonetLoggerFactory.getLogger(ValidationUtil.class);

  /**
   * Validates a reply size: {@code -1} (unlimited) or a positive number of rows.
   *
   * @param replySize the value to check
   * @param fieldName the name of the setting being validated
   * @throws MonetValidationException if the value is 0 or below -1
   */
  public static void checkReplySize(int replySize, String fieldName)
      throws MonetValidationException {
    if (replySize == 0 || replySize < -1) {
      String errorMessage =
          String.format(
              "Invalid value for %s: %d. Value must be -1 (unlimited) or a positive integer.",
              fieldName, replySize);
      LOGGER.error(errorMessage);
      throw new MonetValidationException(errorMessage);
    }
  }

  /**
   * Validates a value that is either {@code -1} (unlimited) or non-negative.
   *
   * @param value the value to check
   * @param fieldName the name of the setting being validated
   * @throws MonetValidationException if the value is below -1
   */
  public static void checkUnlimitedOrNonNegative(int value, String fieldName)
      throws MonetValidationException {
    if (value < -1) {
      String errorMessage =
          String.format(
              "Invalid value for %s: %d. Value must be -1 (unlimited) or >= 0.",
              fieldName, value);
      LOGGER.error(errorMessage);
      throw new MonetValidationException(errorMessage);
    }
  }

  public static <T extends Number> void checkIfPositive(T number, String fieldName)
      throws MonetValidationException {
    if (number.longValue() <= 0) {
      String errorMessage =
          String.format(
              "Invalid value for %s: %d. Value must be a positive integer (> 0).",
              fieldName, number.longValue());
      LOGGER.error(errorMessage);
      throw new MonetValidationException(errorMessage);
    }
  }

  /**
   * Parses a string to an integer.
   *
   * @param value the string value to parse
   * @param fieldName the name of the field being parsed
   * @return the parsed integer
   * @throws MonetValidationException if the value is not an integer
   */
  public static int parseInteger(String value, String fieldName) throws MonetValidationException {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      String errorMessage =
          String.format("Invalid value for %s: '%s'. Value must be an integer.", fieldName, value);
      LOGGER.error(errorMessage);
      throw new MonetValidationException(errorMessage);
    }
  }
}
