package eventbus.jdbc;

import java.util.regex.Pattern;

/**
 * Processing log table names end up concatenated into SQL, so only unqualified identifiers
 * short enough for every supported database are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "event_processing_log";

  // PostgreSQL truncates identifiers beyond 63 bytes, MySQL rejects them beyond 64.
  static final int MAX_LENGTH = 63;
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

  private TableNames() {}

  /**
   * @return {@code tableName}, unchanged
   * @throws IllegalArgumentException if the name is not a plain identifier of at most
   *                                  {@value #MAX_LENGTH} characters
   */
  public static String validate(String tableName) {
    if (tableName == null) {
      throw new NullPointerException("tableName");
    }
    if (tableName.length() > MAX_LENGTH || !IDENTIFIER.matcher(tableName).matches()) {
      throw new IllegalArgumentException(
          "Table name must be an unqualified SQL identifier of at most " + MAX_LENGTH
              + " characters: '" + tableName + "'");
    }
    return tableName;
  }
}
