package ca.gc.cra.xpii.application.governance;

import ca.gc.cra.xpii.domain.governance.AgentIdentity;
import java.util.List;
import java.util.Map;

/**
 * Policies every {@link PolicyEngine} starts with.
 *
 * <p>Context keys: {@value #IDENTITY}, {@value #AUTHOR}, {@value #INPUT_PATH}, {@value #OUTPUT_PATH}.
 *
 * @since 0.1.0
 */
public final class BuiltinPolicies {
  public static final String IDENTITY = "identity";
  public static final String AUTHOR = "author";
  public static final String INPUT_PATH = "input_path";
  public static final String OUTPUT_PATH = "output_path";

  public static final String IDENTITY_MUST_BE_VALID = "identity_must_be_valid";
  public static final String NO_EMPTY_AUTHOR = "no_empty_author";
  public static final String NO_PATH_TRAVERSAL = "no_path_traversal";

  private static final List<String> GUARDED_PATHS = List.of(INPUT_PATH, OUTPUT_PATH);

  private BuiltinPolicies() {}

  /**
   * Identity must be present and pass {@link AgentIdentity#verify()}.
   *
   * @param context action context
   * @return verdict
   */
  public static PolicyVerdict identityMustBeValid(Map<String, Object> context) {
    Object value = context.get(IDENTITY);
    if (!(value instanceof AgentIdentity identity)) {
      return PolicyVerdict.deny("No agent identity present in context.");
    }
    if (!identity.verify()) {
      return PolicyVerdict.deny("Agent identity '" + identity.identityId() + "' is invalid or revoked.");
    }
    return PolicyVerdict.allow("Identity verified.");
  }

  /**
   * Author must be non-empty after trimming.
   *
   * @param context action context
   * @return verdict
   */
  public static PolicyVerdict noEmptyAuthor(Map<String, Object> context) {
    Object author = context.get(AUTHOR);
    if (author == null || author.toString().trim().isEmpty()) {
      return PolicyVerdict.deny("Author field must not be empty.");
    }
    return PolicyVerdict.allow("Author field present.");
  }

  /**
   * Neither input nor output path may contain {@code ..}.
   *
   * @param context action context
   * @return verdict
   */
  public static PolicyVerdict noPathTraversal(Map<String, Object> context) {
    for (String key : GUARDED_PATHS) {
      Object path = context.get(key);
      if (path != null && path.toString().contains("..")) {
        return PolicyVerdict.deny("Path traversal detected in '" + key + "': '" + path + "'.");
      }
    }
    return PolicyVerdict.allow("No path traversal detected.");
  }
}
