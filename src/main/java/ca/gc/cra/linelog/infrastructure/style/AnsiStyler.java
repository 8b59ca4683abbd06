package ca.gc.cra.linelog.infrastructure.style;

import ca.gc.cra.linelog.application.port.StyleRole;
import ca.gc.cra.linelog.application.port.Styler;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> {@link Styler} that wraps text in ANSI SGR escape sequences.
 * <p><strong>Why:</strong> Keeps timestamps dim and level labels colour-coded so terminal output is easy to scan.</p>
 * <p><strong>Role:</strong> Terminal adapter behind the {@link Styler} port.</p>
 * <p><strong>Palette:</strong> timestamp dim; prefix dim bold; keys magenta; DEBUG blue, INFO cyan, WARN yellow and
 * ERROR red, all bold.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @implNote {@link #auto()} honours {@code NO_COLOR} first, then {@code FORCE_COLOR}, then whether a console is
 * attached to the JVM.
 * @since 0.1.0
 */
public final class AnsiStyler implements Styler {
  private static final String ESC = "\u001B[";
  private static final String RESET = ESC + "0m";

  private static final Map<StyleRole, String> CODES = new EnumMap<>(StyleRole.class);

  static {
    CODES.put(StyleRole.TIMESTAMP, "2");
    CODES.put(StyleRole.PREFIX, "2;1");
    CODES.put(StyleRole.KEY, "35");
    CODES.put(StyleRole.DEBUG, "34;1");
    CODES.put(StyleRole.INFO, "36;1");
    CODES.put(StyleRole.WARN, "33;1");
    CODES.put(StyleRole.ERROR, "31;1");
  }

  private static final AnsiStyler ENABLED = new AnsiStyler(true);
  private static final AnsiStyler DISABLED = new AnsiStyler(false);

  private final boolean enabled;

  private AnsiStyler(boolean enabled) {
    this.enabled = enabled;
  }

  /**
   * Returns a styler that always emits escape sequences.
   */
  public static AnsiStyler forced() {
    return ENABLED;
  }

  /**
   * Returns a styler that never emits escape sequences.
   */
  public static AnsiStyler disabled() {
    return DISABLED;
  }

  /**
   * Returns a styler enabled according to the process environment.
   *
   * @return enabled styler when the terminal supports colour, disabled otherwise
   */
  public static AnsiStyler auto() {
    return detect(System::getenv, System.console() != null) ? ENABLED : DISABLED;
  }

  static boolean detect(Function<String, String> env, boolean console) {
    String noColor = env.apply("NO_COLOR");
    if (noColor != null && !noColor.isEmpty()) {
      return false;
    }
    String force = env.apply("FORCE_COLOR");
    if (force != null && !force.isEmpty() && !"0".equals(force) && !"false".equalsIgnoreCase(force)) {
      return true;
    }
    return console;
  }

  /**
   * Indicates whether escape sequences are emitted.
   */
  public boolean enabled() {
    return enabled;
  }

  @Override
  public String apply(StyleRole role, String text) {
    Objects.requireNonNull(role, "role");
    if (!enabled || text.isEmpty()) {
      return text;
    }
    return ESC + CODES.get(role) + 'm' + text + RESET;
  }
}
