package cache.forge.core.backend;

import cache.forge.error.exception.InvalidCacheArgumentException;
import java.util.regex.Pattern;

/**
 * Redis {@code SCAN MATCH} 스타일 글롭 패턴
 *
 * <ul>
 *   <li>{@code *}: 0개 이상의 임의 문자
 *   <li>{@code ?}: 정확히 1개의 문자
 *   <li>{@code [abc]}, {@code [a-z]}: 문자 클래스, {@code [!a]} 또는 {@code [^a]}는 부정
 *   <li>{@code \x}: 다음 문자를 리터럴로 취급
 * </ul>
 *
 * <p>로컬 엔진이 Redis와 같은 매칭 결과를 내도록 정규식으로 변환해 사용합니다.
 */
public final class GlobPattern {

  private final String glob;
  private final Pattern regex;

  private GlobPattern(String glob, Pattern regex) {
    this.glob = glob;
    this.regex = regex;
  }

  public static GlobPattern compile(String glob) {
    if (glob == null) {
      throw new InvalidCacheArgumentException("pattern must not be null");
    }
    return new GlobPattern(glob, Pattern.compile(toRegex(glob), Pattern.DOTALL));
  }

  public boolean matches(String key) {
    return regex.matcher(key).matches();
  }

  public String glob() {
    return glob;
  }

  static String toRegex(String glob) {
    StringBuilder regex = new StringBuilder(glob.length() + 8);
    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i);
      switch (c) {
        case '*' -> regex.append(".*");
        case '?' -> regex.append('.');
        case '\\' -> {
          if (i + 1 < glob.length()) {
            i++;
            regex.append(Pattern.quote(String.valueOf(glob.charAt(i))));
          } else {
            regex.append(Pattern.quote("\\"));
          }
        }
        case '[' -> {
          int close = findClassEnd(glob, i);
          if (close < 0) {
            // 닫히지 않은 '['는 리터럴
            regex.append(Pattern.quote("["));
          } else {
            appendCharClass(regex, glob.substring(i + 1, close));
            i = close;
          }
        }
        default -> regex.append(Pattern.quote(String.valueOf(c)));
      }
      i++;
    }
    return regex.toString();
  }

  private static int findClassEnd(String glob, int open) {
    int i = open + 1;
    if (i < glob.length() && (glob.charAt(i) == '!' || glob.charAt(i) == '^')) {
      i++;
    }
    // 첫 ']'는 클래스 멤버
    if (i < glob.length() && glob.charAt(i) == ']') {
      i++;
    }
    while (i < glob.length()) {
      char c = glob.charAt(i);
      if (c == '\\') {
        i += 2;
        continue;
      }
      if (c == ']') {
        return i;
      }
      i++;
    }
    return -1;
  }

  private static void appendCharClass(StringBuilder regex, String body) {
    regex.append('[');
    int i = 0;
    if (!body.isEmpty() && (body.charAt(0) == '!' || body.charAt(0) == '^')) {
      regex.append('^');
      i = 1;
    }
    for (; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c == '\\' && i + 1 < body.length()) {
        i++;
        appendClassLiteral(regex, body.charAt(i));
      } else if (c == '-' && i > 0 && i < body.length() - 1) {
        regex.append('-');
      } else {
        appendClassLiteral(regex, c);
      }
    }
    regex.append(']');
  }

  private static void appendClassLiteral(StringBuilder regex, char c) {
    if (Character.isLetterOrDigit(c)) {
      regex.append(c);
    } else {
      regex.append('\\').append(c);
    }
  }

  @Override
  public String toString() {
    return glob;
  }
}
