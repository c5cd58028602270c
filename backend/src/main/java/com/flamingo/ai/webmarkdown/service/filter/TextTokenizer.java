package com.flamingo.ai.webmarkdown.service.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lower-cases text and splits it on anything that is not a letter or digit. Tokens shorter than
 * {@link #MIN_TOKEN_LENGTH} characters are dropped. No stemming and no stop-word removal.
 */
public final class TextTokenizer {

  public static final int MIN_TOKEN_LENGTH = 2;

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{Nd}]+");

  private TextTokenizer() {}

  public static List<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<String> tokens = new ArrayList<>();
    for (String token : NON_ALPHANUMERIC.split(text.toLowerCase(Locale.ROOT))) {
      if (token.length() >= MIN_TOKEN_LENGTH) {
        tokens.add(token);
      }
    }
    return tokens;
  }
}
