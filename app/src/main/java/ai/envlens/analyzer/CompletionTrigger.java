package ai.envlens.analyzer;

import java.util.regex.Pattern;

/**
 * A line-prefix pattern after which variable-name completion applies. The pattern is matched against the text of
 * the current line up to the cursor and must be anchored at the end.
 */
public record CompletionTrigger(Pattern pattern, String baseToken) {

    public static CompletionTrigger of(String regex, String baseToken) {
        return new CompletionTrigger(Pattern.compile(regex), baseToken);
    }

    public boolean matches(String linePrefix) {
        return pattern.matcher(linePrefix).find();
    }
}
