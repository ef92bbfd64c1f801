package ai.envlens.analyzer;

/**
 * Content of a plain (non-interpolated) string literal.
 *
 * @param content the characters between the quotes
 * @param offset index of the first content character within the literal's source text
 */
public record StringLiteral(String content, int offset) {}
