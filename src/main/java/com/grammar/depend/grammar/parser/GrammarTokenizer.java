package com.grammar.depend.grammar.parser;

import java.util.ArrayList;
import java.util.List;

import com.grammar.depend.grammar.exception.GrammarLoadException;
import com.grammar.depend.grammar.parser.GrammarToken.TokenType;

/**
 * Tokenizer for grammar source files, good enough to read the grammar header and
 * prequel. Braced blocks (options, tokens, actions) come back as one {@link TokenType#BLOCK}
 * token so their contents never confuse the header parser.
 */
public class GrammarTokenizer {

    private final String source;
    private final String fileName;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public GrammarTokenizer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Tokenize the entire source. Only meant for short sources such as the body of an
     * options block; grammar files are read token by token with {@link #next()}.
     */
    public List<GrammarToken> tokenize() {
        List<GrammarToken> tokens = new ArrayList<>();

        GrammarToken token;
        do {
            token = next();
            tokens.add(token);
        } while (token.getType() != TokenType.EOF);
        return tokens;
    }

    /**
     * Reads the next token, or {@link TokenType#EOF} once the source is exhausted.
     * Nothing beyond the returned token has been looked at.
     */
    public GrammarToken next() {
        skipWhitespaceAndComments();
        if (pos >= source.length()) {
            return new GrammarToken(TokenType.EOF, "", line, column);
        }
        return nextToken();
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekChar(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            } else if (c == '/' && peekChar(1) == '*') {
                skipBlockComment();
            } else {
                break;
            }
        }
    }

    private GrammarToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        switch (c) {
            case ';':
                advance();
                return new GrammarToken(TokenType.SEMI, ";", startLine, startCol);
            case ',':
                advance();
                return new GrammarToken(TokenType.COMMA, ",", startLine, startCol);
            case '=':
                advance();
                return new GrammarToken(TokenType.ASSIGN, "=", startLine, startCol);
            case '.':
                advance();
                return new GrammarToken(TokenType.DOT, ".", startLine, startCol);
            case '@':
                advance();
                return new GrammarToken(TokenType.AT, "@", startLine, startCol);
            case ':':
                advance();
                if (pos < source.length() && source.charAt(pos) == ':') {
                    advance();
                    return new GrammarToken(TokenType.COLONCOLON, "::", startLine, startCol);
                }
                return new GrammarToken(TokenType.COLON, ":", startLine, startCol);
            case '{':
                return readBlock(startLine, startCol);
            case '\'':
            case '"':
                return readStringLiteral(c, startLine, startCol);
            default:
                break;
        }

        if (Character.isDigit(c)) {
            return readNumber(startLine, startCol);
        }
        if (Character.isLetter(c) || c == '_') {
            return readIdentifier(startLine, startCol);
        }

        advance();
        return new GrammarToken(TokenType.OTHER, String.valueOf(c), startLine, startCol);
    }

    private GrammarToken readStringLiteral(char quote, int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        advance(); // opening quote

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                sb.append(source.charAt(pos + 1));
                advance();
                advance();
            } else if (c == quote) {
                advance();
                return new GrammarToken(TokenType.STRING_LITERAL, sb.toString(), startLine, startCol);
            } else if (c == '\n') {
                break;
            } else {
                sb.append(c);
                advance();
            }
        }
        throw GrammarLoadException.at(fileName, startLine, "unterminated string literal");
    }

    private GrammarToken readNumber(int startLine, int startCol) {
        int start = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            advance();
        }
        return new GrammarToken(TokenType.NUMERIC_LITERAL, source.substring(start, pos), startLine, startCol);
    }

    private GrammarToken readIdentifier(int startLine, int startCol) {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            advance();
        }
        return new GrammarToken(TokenType.IDENTIFIER, source.substring(start, pos), startLine, startCol);
    }

    /**
     * Reads up to the matching close brace. Strings and comments inside the block may
     * contain braces of their own.
     */
    private GrammarToken readBlock(int startLine, int startCol) {
        advance(); // {
        int contentStart = pos;
        int depth = 1;

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '{') {
                depth++;
                advance();
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    String content = source.substring(contentStart, pos);
                    advance();
                    return new GrammarToken(TokenType.BLOCK, content, startLine, startCol);
                }
                advance();
            } else if (c == '\'' || c == '"') {
                skipQuoted(c);
            } else if (c == '/' && peekChar(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            } else if (c == '/' && peekChar(1) == '*') {
                skipBlockComment();
            } else {
                advance();
            }
        }
        throw GrammarLoadException.at(fileName, startLine, "unterminated '{' block");
    }

    private void skipQuoted(char quote) {
        advance();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                advance();
                if (pos < source.length()) {
                    advance();
                }
            } else if (c == quote || c == '\n') {
                advance();
                return;
            } else {
                advance();
            }
        }
    }

    private void skipBlockComment() {
        int startLine = line;
        advance();
        advance();
        while (pos < source.length()) {
            if (source.charAt(pos) == '*' && peekChar(1) == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        throw GrammarLoadException.at(fileName, startLine, "unterminated comment");
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }
}
