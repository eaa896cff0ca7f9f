package com.grammar.depend.grammar.parser;

import java.util.ArrayList;
import java.util.List;

import com.grammar.depend.grammar.exception.GrammarLoadException;
import com.grammar.depend.grammar.model.GrammarType;
import com.grammar.depend.grammar.parser.GrammarToken.TokenType;

/**
 * Parser for the header of a grammar file.
 *
 * Reads {@code (lexer|parser)? grammar Name;} and the prequel that may follow it in
 * any order:
 * - {@code options { key = value; ... }}
 * - {@code import A, B = C;} (the name right of {@code =} is the grammar to load)
 * - {@code tokens { ... }} and {@code channels { ... }}
 * - named actions such as {@code @header { ... }} or {@code @parser::members { ... }}
 *
 * Stops at the first rule. Rules themselves are never looked at.
 */
public class GrammarHeaderParser {

    private final GrammarTokenizer tokenizer;
    private final String fileName;
    private final List<GrammarToken> lookahead = new ArrayList<>();

    public GrammarHeaderParser(GrammarTokenizer tokenizer, String fileName) {
        this.tokenizer = tokenizer;
        this.fileName = fileName;
    }

    public static GrammarHeader parse(String source, String fileName) {
        return new GrammarHeaderParser(new GrammarTokenizer(source, fileName), fileName).parse();
    }

    public GrammarHeader parse() {
        GrammarHeader.GrammarHeaderBuilder header = GrammarHeader.builder();

        GrammarType type = GrammarType.COMBINED;
        if (peek().isIdentifier("lexer")) {
            type = GrammarType.LEXER;
            advance();
        } else if (peek().isIdentifier("parser")) {
            type = GrammarType.PARSER;
            advance();
        }
        header.type(type);

        if (!peek().isIdentifier("grammar")) {
            throw error(peek(), "expected 'grammar' declaration but found '" + peek().getValue() + "'");
        }
        advance();
        header.name(expect(TokenType.IDENTIFIER, "grammar name").getValue());
        expect(TokenType.SEMI, "';' after grammar name");

        while (true) {
            GrammarToken token = peek();
            if (token.isIdentifier("options") && peekNext().getType() == TokenType.BLOCK) {
                advance();
                parseOptions(advance(), header);
            } else if (token.isIdentifier("import")) {
                advance();
                parseImports(header);
            } else if ((token.isIdentifier("tokens") || token.isIdentifier("channels"))
                    && peekNext().getType() == TokenType.BLOCK) {
                advance();
                advance();
            } else if (token.getType() == TokenType.AT) {
                skipNamedAction();
            } else {
                break;
            }
        }

        return header.build();
    }

    private void parseOptions(GrammarToken block, GrammarHeader.GrammarHeaderBuilder header) {
        List<GrammarToken> optionTokens = new GrammarTokenizer(block.getValue(), fileName).tokenize();
        int i = 0;
        while (optionTokens.get(i).getType() != TokenType.EOF) {
            GrammarToken key = optionTokens.get(i);
            if (key.getType() != TokenType.IDENTIFIER) {
                throw error(block, key, "expected option name but found '" + key.getValue() + "'");
            }
            if (optionTokens.get(i + 1).getType() != TokenType.ASSIGN) {
                throw error(block, key, "expected '=' after option " + key.getValue());
            }
            i += 2;

            StringBuilder value = new StringBuilder();
            while (optionTokens.get(i).getType() != TokenType.SEMI) {
                GrammarToken part = optionTokens.get(i);
                if (part.getType() == TokenType.EOF) {
                    throw error(block, key, "expected ';' after value of option " + key.getValue());
                }
                value.append(part.getValue());
                i++;
            }
            i++; // ;

            if (value.length() == 0) {
                throw error(block, key, "option " + key.getValue() + " has no value");
            }
            header.option(key.getValue(), value.toString());
        }
    }

    private void parseImports(GrammarHeader.GrammarHeaderBuilder header) {
        while (true) {
            GrammarToken name = expect(TokenType.IDENTIFIER, "imported grammar name");
            if (peek().getType() == TokenType.ASSIGN) {
                advance();
                name = expect(TokenType.IDENTIFIER, "imported grammar name after '='");
            }
            header.importName(name.getValue());

            if (peek().getType() == TokenType.COMMA) {
                advance();
            } else {
                expect(TokenType.SEMI, "';' after import list");
                return;
            }
        }
    }

    private void skipNamedAction() {
        GrammarToken at = advance();
        while (peek().getType() != TokenType.BLOCK) {
            if (peek().getType() == TokenType.EOF) {
                throw error(at, "named action without a body");
            }
            advance();
        }
        advance();
    }

    private GrammarToken expect(TokenType type, String what) {
        GrammarToken token = peek();
        if (token.getType() != type) {
            throw error(token, "expected " + what + " but found '" + token.getValue() + "'");
        }
        return advance();
    }

    private GrammarToken peek() {
        return lookAhead(0);
    }

    private GrammarToken peekNext() {
        return lookAhead(1);
    }

    // tokens are pulled on demand so rule bodies are never lexed
    private GrammarToken lookAhead(int offset) {
        while (lookahead.size() <= offset) {
            if (!lookahead.isEmpty() && lookahead.get(lookahead.size() - 1).getType() == TokenType.EOF) {
                return lookahead.get(lookahead.size() - 1);
            }
            lookahead.add(tokenizer.next());
        }
        return lookahead.get(offset);
    }

    private GrammarToken advance() {
        GrammarToken token = peek();
        if (token.getType() != TokenType.EOF) {
            lookahead.remove(0);
        }
        return token;
    }

    private GrammarLoadException error(GrammarToken token, String message) {
        return GrammarLoadException.at(fileName, token.getLine(), message);
    }

    private GrammarLoadException error(GrammarToken block, GrammarToken inner, String message) {
        return GrammarLoadException.at(fileName, block.getLine() + inner.getLine() - 1, message);
    }
}
