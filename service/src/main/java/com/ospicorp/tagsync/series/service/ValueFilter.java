package com.ospicorp.tagsync.series.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.DoublePredicate;

/**
 * Boolean predicate over a single value, compiled from a small expression language:
 *
 * <pre>
 *   expression := andExpr ( "or" andExpr )*
 *   andExpr    := term ( "and" term )*
 *   term       := "(" expression ")" | operand ( op operand )+
 *   operand    := "val" | number
 *   op         := &lt; | &lt;= | &gt; | &gt;= | == | !=
 * </pre>
 *
 * <p>Keywords are case-insensitive. A chained comparison such as {@code 0 <= val < 100} holds
 * when every adjacent pair holds. Anything else is rejected with a {@link FilterSyntaxException}.
 */
public final class ValueFilter implements DoublePredicate {

  private final String expression;
  private final DoublePredicate predicate;

  private ValueFilter(String expression, DoublePredicate predicate) {
    this.expression = expression;
    this.predicate = predicate;
  }

  public static ValueFilter compile(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new FilterSyntaxException("Filter expression is empty", 0);
    }
    Parser parser = new Parser(expression, tokenize(expression));
    DoublePredicate predicate = parser.parse();
    return new ValueFilter(expression, predicate);
  }

  @Override
  public boolean test(double value) {
    return predicate.test(value);
  }

  @Override
  public String toString() {
    return expression;
  }

  private enum TokenType { LPAREN, RPAREN, OPERATOR, VAL, NUMBER, AND, OR, END }

  private record Token(TokenType type, String text, int position) {}

  private interface Operand {
    double resolve(double val);
  }

  private static List<Token> tokenize(String text) {
    List<Token> tokens = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (c == '(') {
        tokens.add(new Token(TokenType.LPAREN, "(", i++));
      } else if (c == ')') {
        tokens.add(new Token(TokenType.RPAREN, ")", i++));
      } else if (c == '<' || c == '>' || c == '=' || c == '!') {
        int start = i;
        boolean twoChar = i + 1 < text.length() && text.charAt(i + 1) == '=';
        String op = twoChar ? text.substring(i, i + 2) : String.valueOf(c);
        if (op.equals("=") || op.equals("!")) {
          throw new FilterSyntaxException("Unknown operator '" + op + "'", start);
        }
        tokens.add(new Token(TokenType.OPERATOR, op, start));
        i += op.length();
      } else if (startsNumber(text, i, tokens)) {
        int start = i;
        i = scanNumber(text, i);
        tokens.add(new Token(TokenType.NUMBER, text.substring(start, i), start));
      } else if (Character.isLetter(c) || c == '_') {
        int start = i;
        while (i < text.length()
            && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
          i++;
        }
        String word = text.substring(start, i).toLowerCase(Locale.ROOT);
        TokenType type = switch (word) {
          case "val" -> TokenType.VAL;
          case "and" -> TokenType.AND;
          case "or" -> TokenType.OR;
          default -> throw new FilterSyntaxException("Unknown word '" + word + "'", start);
        };
        tokens.add(new Token(type, word, start));
      } else {
        throw new FilterSyntaxException("Unexpected character '" + c + "'", i);
      }
    }
    tokens.add(new Token(TokenType.END, "", text.length()));
    return tokens;
  }

  // A sign only starts a number where an operand is expected.
  private static boolean startsNumber(String text, int i, List<Token> tokens) {
    char c = text.charAt(i);
    if (Character.isDigit(c)) {
      return true;
    }
    boolean nextIsDigit = i + 1 < text.length()
        && (Character.isDigit(text.charAt(i + 1)) || text.charAt(i + 1) == '.');
    if (c == '.') {
      return i + 1 < text.length() && Character.isDigit(text.charAt(i + 1));
    }
    if (c == '-' || c == '+') {
      TokenType previous = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1).type();
      boolean operandExpected = previous == null || previous == TokenType.OPERATOR
          || previous == TokenType.LPAREN || previous == TokenType.AND
          || previous == TokenType.OR;
      return operandExpected && nextIsDigit;
    }
    return false;
  }

  private static int scanNumber(String text, int i) {
    if (text.charAt(i) == '-' || text.charAt(i) == '+') {
      i++;
    }
    while (i < text.length() && Character.isDigit(text.charAt(i))) {
      i++;
    }
    if (i < text.length() && text.charAt(i) == '.') {
      i++;
      while (i < text.length() && Character.isDigit(text.charAt(i))) {
        i++;
      }
    }
    if (i < text.length() && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
      int exponent = i + 1;
      if (exponent < text.length()
          && (text.charAt(exponent) == '-' || text.charAt(exponent) == '+')) {
        exponent++;
      }
      if (exponent < text.length() && Character.isDigit(text.charAt(exponent))) {
        i = exponent;
        while (i < text.length() && Character.isDigit(text.charAt(i))) {
          i++;
        }
      }
    }
    return i;
  }

  private static final class Parser {
    private final String source;
    private final List<Token> tokens;
    private int position;

    Parser(String source, List<Token> tokens) {
      this.source = source;
      this.tokens = tokens;
    }

    DoublePredicate parse() {
      DoublePredicate result = orExpression();
      Token trailing = peek();
      if (trailing.type() != TokenType.END) {
        throw new FilterSyntaxException(
            "Unexpected '" + trailing.text() + "' in filter '" + source + "'",
            trailing.position());
      }
      return result;
    }

    private DoublePredicate orExpression() {
      DoublePredicate left = andExpression();
      while (peek().type() == TokenType.OR) {
        position++;
        DoublePredicate right = andExpression();
        left = left.or(right);
      }
      return left;
    }

    private DoublePredicate andExpression() {
      DoublePredicate left = term();
      while (peek().type() == TokenType.AND) {
        position++;
        DoublePredicate right = term();
        left = left.and(right);
      }
      return left;
    }

    private DoublePredicate term() {
      if (peek().type() == TokenType.LPAREN) {
        Token open = next();
        DoublePredicate inner = orExpression();
        if (peek().type() != TokenType.RPAREN) {
          throw new FilterSyntaxException("Unbalanced '(' in filter '" + source + "'",
              open.position());
        }
        position++;
        return inner;
      }
      return comparison();
    }

    private DoublePredicate comparison() {
      Operand left = operand();
      if (peek().type() != TokenType.OPERATOR) {
        throw new FilterSyntaxException("Expected a comparison operator in filter '"
            + source + "'", peek().position());
      }
      DoublePredicate chain = null;
      while (peek().type() == TokenType.OPERATOR) {
        String op = next().text();
        Operand right = operand();
        DoublePredicate link = compare(left, op, right);
        chain = chain == null ? link : chain.and(link);
        left = right;
      }
      return chain;
    }

    private Operand operand() {
      Token token = next();
      if (token.type() == TokenType.VAL) {
        return val -> val;
      }
      if (token.type() == TokenType.NUMBER) {
        double constant;
        try {
          constant = Double.parseDouble(token.text());
        } catch (NumberFormatException ex) {
          throw new FilterSyntaxException("Invalid number '" + token.text() + "'",
              token.position());
        }
        return val -> constant;
      }
      String found = token.type() == TokenType.END ? "end of filter" : "'" + token.text() + "'";
      throw new FilterSyntaxException("Expected 'val' or a number but found " + found,
          token.position());
    }

    private static DoublePredicate compare(Operand left, String op, Operand right) {
      return switch (op) {
        case "<" -> v -> left.resolve(v) < right.resolve(v);
        case "<=" -> v -> left.resolve(v) <= right.resolve(v);
        case ">" -> v -> left.resolve(v) > right.resolve(v);
        case ">=" -> v -> left.resolve(v) >= right.resolve(v);
        case "==" -> v -> left.resolve(v) == right.resolve(v);
        case "!=" -> v -> left.resolve(v) != right.resolve(v);
        default -> throw new IllegalStateException("Unhandled operator " + op);
      };
    }

    private Token peek() {
      return tokens.get(position);
    }

    private Token next() {
      Token token = tokens.get(position);
      if (token.type() != TokenType.END) {
        position++;
      }
      return token;
    }
  }
}
