package nl.bytesoflife.lanterncad.config;

import java.util.function.Function;

/**
 * Evaluates the arithmetic used in configuration values, such as
 * {@code Diameter_SM_Clad / (2 * sin(180 / Num_Cores_Ring))}.
 * <p>
 * Supports {@code + - * / ^}, parentheses, unary minus, the constant {@code pi} and the
 * functions {@code sin}, {@code cos}, {@code tan} (arguments in degrees), {@code sqrt},
 * {@code abs}, {@code exp} and {@code log}. Other identifiers are looked up through the
 * supplied variable resolver.
 */
public class ExpressionEvaluator {

    private String input;
    private int pos;
    private Function<String, Double> variables;

    public double evaluate(String expression, Function<String, Double> variables) {
        this.input = expression;
        this.pos = 0;
        this.variables = variables;

        double value = parseSum();
        skipWhitespace();
        if (pos < input.length()) {
            throw new ParseException("Unexpected '" + input.charAt(pos) + "' in '" + input + "'", pos);
        }
        if (!Double.isFinite(value)) {
            throw new ConfigException("Expression '" + input + "' evaluates to " + value);
        }
        return value;
    }

    private double parseSum() {
        double value = parseProduct();
        while (true) {
            skipWhitespace();
            if (accept('+')) {
                value += parseProduct();
            } else if (accept('-')) {
                value -= parseProduct();
            } else {
                return value;
            }
        }
    }

    private double parseProduct() {
        double value = parseUnary();
        while (true) {
            skipWhitespace();
            if (accept('*')) {
                value *= parseUnary();
            } else if (accept('/')) {
                value /= parseUnary();
            } else {
                return value;
            }
        }
    }

    private double parseUnary() {
        skipWhitespace();
        if (accept('-')) return -parseUnary();
        if (accept('+')) return parseUnary();
        return parsePower();
    }

    private double parsePower() {
        double base = parsePrimary();
        skipWhitespace();
        if (accept('^')) {
            return Math.pow(base, parseUnary());
        }
        return base;
    }

    private double parsePrimary() {
        skipWhitespace();
        if (pos >= input.length()) {
            throw new ParseException("Unexpected end of expression '" + input + "'", pos);
        }
        char c = input.charAt(pos);
        if (c == '(') {
            pos++;
            double value = parseSum();
            expect(')');
            return value;
        }
        if (Character.isDigit(c) || c == '.') {
            return parseNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            String name = parseIdentifier();
            skipWhitespace();
            if (accept('(')) {
                double argument = parseSum();
                expect(')');
                return applyFunction(name, argument);
            }
            if (name.equals("pi")) return Math.PI;
            Double value = variables.apply(name);
            if (value == null) {
                throw new ConfigException("Unknown parameter '" + name + "' in '" + input + "'");
            }
            return value;
        }
        throw new ParseException("Unexpected '" + c + "' in '" + input + "'", pos);
    }

    private double applyFunction(String name, double x) {
        return switch (name) {
            case "sin" -> Math.sin(Math.toRadians(x));
            case "cos" -> Math.cos(Math.toRadians(x));
            case "tan" -> Math.tan(Math.toRadians(x));
            case "sqrt" -> Math.sqrt(x);
            case "abs" -> Math.abs(x);
            case "exp" -> Math.exp(x);
            case "log" -> Math.log(x);
            default -> throw new ConfigException("Unknown function '" + name + "' in '" + input + "'");
        };
    }

    private double parseNumber() {
        int start = pos;
        while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) pos++;
            if (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) pos++;
            } else {
                pos = mark;
            }
        }
        String text = input.substring(start, pos);
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid number '" + text + "' in '" + input + "'", start);
        }
    }

    private String parseIdentifier() {
        int start = pos;
        while (pos < input.length() && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private boolean accept(char c) {
        if (pos < input.length() && input.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char c) {
        skipWhitespace();
        if (!accept(c)) {
            throw new ParseException("Expected '" + c + "' in '" + input + "'", pos);
        }
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    public static class ParseException extends ConfigException {
        private final int position;

        public ParseException(String message, int position) {
            super(message + " at position " + position);
            this.position = position;
        }

        public int getPosition() {
            return position;
        }
    }
}
