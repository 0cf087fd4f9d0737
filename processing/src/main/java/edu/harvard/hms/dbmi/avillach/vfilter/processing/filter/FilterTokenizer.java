package edu.harvard.hms.dbmi.avillach.vfilter.processing.filter;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.ComparisonOperator;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.SampleScope;
import edu.harvard.hms.dbmi.avillach.vfilter.data.query.ScopeType;
import edu.harvard.hms.dbmi.avillach.vfilter.exception.FilterParseException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces every recognized sub-expression of a filter string with a symbol placeholder, leaving only symbols, boolean connectives
 * and parentheses behind. Categories are handled in a fixed order (scoped, comparator, set membership, gene) and each works on
 * the output of the previous one, so text consumed by an earlier category is never looked at again.
 */
public class FilterTokenizer {

    // the closing half of "(EXPR) in SCOPE(samples)"; the opening parenthesis is found by walking back
    private static final Pattern SCOPE_TAIL = Pattern.compile("\\)\\s*in\\s+(\\w+)\\s*\\(([^()]*)\\)", Pattern.CASE_INSENSITIVE);

    private static final Pattern COMPARATOR =
        Pattern.compile("\\b([A-Za-z_]\\w*)\\s*(==|!=|>=|<=|>|<)\\s*(\"[^\"]*\"|'[^']*'|[^\\s(){}]+)");

    private static final Pattern SET_MEMBERSHIP = Pattern.compile("\\b(NOT_IN_SET|IN_SET)\\s*\\(([^()]*)\\)", Pattern.CASE_INSENSITIVE);

    private static final Pattern GENE = Pattern.compile("\\bGENE\\s*\\(([^()]*)\\)", Pattern.CASE_INSENSITIVE);

    private static final Pattern QUOTED = Pattern.compile("\"[^\"]*\"|'[^']*'");

    private static final Splitter SAMPLE_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    /**
     * @return the symbolized filter string, with {@code symbols} holding what each symbol stands for
     */
    public String symbolize(String filterString, SymbolTable symbols) {
        // braces would be indistinguishable from symbol placeholders
        if (CharMatcher.anyOf("{}").matchesAnyOf(QUOTED.matcher(filterString).replaceAll(""))) {
            throw new FilterParseException(filterString, "Braces are only allowed inside quoted values");
        }
        String symbolized = symbolizeScopes(filterString, symbols);
        symbolized = symbolizeMatches(symbolized, COMPARATOR, this::toComparator, symbols);
        symbolized = symbolizeMatches(symbolized, SET_MEMBERSHIP, this::toSetMembership, symbols);
        return symbolizeMatches(symbolized, GENE, this::toGene, symbols);
    }

    private String symbolizeScopes(String text, SymbolTable symbols) {
        List<SubExpressionSpan> spans = new ArrayList<>();
        // parentheses inside quoted values do not count, so the scope structure is read from a masked copy of the same length
        String masked = maskQuoted(text);
        Matcher matcher = SCOPE_TAIL.matcher(masked);
        while (matcher.find()) {
            int open = findOpeningParenthesis(masked, text, matcher.start());
            String scopeText = text.substring(open, matcher.end());
            String innerExpression = text.substring(open + 1, matcher.start());
            if (innerExpression.isBlank()) {
                throw new FilterParseException(scopeText, "Scoped expression has no condition");
            }
            String sampleList = text.substring(matcher.start(2), matcher.end(2));
            SampleScope scope = new SampleScope(parseScopeType(matcher.group(1), scopeText), parseSampleIds(sampleList, scopeText));
            spans.add(new SubExpressionSpan(open, matcher.end(), new SubExpression.Scoped(scopeText, innerExpression.trim(), scope)));
        }
        spans.sort((a, b) -> Integer.compare(a.start(), b.start()));

        StringBuilder symbolized = new StringBuilder();
        int cursor = 0;
        for (SubExpressionSpan span : spans) {
            // nested scopes stay inside the text of the scope that contains them
            if (span.start() < cursor) {
                continue;
            }
            symbolized.append(text, cursor, span.start());
            symbolized.append(SymbolTable.placeholder(symbols.allocate(span.expression())));
            cursor = span.end();
        }
        symbolized.append(text.substring(cursor));
        return symbolized.toString();
    }

    private static String maskQuoted(String text) {
        StringBuilder masked = new StringBuilder(text);
        Matcher matcher = QUOTED.matcher(text);
        while (matcher.find()) {
            for (int i = matcher.start(); i < matcher.end(); i++) {
                masked.setCharAt(i, '_');
            }
        }
        return masked.toString();
    }

    private int findOpeningParenthesis(String masked, String text, int closingIndex) {
        int depth = 0;
        for (int i = closingIndex; i >= 0; i--) {
            char c = masked.charAt(i);
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new FilterParseException(text.substring(0, closingIndex + 1), "Unbalanced parentheses before scope");
    }

    private ScopeType parseScopeType(String keyword, String scopeText) {
        try {
            return ScopeType.valueOf(keyword.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new FilterParseException(scopeText, "Unknown scope " + keyword + ", expected ALL, ANY or ONLY", e);
        }
    }

    private Set<String> parseSampleIds(String sampleList, String scopeText) {
        Set<String> sampleIds = new LinkedHashSet<>(SAMPLE_SPLITTER.splitToList(sampleList));
        if (sampleIds.isEmpty()) {
            throw new FilterParseException(scopeText, "Scope lists no samples");
        }
        return sampleIds;
    }

    private String symbolizeMatches(String text, Pattern pattern, Function<MatchResult, SubExpression> parser, SymbolTable symbols) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder symbolized = new StringBuilder();
        while (matcher.find()) {
            String symbol = symbols.allocate(parser.apply(matcher.toMatchResult()));
            matcher.appendReplacement(symbolized, Matcher.quoteReplacement(SymbolTable.placeholder(symbol)));
        }
        matcher.appendTail(symbolized);
        return symbolized.toString();
    }

    private SubExpression toComparator(MatchResult match) {
        ComparisonOperator operator = ComparisonOperator.fromSymbol(match.group(2))
            .orElseThrow(() -> new FilterParseException(match.group(), "Unknown operator " + match.group(2)));
        return new SubExpression.Comparator(match.group(), match.group(1), operator, unquote(match.group(3)));
    }

    private SubExpression toSetMembership(MatchResult match) {
        String variantSetUid = match.group(2).trim();
        if (variantSetUid.isEmpty()) {
            throw new FilterParseException(match.group(), "Set membership requires a variant set uid");
        }
        boolean member = !match.group(1).toUpperCase(Locale.ROOT).startsWith("NOT");
        return new SubExpression.SetMembership(match.group(), variantSetUid, member);
    }

    private SubExpression toGene(MatchResult match) {
        String geneLabel = match.group(1).trim();
        if (geneLabel.isEmpty()) {
            throw new FilterParseException(match.group(), "Gene restriction requires a gene label");
        }
        return new SubExpression.Gene(match.group(), geneLabel);
    }

    private static String unquote(String literal) {
        if (literal.length() >= 2) {
            char first = literal.charAt(0);
            if ((first == '"' || first == '\'') && literal.charAt(literal.length() - 1) == first) {
                return literal.substring(1, literal.length() - 1);
            }
        }
        return literal;
    }

    private record SubExpressionSpan(int start, int end, SubExpression expression) {
    }
}
