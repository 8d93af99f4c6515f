package com.geico.poc.cargoquery.validation;

import com.geico.poc.cargoquery.compiler.QuerySpec;
import com.geico.poc.cargoquery.compiler.SecurityViolationException;
import com.geico.poc.cargoquery.compiler.token.SqlTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rejects query parameters that could break out of the generated SELECT.
 *
 * Quoted literals are removed before the keyword/symbol scan so that string comparisons
 * such as {@code Title = 'From Here'} are not rejected. The where parameter is additionally
 * HTML-decoded and checked for comment markers with its literals left in, since page-name
 * macros HTML-encode their output.
 */
public class QueryTokenGuard {

    private static final Logger log = LoggerFactory.getLogger(QueryTokenGuard.class);

    private static final Map<Pattern, String> WHERE_ONLY = new LinkedHashMap<>();
    private static final Map<Pattern, String> FORBIDDEN = new LinkedHashMap<>();

    static {
        WHERE_ONLY.put(Pattern.compile("--"), "--");
        WHERE_ONLY.put(Pattern.compile("#"), "#");

        FORBIDDEN.put(Pattern.compile("\\bselect\\b", Pattern.CASE_INSENSITIVE), "SELECT");
        FORBIDDEN.put(Pattern.compile("\\binto\\b", Pattern.CASE_INSENSITIVE), "INTO");
        FORBIDDEN.put(Pattern.compile("\\bfrom\\b", Pattern.CASE_INSENSITIVE), "FROM");
        FORBIDDEN.put(Pattern.compile("\\bunion\\b", Pattern.CASE_INSENSITIVE), "UNION");
        FORBIDDEN.put(Pattern.compile(";"), ";");
        FORBIDDEN.put(Pattern.compile("@"), "@");
        FORBIDDEN.put(Pattern.compile("<\\?"), "<?");
        FORBIDDEN.put(Pattern.compile("--"), "--");
        FORBIDDEN.put(Pattern.compile("/\\*"), "/*");
        FORBIDDEN.put(Pattern.compile("#"), "#");
    }

    // Identifier directly followed by an opening parenthesis
    private static final Pattern FUNCTION_CALL = Pattern.compile("([\\w$]+)\\s*\\(");

    // The call-site scan also picks these up in expressions like "NOT (a OR b)"
    private static final Set<String> LOGICAL_OPERATORS = Set.of("AND", "OR", "NOT");

    private final Set<String> allowedFunctions;

    public QueryTokenGuard(Collection<String> allowedFunctions) {
        Set<String> allowed = new HashSet<>(LOGICAL_OPERATORS);
        for (String function : allowedFunctions) {
            allowed.add(function.trim().toUpperCase(Locale.ROOT));
        }
        this.allowedFunctions = Collections.unmodifiableSet(allowed);
    }

    public Set<String> getAllowedFunctions() {
        return allowedFunctions;
    }

    /**
     * Collect every violation in the query parameters
     */
    public ValidationResult validate(QuerySpec spec) {
        ValidationResult result = new ValidationResult();

        String decodedWhere = HtmlUtils.htmlUnescape(spec.getWhere());
        for (Map.Entry<Pattern, String> entry : WHERE_ONLY.entrySet()) {
            if (entry.getKey().matcher(decodedWhere).find()) {
                result.addError("Error in \"where\" parameter: the string \"" + entry.getValue()
                        + "\" cannot be used within a query.");
            }
        }

        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("tables", spec.getTables());
        parameters.put("fields", SqlTokenizer.removeQuotedStrings(spec.getFields()));
        parameters.put("where", SqlTokenizer.removeQuotedStrings(spec.getWhere()));
        parameters.put("decoded where", SqlTokenizer.removeQuotedStrings(decodedWhere));
        parameters.put("join on", SqlTokenizer.removeQuotedStrings(spec.getJoinOn()));
        parameters.put("group by", SqlTokenizer.removeQuotedStrings(spec.getGroupBy()));
        parameters.put("having", SqlTokenizer.removeQuotedStrings(spec.getHaving()));
        parameters.put("order by", SqlTokenizer.removeQuotedStrings(spec.getOrderBy()));
        parameters.put("limit", spec.getLimit());

        for (Map.Entry<Pattern, String> entry : FORBIDDEN.entrySet()) {
            for (String value : parameters.values()) {
                if (entry.getKey().matcher(value).find()) {
                    result.addError("Error: the string \"" + entry.getValue() + "\" cannot be used within a query.");
                    break;
                }
            }
        }

        List<String> callSites = new ArrayList<>();
        callSites.add(parameters.get("decoded where"));
        callSites.add(parameters.get("join on"));
        callSites.add(parameters.get("group by"));
        callSites.add(parameters.get("having"));
        callSites.add(parameters.get("order by"));
        callSites.add(spec.getLimit());
        for (String value : callSites) {
            for (String function : findFunctionCalls(value)) {
                if (!allowedFunctions.contains(function)) {
                    result.addError(disallowedFunctionMessage(function));
                }
            }
        }

        return result;
    }

    /**
     * Validate and throw on the first failure
     *
     * @throws SecurityViolationException listing every violation found
     */
    public void check(QuerySpec spec) {
        ValidationResult result = validate(spec);
        if (result.hasErrors()) {
            log.warn("Rejected query parameters: {}", result.getErrors());
            throw new SecurityViolationException(result.getErrorMessage());
        }
    }

    /**
     * Upper-cased names of the functions called in the text, in order of appearance,
     * each checked against the whitelist. Quoted literals must already be removed.
     *
     * @throws SecurityViolationException for the first function that is not allowed
     */
    public List<String> getAndValidateSqlFunctions(String str) {
        List<String> functions = findFunctionCalls(str);
        for (String function : functions) {
            if (!allowedFunctions.contains(function)) {
                throw new SecurityViolationException(disallowedFunctionMessage(function));
            }
        }
        return functions;
    }

    static List<String> findFunctionCalls(String str) {
        List<String> functions = new ArrayList<>();
        if (str == null || str.isEmpty()) {
            return functions;
        }
        Matcher matcher = FUNCTION_CALL.matcher(str);
        while (matcher.find()) {
            String name = matcher.group(1);
            // Numbers before a parenthesis are not calls
            if (!Character.isDigit(name.charAt(0))) {
                functions.add(name.toUpperCase(Locale.ROOT));
            }
        }
        return functions;
    }

    private static String disallowedFunctionMessage(String function) {
        return "Error: the SQL function \"" + function + "()\" is not allowed.";
    }
}
