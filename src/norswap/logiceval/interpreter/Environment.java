package norswap.logiceval.interpreter;

import norswap.logiceval.ir.CodeBlock;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The state an {@link Interpreter} runs against: variable values, rules with their code and
 * last value, the code of named expressions, and the code of the last unnamed expression.
 *
 * <p>An environment lives as long as a session and is never shared between sessions. It is
 * not thread-safe.
 */
public final class Environment
{
    // ---------------------------------------------------------------------------------------------

    private static final class Rule
    {
        final CodeBlock code;
        final boolean value;

        Rule (CodeBlock code, boolean value) {
            this.code = code;
            this.value = value;
        }
    }

    // ---------------------------------------------------------------------------------------------

    private final Map<String, Boolean> variables = new HashMap<>();
    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private final Map<String, CodeBlock> expressions = new HashMap<>();
    private CodeBlock lastExpression = null;

    // ==== VARIABLES ==============================================================================

    /** Value of a variable, or null if it was never bound or declared. */
    public Boolean variable (String name) {
        return variables.get(name);
    }

    public void setVariable (String name, boolean value) {
        variables.put(name, value);
    }

    /** Binds the variable to false unless it already has a value. */
    public void declare (String name) {
        variables.putIfAbsent(name, false);
    }

    /** A sorted snapshot of all variables. */
    public Map<String, Boolean> variables () {
        return Collections.unmodifiableMap(new TreeMap<>(variables));
    }

    // ==== RULES ==================================================================================

    public void defineRule (String name, CodeBlock code, boolean value) {
        rules.put(name, new Rule(code, value));
    }

    /** Last value computed for the rule, or null if it never ran. */
    public Boolean ruleValue (String name) {
        Rule rule = rules.get(name);
        return rule == null ? null : rule.value;
    }

    /** Names of the rules that ran, in definition order. */
    public Set<String> ruleNames () {
        return Collections.unmodifiableSet(rules.keySet());
    }

    // ==== STORED CODE ============================================================================

    public void storeExpression (String name, CodeBlock code) {
        expressions.put(name, code);
    }

    public void setLastExpression (CodeBlock code) {
        lastExpression = code;
    }

    /** Code of the last unnamed expression, or null if there was none. */
    public CodeBlock lastExpression () {
        return lastExpression;
    }

    /**
     * Code stored under a name: a named expression, else a rule. Null if neither exists.
     */
    public CodeBlock code (String name)
    {
        CodeBlock code = expressions.get(name);
        if (code != null) return code;
        Rule rule = rules.get(name);
        return rule == null ? null : rule.code;
    }
}
