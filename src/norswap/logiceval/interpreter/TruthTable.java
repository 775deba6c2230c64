package norswap.logiceval.interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The value of an expression for every assignment to its free variables.
 *
 * <p>Columns are the variables sorted by name. Rows come in ascending binary order, the first
 * column being the most significant bit.
 */
public final class TruthTable
{
    public final List<String> variables;
    private final List<boolean[]> assignments = new ArrayList<>();
    private final List<Boolean> results = new ArrayList<>();

    TruthTable (List<String> variables) {
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
    }

    void add (boolean[] assignment, boolean result) {
        assignments.add(assignment.clone());
        results.add(result);
    }

    // ---------------------------------------------------------------------------------------------

    public int rowCount () {
        return results.size();
    }

    /** Value of each variable in the row, in column order. */
    public boolean[] assignment (int row) {
        return assignments.get(row).clone();
    }

    public boolean result (int row) {
        return results.get(row);
    }

    // ---------------------------------------------------------------------------------------------

    public String header ()
    {
        List<String> columns = new ArrayList<>(variables);
        columns.add("Result");
        return String.join(" | ", columns);
    }

    public String row (int row)
    {
        StringBuilder b = new StringBuilder();
        for (boolean value : assignments.get(row))
            b.append(value ? '1' : '0').append(" | ");
        return b.append(results.get(row) ? '1' : '0').toString();
    }

    /** Header, a dash rule as wide as the header, then one line per row. */
    public List<String> lines ()
    {
        List<String> lines = new ArrayList<>(rowCount() + 2);
        String header = header();
        lines.add(header);
        lines.add("-".repeat(header.length()));
        for (int i = 0; i < rowCount(); ++i)
            lines.add(row(i));
        return lines;
    }
}
