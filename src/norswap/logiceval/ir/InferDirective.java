package norswap.logiceval.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code INFER name...}
 */
public final class InferDirective extends Instruction
{
    public final List<String> rules;

    public InferDirective (List<String> rules) {
        if (rules.isEmpty()) throw new IllegalArgumentException("INFER needs at least one rule");
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    @Override public boolean isDirective () {
        return true;
    }

    @Override public <R> R accept (InstructionVisitor<R> visitor) {
        return visitor.visitInfer(this);
    }

    @Override public String toString () {
        return "INFER " + String.join(" ", rules);
    }
}
