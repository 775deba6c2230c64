package norswap.logiceval.ast;

import norswap.logiceval.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class InferNode extends StatementNode
{
    public final List<String> rules;

    public InferNode (Position position, List<String> rules) {
        super(position);
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    @Override public <R> R accept (StatementVisitor<R> visitor) {
        return visitor.visitInfer(this);
    }

    @Override public String contents () {
        return "infer " + String.join(", ", rules) + ";";
    }
}
