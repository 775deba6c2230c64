package norswap.logiceval.ir;

public interface InstructionVisitor<R>
{
    R visitBinary (BinaryInstruction insn);
    R visitUnary (UnaryInstruction insn);
    R visitCopy (CopyInstruction insn);
    R visitTable (TableDirective insn);
    R visitEval (EvalDirective insn);
    R visitInfer (InferDirective insn);
}
