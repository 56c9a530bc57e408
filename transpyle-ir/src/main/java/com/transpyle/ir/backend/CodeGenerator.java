package com.transpyle.ir.backend;

import com.transpyle.ir.expr.TypeTag;
import com.transpyle.ir.inst.*;

import java.util.List;

/**
 * IR → 目标语言源码生成器。
 *
 * <p>每次 {@link #generate} 调用使用新的 {@link EmitContext}，声明状态不会跨调用残留。</p>
 */
public class CodeGenerator implements InstructionVisitor<Void, EmitContext> {

    private final GeneratorConfig config;

    public CodeGenerator() {
        this(new GeneratorConfig());
    }

    public CodeGenerator(GeneratorConfig config) {
        this.config = config;
    }

    /**
     * 生成完整程序文本，行间以 \n 连接，末尾无换行
     */
    public String generate(IrProgram program, TargetLanguage target) {
        Backend backend = Backend.forTarget(target);
        EmitContext ctx = new EmitContext(config, backend);
        String unit = config.getIndentString();

        ctx.raw(backend.header(unit));
        ctx.setIndentLevel(backend.bodyDepth());
        emitBlock(program.getInstructions(), ctx);
        ctx.setIndentLevel(0);
        ctx.raw(backend.footer(unit));
        return ctx.getOutput();
    }

    private void emitBlock(List<Instruction> block, EmitContext ctx) {
        for (Instruction inst : block) {
            inst.accept(this, ctx);
        }
    }

    /**
     * 缩进一层并在新作用域中生成语句块
     */
    private void emitNested(List<Instruction> block, EmitContext ctx) {
        ctx.indent();
        ctx.getScope().enter();
        emitBlock(block, ctx);
        ctx.getScope().exit();
        ctx.dedent();
    }

    @Override
    public Void visitAssign(IrAssign node, EmitContext ctx) {
        Backend backend = ctx.getBackend();
        DeclarationScope scope = ctx.getScope();
        String value = backend.render(node.getValue());
        if (scope.isDeclared(node.getName())) {
            ctx.line(node.getName() + " = " + value + ";");
        } else {
            scope.declare(node.getName(), node.getTypeTag());
            ctx.line(backend.declarationType(node.getTypeTag()) + " " + node.getName() + " = " + value + ";");
        }
        return null;
    }

    @Override
    public Void visitPrint(IrPrint node, EmitContext ctx) {
        ctx.line(ctx.getBackend().printStatement(node.getParts(), ctx.getScope()));
        return null;
    }

    @Override
    public Void visitIf(IrIf node, EmitContext ctx) {
        ctx.line("if (" + ctx.getBackend().render(node.getCondition()) + ") {");
        emitNested(node.getThenBlock(), ctx);
        if (node.hasElse()) {
            ctx.line("} else {");
            emitNested(node.getElseBlock(), ctx);
        }
        ctx.line("}");
        return null;
    }

    @Override
    public Void visitWhile(IrWhile node, EmitContext ctx) {
        ctx.line("while (" + ctx.getBackend().render(node.getCondition()) + ") {");
        emitNested(node.getBody(), ctx);
        ctx.line("}");
        return null;
    }

    /**
     * 循环变量在循环自身的作用域中声明为 int
     */
    @Override
    public Void visitFor(IrFor node, EmitContext ctx) {
        Backend backend = ctx.getBackend();
        DeclarationScope scope = ctx.getScope();
        ctx.line(backend.forHeader(node.getLoopVariable(), backend.render(node.getLimit())));
        ctx.indent();
        scope.enter();
        scope.declare(node.getLoopVariable(), TypeTag.INT);
        emitBlock(node.getBody(), ctx);
        scope.exit();
        ctx.dedent();
        ctx.line("}");
        return null;
    }

    @Override
    public Void visitComment(IrComment node, EmitContext ctx) {
        ctx.line(ctx.getBackend().comment(node.getText()));
        return null;
    }
}
