package com.transpyle.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.transpyle.ir.expr.IrExpr;
import com.transpyle.ir.expr.IrExprPrinter;
import com.transpyle.ir.inst.*;

import java.util.List;

/**
 * IR → JSON。
 *
 * <p>每条指令一个对象，以 action 区分种类；表达式按与目标无关的形式渲染成文本。</p>
 */
public class IrJsonWriter implements InstructionVisitor<JsonObject, Void> {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public String toJson(IrProgram program) {
        return gson.toJson(write(program));
    }

    public JsonArray write(IrProgram program) {
        return writeBlock(program.getInstructions());
    }

    private JsonArray writeBlock(List<Instruction> block) {
        JsonArray array = new JsonArray();
        for (Instruction inst : block) {
            array.add(inst.accept(this, null));
        }
        return array;
    }

    private static JsonObject action(String name) {
        JsonObject obj = new JsonObject();
        obj.addProperty("action", name);
        return obj;
    }

    private static String text(IrExpr expr) {
        return IrExprPrinter.NEUTRAL.print(expr);
    }

    @Override
    public JsonObject visitAssign(IrAssign node, Void ctx) {
        JsonObject obj = action("ASSIGN");
        obj.addProperty("name", node.getName());
        obj.addProperty("value", text(node.getValue()));
        obj.addProperty("type", node.getTypeTag().getName());
        return obj;
    }

    @Override
    public JsonObject visitPrint(IrPrint node, Void ctx) {
        JsonObject obj = action("PRINT");
        JsonArray parts = new JsonArray();
        for (IrPrintPart part : node.getParts()) {
            JsonObject p = new JsonObject();
            p.addProperty("val", text(part.getValue()));
            p.addProperty("type", part.isLiteralString() ? "string" : "var");
            parts.add(p);
        }
        obj.add("parts", parts);
        return obj;
    }

    @Override
    public JsonObject visitIf(IrIf node, Void ctx) {
        JsonObject obj = action("IF");
        obj.addProperty("condition", text(node.getCondition()));
        obj.add("body", writeBlock(node.getThenBlock()));
        obj.add("else_body", writeBlock(node.getElseBlock()));
        return obj;
    }

    @Override
    public JsonObject visitWhile(IrWhile node, Void ctx) {
        JsonObject obj = action("WHILE");
        obj.addProperty("condition", text(node.getCondition()));
        obj.add("body", writeBlock(node.getBody()));
        return obj;
    }

    @Override
    public JsonObject visitFor(IrFor node, Void ctx) {
        JsonObject obj = action("FOR");
        obj.addProperty("var", node.getLoopVariable());
        obj.addProperty("limit", text(node.getLimit()));
        obj.add("body", writeBlock(node.getBody()));
        return obj;
    }

    @Override
    public JsonObject visitComment(IrComment node, Void ctx) {
        JsonObject obj = action("COMMENT");
        obj.addProperty("text", node.getText());
        return obj;
    }
}
