package com.transpyle.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.transpyle.ir.Transpiler;
import com.transpyle.ir.inst.IrProgram;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IR JSON 导出测试
 */
class IrJsonWriterTest {

    private final Transpiler transpiler = new Transpiler();
    private final IrJsonWriter writer = new IrJsonWriter();

    private JsonArray dump(String source) {
        return writer.write(transpiler.parse(source));
    }

    @Test
    @DisplayName("赋值记录名称、值与类型")
    void testAssign() {
        JsonArray ir = dump("pi = 3.5\nok = True\n");
        JsonObject pi = ir.get(0).getAsJsonObject();
        assertEquals("ASSIGN", pi.get("action").getAsString());
        assertEquals("pi", pi.get("name").getAsString());
        assertEquals("3.5", pi.get("value").getAsString());
        assertEquals("double", pi.get("type").getAsString());
        JsonObject ok = ir.get(1).getAsJsonObject();
        assertEquals("true", ok.get("value").getAsString());
        assertEquals("bool", ok.get("type").getAsString());
    }

    @Test
    @DisplayName("if / else 的分支与条件")
    void testIf() {
        JsonObject stmt = dump("if x >= 2:\n    print(x)\nelse:\n    x = 0\n").get(0).getAsJsonObject();
        assertEquals("IF", stmt.get("action").getAsString());
        assertEquals("x >= 2", stmt.get("condition").getAsString());
        assertEquals(1, stmt.getAsJsonArray("body").size());
        JsonObject elseAssign = stmt.getAsJsonArray("else_body").get(0).getAsJsonObject();
        assertEquals("ASSIGN", elseAssign.get("action").getAsString());
    }

    @Test
    @DisplayName("没有 else 时 else_body 为空数组")
    void testWhileAndEmptyElse() {
        JsonArray ir = dump("while n < 3:\n    n = n + 1\nif n == 3:\n    pass\n");
        JsonObject loop = ir.get(0).getAsJsonObject();
        assertEquals("WHILE", loop.get("action").getAsString());
        assertEquals("n < 3", loop.get("condition").getAsString());
        assertEquals("n + 1", loop.getAsJsonArray("body").get(0).getAsJsonObject().get("value").getAsString());
        assertEquals(0, ir.get(1).getAsJsonObject().getAsJsonArray("else_body").size());
    }

    @Test
    @DisplayName("语法错误导出为单条 COMMENT")
    void testComment() {
        JsonArray ir = dump("def (:\n");
        assertEquals(1, ir.size());
        JsonObject comment = ir.get(0).getAsJsonObject();
        assertEquals("COMMENT", comment.get("action").getAsString());
        assertTrue(comment.get("text").getAsString().startsWith("Error: "));
    }

    @Test
    @DisplayName("toJson 输出可被重新解析")
    void testToJson() {
        IrProgram program = transpiler.parse("print(\"<a>\", 1)\n");
        JsonArray parsed = JsonParser.parseString(writer.toJson(program)).getAsJsonArray();
        JsonArray parts = parsed.get(0).getAsJsonObject().getAsJsonArray("parts");
        assertEquals("\"<a>\"", parts.get(0).getAsJsonObject().get("val").getAsString());
        assertEquals("var", parts.get(1).getAsJsonObject().get("type").getAsString());
    }
}
