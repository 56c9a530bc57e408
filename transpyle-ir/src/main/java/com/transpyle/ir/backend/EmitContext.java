package com.transpyle.ir.backend;

import java.util.ArrayList;
import java.util.List;

/**
 * 代码生成上下文，跟踪输出行、缩进层级与声明作用域
 */
public class EmitContext {
    private final List<String> lines = new ArrayList<>();
    private final GeneratorConfig config;
    private final Backend backend;
    private final DeclarationScope scope;
    private int indentLevel = 0;

    public EmitContext(GeneratorConfig config, Backend backend) {
        this.config = config;
        this.backend = backend;
        this.scope = new DeclarationScope(config.getScopingMode());
    }

    public Backend getBackend() {
        return backend;
    }

    public DeclarationScope getScope() {
        return scope;
    }

    public void setIndentLevel(int indentLevel) {
        this.indentLevel = indentLevel;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加一行（按当前层级缩进）
     */
    public void line(String text) {
        lines.add(indentString() + text);
    }

    /**
     * 原样追加多行
     */
    public void raw(List<String> text) {
        lines.addAll(text);
    }

    /**
     * 以换行拼接的输出，末尾无换行
     */
    public String getOutput() {
        return String.join("\n", lines);
    }

    private String indentString() {
        String unit = config.getIndentString();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(unit);
        }
        return sb.toString();
    }
}
