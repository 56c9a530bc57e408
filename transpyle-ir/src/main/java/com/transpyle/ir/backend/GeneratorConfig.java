package com.transpyle.ir.backend;

/**
 * 代码生成配置
 */
public class GeneratorConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;
    private ScopingMode scopingMode = ScopingMode.BLOCK;

    public GeneratorConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("Indent size must not be negative: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    public ScopingMode getScopingMode() {
        return scopingMode;
    }

    public void setScopingMode(ScopingMode scopingMode) {
        this.scopingMode = scopingMode;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
