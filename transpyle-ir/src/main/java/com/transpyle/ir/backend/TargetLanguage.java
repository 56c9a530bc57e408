package com.transpyle.ir.backend;

/**
 * 代码生成目标语言
 */
public enum TargetLanguage {
    C("c"),
    CPP("cpp"),
    JAVA("java");

    private final String name;

    TargetLanguage(String name) {
        this.name = name;
    }

    /**
     * 目标选择器名称（c / cpp / java）
     */
    public String getName() {
        return name;
    }

    /**
     * 按名称解析目标语言，忽略大小写
     *
     * @throws UnsupportedTargetException 名称为空或未知
     */
    public static TargetLanguage fromName(String name) {
        if (name != null) {
            String trimmed = name.trim();
            for (TargetLanguage target : values()) {
                if (target.name.equalsIgnoreCase(trimmed)) {
                    return target;
                }
            }
        }
        throw new UnsupportedTargetException(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
