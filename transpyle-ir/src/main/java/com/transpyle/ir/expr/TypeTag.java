package com.transpyle.ir.expr;

/**
 * IR 表达式携带的粗粒度类型标签。具体的目标语言类型由后端决定。
 */
public enum TypeTag {
    INT("int"),
    DOUBLE("double"),
    STRING("string"),
    BOOL("bool"),
    /** 变量引用，类型需查询声明作用域 */
    VAR("var"),
    /** 运算结果，类型未推断 */
    AUTO("auto");

    private final String name;

    TypeTag(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
