package com.transpyle.compiler.ast.decl;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 导入声明：{@code import a.b as c} 或 {@code from ..a import b as c}
 */
public class ImportDecl extends Declaration {
    private final boolean fromImport;
    private final int level;            // from 导入的前导点数
    private final List<Alias> names;    // 通配导入时为空
    private final boolean wildcard;

    public ImportDecl(SourceLocation location, String module, boolean fromImport, int level,
                      List<Alias> names, boolean wildcard) {
        super(location, module);
        this.fromImport = fromImport;
        this.level = level;
        this.names = names;
        this.wildcard = wildcard;
    }

    /**
     * from 导入的模块名；普通 import 时为 null
     */
    public String getModule() {
        return name;
    }

    public boolean isFromImport() {
        return fromImport;
    }

    public int getLevel() {
        return level;
    }

    public List<Alias> getNames() {
        return names;
    }

    public boolean isWildcard() {
        return wildcard;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportDecl(this, context);
    }

    public static final class Alias {
        private final String name;
        private final String asName;  // 可选

        public Alias(String name, String asName) {
            this.name = name;
            this.asName = asName;
        }

        public String getName() {
            return name;
        }

        public String getAsName() {
            return asName;
        }
    }
}
