package com.transpyle.ir.backend;

import com.transpyle.ir.expr.TypeTag;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * 代码生成期间的已声明变量表。
 *
 * <p>BLOCK 模式下为作用域栈，查找由内向外；FLAT 模式下 enter/exit 不起作用，
 * 所有声明进入同一张表。</p>
 */
public class DeclarationScope {
    private final ScopingMode mode;
    private final Deque<Map<String, TypeTag>> frames = new ArrayDeque<>();

    public DeclarationScope(ScopingMode mode) {
        this.mode = mode;
        frames.push(new HashMap<String, TypeTag>());
    }

    public void enter() {
        if (mode == ScopingMode.BLOCK) {
            frames.push(new HashMap<String, TypeTag>());
        }
    }

    public void exit() {
        if (mode == ScopingMode.BLOCK) {
            if (frames.size() == 1) {
                throw new IllegalStateException("Cannot exit the outermost scope");
            }
            frames.pop();
        }
    }

    /**
     * 在当前（最内层）作用域声明变量
     */
    public void declare(String name, TypeTag type) {
        frames.peek().put(name, type);
    }

    public boolean isDeclared(String name) {
        return lookup(name) != null;
    }

    /**
     * 查找可见的声明类型，未声明时返回 null
     */
    public TypeTag lookup(String name) {
        for (Map<String, TypeTag> frame : frames) {
            TypeTag type = frame.get(name);
            if (type != null) {
                return type;
            }
        }
        return null;
    }

    public int depth() {
        return frames.size();
    }
}
