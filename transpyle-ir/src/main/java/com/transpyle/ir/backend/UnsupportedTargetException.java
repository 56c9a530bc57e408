package com.transpyle.ir.backend;

import com.transpyle.compiler.TranspyleException;

/**
 * 未知的目标语言选择器
 */
public class UnsupportedTargetException extends TranspyleException {
    private final String requested;

    public UnsupportedTargetException(String requested) {
        super("Unsupported target language: " + (requested == null ? "<none>" : "'" + requested + "'")
                + " (expected one of c, cpp, java)");
        this.requested = requested;
    }

    public String getRequested() {
        return requested;
    }
}
