package org.csu.bnfuzz.common.model;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 诊断信息，附带源码位置。
 *
 * 词法、语法、语义和生成阶段的错误都以它为载体；notes 用于补充说明相关位置
 * (例如重复定义时指向最初的定义)。来自命令行而非语法文件的诊断 loc 为 null。
 */
public record Diagnostic(Level level, Loc loc, String message, List<Diagnostic> notes) {

    public enum Level {
        ERROR,
        NOTE
    }

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(Loc loc, String message) {
        return new Diagnostic(Level.ERROR, loc, message, List.of());
    }

    public static Diagnostic note(Loc loc, String message) {
        return new Diagnostic(Level.NOTE, loc, message, List.of());
    }

    public Diagnostic withNote(Loc noteLoc, String noteMessage) {
        List<Diagnostic> extended = new ArrayList<>(notes);
        extended.add(note(noteLoc, noteMessage));
        return new Diagnostic(level, loc, message, extended);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (loc != null) {
            sb.append(loc).append(": ");
        }
        sb.append(level).append(": ").append(message);
        for (Diagnostic note : notes) {
            sb.append(System.lineSeparator()).append(note);
        }
        return sb.toString();
    }
}
