package org.csu.bnfuzz.common.exception;

import org.csu.bnfuzz.common.model.Loc;

/**
 * 随机生成阶段的异常，会中止当前这一次生成。
 */
public class GenerationException extends DiagnosticException {

    public GenerationException(Loc loc, String message) {
        super(loc, message);
    }
}
