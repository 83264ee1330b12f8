package org.csu.bnfuzz.common.model;

/**
 * 源码位置。row 与 column 均从 0 开始存储，展示时按 1 开始。
 *
 * @param file   语法文件路径
 * @param row    行号 (从 0 开始)
 * @param column 列号 (按码点计, 从 0 开始)
 */
public record Loc(String file, int row, int column) {

    @Override
    public String toString() {
        return String.format("%s:%d:%d", file, row + 1, column + 1);
    }
}
