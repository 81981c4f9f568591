package com.yuzhi.sqlguard.platform.service.sql;

/**
 * Token index layout of one {@code SELECT} block. A set-operation branch, a CTE body and a subquery outside the
 * FROM clause each count as their own block.
 *
 * @param selectIndex index of the SELECT keyword
 * @param fromIndex index of the block's FROM keyword, or -1
 * @param whereIndex index of the block's WHERE keyword, or -1
 * @param regionEnd exclusive end of the FROM/WHERE region: the first trailing clause keyword or {@code endIndex}
 * @param endIndex exclusive end of the block
 * @param depth parenthesis depth of the block's own tokens
 */
public record QueryBlock(int selectIndex, int fromIndex, int whereIndex, int regionEnd, int endIndex, int depth) {

    public boolean hasFrom() {
        return fromIndex >= 0;
    }

    public boolean hasWhere() {
        return whereIndex >= 0;
    }
}
