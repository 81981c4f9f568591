package com.yuzhi.sqlguard.platform.service.sql;

public enum SqlTokenType {
    WORD,
    QUOTED_IDENTIFIER,
    STRING,
    NUMBER,
    PARAMETER,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    DOT,
    SEMICOLON,
    OPERATOR,
}
