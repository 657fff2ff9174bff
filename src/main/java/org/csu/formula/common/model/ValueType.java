package org.csu.formula.common.model;

/**
 * 公式语言中值的类型标签。
 */
public enum ValueType {
    NUMBER,     // Long 或 Double
    TEXT,
    BOOLEAN,
    NULL,
    DATE,       // LocalDate
    TIME,       // LocalTime
    DATETIME,   // LocalDateTime
    SEQUENCE,   // List<Value>, 有序, 可嵌套
    LAZY;       // Supplier, 在读取变量时才求值

    public boolean isTemporal() {
        return this == DATE || this == TIME || this == DATETIME;
    }
}
