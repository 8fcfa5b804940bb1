package com.obsidian.panelreportbackend.service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/*
 * 描述: 把毫秒级时间戳格式化为 "yyyy-MM-dd HH:mm:ss"。
 *       大于 10^12 的数值视为毫秒时间戳，其他值原样返回。
 */
public class TimestampFormatter {

    static final long EPOCH_MILLIS_THRESHOLD = 1_000_000_000_000L;

    // 2^63，double 能精确表示
    private static final double LONG_RANGE_LIMIT = 0x1p63;

    private static final String PATTERN = "yyyy-MM-dd HH:mm:ss";

    private final DateTimeFormatter formatter;

    public TimestampFormatter(ZoneId zone) {
        this.formatter = DateTimeFormatter.ofPattern(PATTERN).withZone(zone);
    }

    public Object format(Object value) {
        if (!(value instanceof Number)) {
            return value;
        }
        Number number = (Number) value;
        if (!(number.doubleValue() > EPOCH_MILLIS_THRESHOLD)) {
            return value;
        }
        Long millis = toEpochMillis(number);
        if (millis == null) {
            return value;
        }
        try {
            return formatter.format(Instant.ofEpochMilli(millis));
        } catch (DateTimeException ex) {
            // 超出可格式化的年份范围
            return value;
        }
    }

    /*
     * 超出 long 范围的数值返回 null，不能截断或饱和成一个错误的时间。
     */
    private static Long toEpochMillis(Number number) {
        if (number instanceof BigInteger || number instanceof BigDecimal) {
            BigInteger integral = number instanceof BigInteger
                    ? (BigInteger) number
                    : ((BigDecimal) number).toBigInteger();
            return integral.bitLength() < Long.SIZE ? integral.longValue() : null;
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            return d < LONG_RANGE_LIMIT ? (long) d : null;
        }
        return number.longValue();
    }
}
