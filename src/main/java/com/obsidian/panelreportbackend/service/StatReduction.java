package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.dto.PanelResult;
import com.obsidian.panelreportbackend.model.FieldSchema;
import com.obsidian.panelreportbackend.model.Frame;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/*
 * 描述: stat 面板把第一个帧归约为单个 TOTAL 的规则。
 *       按声明顺序依次尝试，第一个 matches 的规则生效；NUMERIC_SUM 兜底，保证 stat 面板一定有总数。
 *
 *       注意: 前两条规则只根据字段名判断，如果某个字段恰好叫 "Count" 但不是计数指标，
 *       得到的总数没有实际意义。为了与现有报告保持一致，仍保留这个顺序。
 */
public enum StatReduction {

    /*
     * terms 聚合: 存在 "Count" 列时对该列求和。
     */
    COUNT_COLUMN {
        @Override
        boolean matches(Frame frame) {
            return frame.indexOfField(COUNT) >= 0;
        }

        @Override
        List<?> operands(Frame frame) {
            return frame.column(frame.indexOfField(COUNT));
        }

        @Override
        String summary(Number total) {
            return "Sum of Count column = " + total;
        }
    },

    /*
     * date_histogram + count 指标: 只有 Time 和 Value/Count 两列。
     */
    COUNT_HISTOGRAM {
        @Override
        boolean matches(Frame frame) {
            List<FieldSchema> fields = frame.getFields();
            if (fields.size() != 2) {
                return false;
            }
            FieldSchema valueField = fields.get(1);
            String displayName = valueField.getDisplayNameFromDS() == null
                    ? "" : valueField.getDisplayNameFromDS().toLowerCase(Locale.ROOT);
            return "Time".equals(fields.get(0).getName())
                    && (VALUE.equals(valueField.getName()) || COUNT.equals(valueField.getName()))
                    && displayName.startsWith("count");
        }

        @Override
        List<?> operands(Frame frame) {
            return frame.column(1);
        }

        @Override
        String summary(Number total) {
            return "Event count across time buckets = " + total;
        }
    },

    NUMERIC_SUM {
        @Override
        boolean matches(Frame frame) {
            return true;
        }

        @Override
        List<?> operands(Frame frame) {
            List<Object> all = new ArrayList<>();
            for (int i = 0; i < frame.getValues().size(); i++) {
                all.addAll(frame.column(i));
            }
            return all;
        }

        @Override
        String summary(Number total) {
            return "Total=" + total;
        }
    };

    public static final String TOTAL_FIELD = "TOTAL";

    private static final String COUNT = "Count";
    private static final String VALUE = "Value";

    abstract boolean matches(Frame frame);

    abstract List<?> operands(Frame frame);

    abstract String summary(Number total);

    public PanelResult apply(Frame frame) {
        Number total = sum(operands(frame));
        return totalResult(total, summary(total));
    }

    /*
     * 依次尝试所有规则，返回第一个匹配规则的结果。
     */
    public static PanelResult reduce(Frame frame) {
        for (StatReduction rule : values()) {
            if (rule.matches(frame)) {
                return rule.apply(frame);
            }
        }
        throw new IllegalStateException("NUMERIC_SUM always matches");
    }

    public static PanelResult empty() {
        return totalResult(0L, NUMERIC_SUM.summary(0L));
    }

    private static PanelResult totalResult(Number total, String summary) {
        List<List<Object>> rows = new ArrayList<>();
        List<Object> row = new ArrayList<>();
        row.add(total);
        rows.add(row);
        return new PanelResult(new ArrayList<>(List.of(TOTAL_FIELD)), rows, summary);
    }

    /*
     * 只累加数值；全部是整数时返回 Long，超出 long 范围时返回 BigInteger，出现浮点数时返回 Double。
     */
    static Number sum(List<?> values) {
        BigInteger integral = BigInteger.ZERO;
        double fractional = 0d;
        boolean sawFloating = false;
        for (Object value : values) {
            if (!(value instanceof Number)) {
                continue;
            }
            if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
                fractional += ((Number) value).doubleValue();
                sawFloating = true;
            } else if (value instanceof BigInteger) {
                integral = integral.add((BigInteger) value);
            } else {
                integral = integral.add(BigInteger.valueOf(((Number) value).longValue()));
            }
        }
        if (sawFloating) {
            return integral.doubleValue() + fractional;
        }
        if (integral.bitLength() < Long.SIZE) {
            return integral.longValue();
        }
        return integral;
    }
}
