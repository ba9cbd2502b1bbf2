package io.leavesfly.vshell.command.sed;

import java.util.regex.Pattern;

/**
 * sed 地址：行号、'$'（末行）、/regex/，或两个地址组成的范围
 * <p>
 * 范围匹配：行号到行号为闭区间，行号到 '$' 为从第 N 行到末尾；
 * 其余组合（含正则）只分别测试两个端点，不跟踪"是否处于范围内"的状态。
 */
public abstract class SedAddress {

    /**
     * @param lineNumber 当前行号（从 1 开始）
     * @param totalLines 总行数
     * @param line       当前行内容
     */
    public abstract boolean matches(int lineNumber, int totalLines, String line);

    public static SedAddress line(int number) {
        return new Line(number);
    }

    public static SedAddress last() {
        return new Last();
    }

    public static SedAddress regex(Pattern pattern) {
        return new Regex(pattern);
    }

    public static SedAddress range(SedAddress start, SedAddress end) {
        return new Range(start, end);
    }

    static final class Line extends SedAddress {
        final int number;

        Line(int number) {
            this.number = number;
        }

        @Override
        public boolean matches(int lineNumber, int totalLines, String line) {
            return lineNumber == number;
        }
    }

    static final class Last extends SedAddress {
        @Override
        public boolean matches(int lineNumber, int totalLines, String line) {
            return lineNumber == totalLines;
        }
    }

    static final class Regex extends SedAddress {
        final Pattern pattern;

        Regex(Pattern pattern) {
            this.pattern = pattern;
        }

        @Override
        public boolean matches(int lineNumber, int totalLines, String line) {
            return pattern.matcher(line).find();
        }
    }

    static final class Range extends SedAddress {
        final SedAddress start;
        final SedAddress end;

        Range(SedAddress start, SedAddress end) {
            this.start = start;
            this.end = end;
        }

        @Override
        public boolean matches(int lineNumber, int totalLines, String line) {
            if (start instanceof Line && end instanceof Line) {
                return lineNumber >= ((Line) start).number && lineNumber <= ((Line) end).number;
            }
            if (start instanceof Line && end instanceof Last) {
                return lineNumber >= ((Line) start).number;
            }
            return start.matches(lineNumber, totalLines, line) || end.matches(lineNumber, totalLines, line);
        }
    }
}
