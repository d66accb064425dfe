package com.snupl.compiler.formatter;

/**
 * SnuPL 字符串转义/反转义工具
 */
public final class SnuplStringUtils {

    private SnuplStringUtils() {}

    /**
     * 反转义：将转义字符标识符转为实际字符。
     * <p>给定反斜杠后面的字符（如 'n'），返回对应的实际字符（如 '\n'）。</p>
     *
     * @return 反转义后的字符，未识别的转义返回 -1
     */
    public static int unescapeChar(char c) {
        switch (c) {
            case 'n':  return '\n';
            case 't':  return '\t';
            case '0':  return '\0';
            case '\\': return '\\';
            case '\'': return '\'';
            case '"':  return '"';
            default:   return -1;
        }
    }

    /**
     * 反转义整个字符串，未识别的转义序列原样保留反斜杠后的字符。
     */
    public static String unescape(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char next = s.charAt(++i);
                int r = unescapeChar(next);
                sb.append(r >= 0 ? (char) r : next);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** 转义字符串内容（用于双引号包裹的字符串） */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /** 转义单个字符（用于单引号包裹的字符字面量） */
    public static String escapeChar(char c) {
        switch (c) {
            case '\\': return "\\\\";
            case '\'': return "\\'";
            case '\n': return "\\n";
            case '\t': return "\\t";
            case '\0': return "\\0";
            default: return String.valueOf(c);
        }
    }
}
