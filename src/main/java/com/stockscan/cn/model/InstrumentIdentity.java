package com.stockscan.cn.model;

import java.util.Locale;

/**
 * 模块说明：InstrumentIdentity（class）。
 * 主要职责：保存补零后的 6 位证券代码与展示名称。
 */
public final class InstrumentIdentity {
    public static final int CODE_WIDTH = 6;

    public final String code;
    public final String name;

    public InstrumentIdentity(String code, String name) {
        this.code = padCode(code);
        this.name = name == null ? "" : name;
    }

/**
 * 方法说明：padCode，负责把文件名或名称表中的代码统一为 6 位左补零格式。
 * 处理流程：先去除首尾空白，已达到宽度的代码原样返回。
 */
    public static String padCode(String raw) {
        String code = raw == null ? "" : raw.trim();
        if (code.length() >= CODE_WIDTH) {
            return code;
        }
        return "0".repeat(CODE_WIDTH - code.length()) + code;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s(%s)", code, name);
    }
}
